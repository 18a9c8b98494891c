package com.bbthechange.tvguide.exception;

/**
 * Exception thrown when a Discord webhook call fails.
 * Carries the HTTP status so callers can tell a deleted message (404) from an outage.
 */
public class DiscordException extends RuntimeException {

    private final int statusCode;

    public DiscordException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public DiscordException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
