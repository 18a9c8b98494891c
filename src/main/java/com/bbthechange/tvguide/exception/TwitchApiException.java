package com.bbthechange.tvguide.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when Twitch API operations fail.
 * Maps to HTTP 502 (bad gateway), 503 (service unavailable) or 400 (bad request) based on error type.
 */
public class TwitchApiException extends RuntimeException {

    private final ErrorType errorType;

    public enum ErrorType {
        /**
         * Twitch rejected the app credentials.
         */
        AUTHENTICATION_FAILED(HttpStatus.BAD_GATEWAY),

        /**
         * Twitch API unavailable, rate limited past the retry budget, or returned garbage.
         */
        SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),

        /**
         * The request could not be built from the given input.
         */
        INVALID_REQUEST(HttpStatus.BAD_REQUEST);

        private final HttpStatus httpStatus;

        ErrorType(HttpStatus httpStatus) {
            this.httpStatus = httpStatus;
        }

        public HttpStatus getHttpStatus() {
            return httpStatus;
        }
    }

    public TwitchApiException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public TwitchApiException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public HttpStatus getHttpStatus() {
        return errorType.getHttpStatus();
    }

    public static TwitchApiException authenticationFailed(String message, Throwable cause) {
        return new TwitchApiException(ErrorType.AUTHENTICATION_FAILED, message, cause);
    }

    public static TwitchApiException serviceUnavailable(String message, Throwable cause) {
        return new TwitchApiException(ErrorType.SERVICE_UNAVAILABLE, message, cause);
    }

    public static TwitchApiException invalidRequest(String message) {
        return new TwitchApiException(ErrorType.INVALID_REQUEST, message);
    }
}
