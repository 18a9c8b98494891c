package com.bbthechange.tvguide.service;

/**
 * Result of adding or removing a tracked streamer.
 */
public enum StreamerManagementResult {
    SUCCESS,
    NOT_FOUND,
    ALREADY_EXISTS,
    ERROR
}
