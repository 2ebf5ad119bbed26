package com.streammeta.common.exception;

/**
 * Error codes for categorizing stream metadata failures.
 * Error codes are organized by category:
 * - 1xxx: Expected, caller-facing outcomes
 * - 3xxx: Metadata and subsystem faults
 */
public enum ErrorCode {

    // Caller-facing outcomes (1xxx)
    STREAM_NOT_FOUND(1001, "Stream does not exist"),
    STREAM_BEING_DELETED(1002, "Stream is being deleted"),
    INVALID_REQUEST(1003, "Invalid request parameters"),

    // Metadata and subsystem faults (3xxx)
    MALFORMED_SETTINGS(3001, "Stream settings could not be parsed"),
    SUBSYSTEM_FAILURE(3002, "A subsystem call failed"),

    // Unknown errors
    UNKNOWN_ERROR(9999, "Unknown error occurred");

    private final int code;
    private final String message;

    ErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Expected outcomes are reported to the caller but are not faults.
     */
    public boolean isClientOutcome() {
        return code >= 1000 && code < 2000;
    }
}
