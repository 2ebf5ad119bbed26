package com.streammeta.common.exception;

/**
 * Base exception for all stream metadata errors.
 * All custom exceptions should extend this base class.
 */
public class StreamMetaException extends RuntimeException {

    private final ErrorCode errorCode;

    public StreamMetaException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StreamMetaException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
