package com.streammeta.common.exception;

/**
 * Exception thrown when a schema carries a settings blob that is not a JSON object.
 */
public class MalformedSettingsException extends StreamMetaException {

    public MalformedSettingsException(String message) {
        super(ErrorCode.MALFORMED_SETTINGS, message);
    }

    public MalformedSettingsException(String message, Throwable cause) {
        super(ErrorCode.MALFORMED_SETTINGS, message, cause);
    }
}
