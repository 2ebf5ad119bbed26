package com.streammeta.common.exception;

/**
 * Exception thrown when a stream, or its schema, does not exist
 */
public class StreamNotFoundException extends StreamMetaException {

    public StreamNotFoundException(String streamName) {
        super(ErrorCode.STREAM_NOT_FOUND, "stream not found: " + streamName);
    }
}
