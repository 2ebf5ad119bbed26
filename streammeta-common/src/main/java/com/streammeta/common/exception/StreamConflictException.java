package com.streammeta.common.exception;

/**
 * Exception thrown when a write targets a stream already marked for deletion
 */
public class StreamConflictException extends StreamMetaException {

    public StreamConflictException(String streamName) {
        super(ErrorCode.STREAM_BEING_DELETED, "stream [" + streamName + "] is being deleted");
    }
}
