package com.streammeta.common.exception;

/**
 * Exception thrown when an external subsystem call fails part way through a
 * multi-step operation. The stage names the step that could not be completed,
 * so an operator knows where a retry will resume doing real work.
 */
public class SubsystemFailureException extends StreamMetaException {

    private final String stage;
    private final String streamName;

    public SubsystemFailureException(String stage, String streamName, Throwable cause) {
        super(ErrorCode.SUBSYSTEM_FAILURE,
                String.format("failed to delete stream [%s] at stage %s: %s",
                        streamName, stage, cause.getMessage()),
                cause);
        this.stage = stage;
        this.streamName = streamName;
    }

    public String getStage() {
        return stage;
    }

    public String getStreamName() {
        return streamName;
    }
}
