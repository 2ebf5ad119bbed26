package com.streammeta.metadata.store;

import com.streammeta.common.model.StreamType;

/**
 * The compaction subsystem's registry of pending stream deletions and compaction offsets.
 * Every mutation is idempotent.
 */
public interface CompactionCoordinator {

    /**
     * Record the stream as pending deletion so compaction abandons it
     */
    void markPendingDelete(String orgId, String streamName, StreamType streamType);

    /**
     * Release the pending-deletion mark once the compactor has finished with the stream's data
     */
    void clearPendingDelete(String orgId, String streamName, StreamType streamType);

    boolean isPendingDelete(String orgId, String streamName, StreamType streamType);

    /**
     * Compaction checkpoint of the stream, 0 when none was recorded
     */
    long getOffset(String orgId, String streamName, StreamType streamType);

    void setOffset(String orgId, String streamName, StreamType streamType, long offset);

    void deleteOffset(String orgId, String streamName, StreamType streamType);
}
