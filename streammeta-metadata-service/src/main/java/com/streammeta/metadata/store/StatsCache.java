package com.streammeta.metadata.store;

import com.streammeta.common.model.StreamStats;
import com.streammeta.common.model.StreamType;

/**
 * Raw usage counters maintained by ingestion
 */
public interface StatsCache {

    /**
     * Copy of the raw counters; the default value when nothing was recorded
     */
    StreamStats getStats(String orgId, String streamName, StreamType streamType);

    void setStats(String orgId, String streamName, StreamType streamType, StreamStats stats);

    void removeStats(String orgId, String streamName, StreamType streamType);
}
