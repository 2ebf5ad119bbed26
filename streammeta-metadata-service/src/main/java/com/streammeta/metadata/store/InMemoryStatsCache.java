package com.streammeta.metadata.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.streammeta.common.model.StreamStats;
import com.streammeta.common.model.StreamType;
import com.streammeta.metadata.config.StreamMetaConfig;
import org.springframework.stereotype.Component;

/**
 * Stats cache backed by a size-bounded Caffeine cache.
 * Callers always receive copies so the cached counters cannot be mutated through them.
 */
@Component
public class InMemoryStatsCache implements StatsCache {

    private final Cache<String, StreamStats> stats;

    public InMemoryStatsCache(StreamMetaConfig config) {
        this.stats = Caffeine.newBuilder()
                .maximumSize(config.getCache().getStatsMaxSize())
                .build();
    }

    @Override
    public StreamStats getStats(String orgId, String streamName, StreamType streamType) {
        StreamStats cached = stats.getIfPresent(StreamKeys.of(orgId, streamType, streamName));
        return cached == null ? new StreamStats() : cached.toBuilder().build();
    }

    @Override
    public void setStats(String orgId, String streamName, StreamType streamType, StreamStats value) {
        stats.put(StreamKeys.of(orgId, streamType, streamName), value.toBuilder().build());
    }

    @Override
    public void removeStats(String orgId, String streamName, StreamType streamType) {
        stats.invalidate(StreamKeys.of(orgId, streamType, streamName));
    }
}
