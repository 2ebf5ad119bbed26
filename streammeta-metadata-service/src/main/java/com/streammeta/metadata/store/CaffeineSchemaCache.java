package com.streammeta.metadata.store;

import com.streammeta.common.model.Schema;
import com.streammeta.common.model.StreamType;
import com.streammeta.metadata.config.CacheConfig;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Schema cache stored in the Caffeine-backed {@code streamSchemas} Spring cache
 */
@Component
public class CaffeineSchemaCache implements SchemaCache {

    private final Cache cache;

    public CaffeineSchemaCache(CacheManager cacheManager) {
        this.cache = Objects.requireNonNull(cacheManager.getCache(CacheConfig.STREAM_SCHEMAS),
                "cache " + CacheConfig.STREAM_SCHEMAS + " is not configured");
    }

    @Override
    public Optional<Schema> get(String orgId, StreamType streamType, String streamName) {
        return Optional.ofNullable(cache.get(StreamKeys.of(orgId, streamType, streamName), Schema.class));
    }

    @Override
    public void put(String orgId, StreamType streamType, String streamName, Schema schema) {
        cache.put(StreamKeys.of(orgId, streamType, streamName), schema);
    }

    @Override
    public void remove(String orgId, StreamType streamType, String streamName) {
        cache.evict(StreamKeys.of(orgId, streamType, streamName));
    }
}
