package com.streammeta.metadata.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Cache configuration for the stream metadata service.
 * Uses Caffeine for high-performance in-memory caching.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String STREAM_SCHEMAS = "streamSchemas";

    @Bean
    public CacheManager cacheManager(StreamMetaConfig config) {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(STREAM_SCHEMAS);

        // entries are evicted explicitly on schema change and stream deletion
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(config.getCache().getSchemaMaxSize())
                .recordStats());

        return cacheManager;
    }
}
