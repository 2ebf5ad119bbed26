package com.streammeta.metadata.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized configuration for the stream metadata service
 */
@Configuration
@ConfigurationProperties(prefix = "streammeta")
@Data
public class StreamMetaConfig {

    // ========== STORAGE CONFIGURATION ==========
    private StorageConfig storage = new StorageConfig();

    @Data
    public static class StorageConfig {
        /**
         * true when stream data lives on local disk, false for remote object storage
         */
        private boolean localMode = true;
    }

    // ========== CACHE CONFIGURATION ==========
    private CacheSizes cache = new CacheSizes();

    @Data
    public static class CacheSizes {
        private long schemaMaxSize = 10000;
        private long statsMaxSize = 10000;
    }
}
