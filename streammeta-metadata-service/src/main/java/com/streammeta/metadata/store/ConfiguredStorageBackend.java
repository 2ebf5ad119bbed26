package com.streammeta.metadata.store;

import com.streammeta.metadata.config.StreamMetaConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Storage backend as declared by {@code streammeta.storage.local-mode}
 */
@Component
@RequiredArgsConstructor
public class ConfiguredStorageBackend implements StorageBackend {

    private final StreamMetaConfig config;

    @Override
    public boolean isLocalDisk() {
        return config.getStorage().isLocalMode();
    }
}
