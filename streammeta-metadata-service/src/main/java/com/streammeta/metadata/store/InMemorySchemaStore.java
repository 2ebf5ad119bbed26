package com.streammeta.metadata.store;

import com.streammeta.common.model.Schema;
import com.streammeta.common.model.StreamLocation;
import com.streammeta.common.model.StreamType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Schema store kept in memory. Listing order is the key order {@code org/type/name}.
 */
@Slf4j
@Component
public class InMemorySchemaStore implements SchemaStore {

    private final ConcurrentSkipListMap<String, VersionedSchemas> schemas = new ConcurrentSkipListMap<>();

    @Override
    public Schema get(String orgId, String streamName, StreamType streamType) {
        VersionedSchemas entry = schemas.get(StreamKeys.of(orgId, streamType, streamName));
        if (entry == null) {
            return Schema.empty();
        }
        return entry.latest();
    }

    @Override
    public List<Schema> getVersions(String orgId, String streamName, StreamType streamType) {
        VersionedSchemas entry = schemas.get(StreamKeys.of(orgId, streamType, streamName));
        if (entry == null) {
            return Collections.emptyList();
        }
        return new ArrayList<>(entry.versions);
    }

    @Override
    public void set(String orgId, String streamName, StreamType streamType, Schema schema) {
        String key = StreamKeys.of(orgId, streamType, streamName);
        schemas.computeIfAbsent(key, k -> new VersionedSchemas(streamName, streamType))
                .versions.add(schema.withMetadata(schema.getMetadata()));
        log.debug("Stored schema version for {}", key);
    }

    @Override
    public void delete(String orgId, String streamName, StreamType streamType) {
        String key = StreamKeys.of(orgId, streamType, streamName);
        if (schemas.remove(key) != null) {
            log.debug("Deleted all schema versions of {}", key);
        }
    }

    @Override
    public List<StreamLocation> list(String orgId, Optional<StreamType> streamType, boolean withSchema) {
        String prefix = streamType
                .map(type -> orgId + "/" + type + "/")
                .orElse(orgId + "/");

        List<StreamLocation> locations = new ArrayList<>();
        for (Map.Entry<String, VersionedSchemas> entry : schemas.tailMap(prefix).entrySet()) {
            if (!entry.getKey().startsWith(prefix)) {
                break;
            }
            VersionedSchemas value = entry.getValue();
            locations.add(StreamLocation.builder()
                    .streamName(value.streamName)
                    .streamType(value.streamType)
                    .schema(withSchema ? value.latest() : Schema.empty())
                    .build());
        }
        return locations;
    }

    private static final class VersionedSchemas {
        private final String streamName;
        private final StreamType streamType;
        private final List<Schema> versions = new CopyOnWriteArrayList<>();

        private VersionedSchemas(String streamName, StreamType streamType) {
            this.streamName = streamName;
            this.streamType = streamType;
        }

        private Schema latest() {
            if (versions.isEmpty()) {
                return Schema.empty();
            }
            Schema latest = versions.get(versions.size() - 1);
            return latest.withMetadata(latest.getMetadata());
        }
    }
}
