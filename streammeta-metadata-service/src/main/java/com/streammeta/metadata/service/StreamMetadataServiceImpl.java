package com.streammeta.metadata.service;

import com.streammeta.common.exception.StreamConflictException;
import com.streammeta.common.exception.StreamNotFoundException;
import com.streammeta.common.model.Schema;
import com.streammeta.common.model.StreamDescriptor;
import com.streammeta.common.model.StreamLocation;
import com.streammeta.common.model.StreamSettings;
import com.streammeta.common.model.StreamStats;
import com.streammeta.common.model.StreamType;
import com.streammeta.metadata.codec.SettingsCodec;
import com.streammeta.metadata.store.CompactionCoordinator;
import com.streammeta.metadata.store.SchemaCache;
import com.streammeta.metadata.store.SchemaStore;
import com.streammeta.metadata.store.StatsCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Implementation of StreamMetadataService.
 * Owns no state: every call reads the collaborators and rebuilds its result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StreamMetadataServiceImpl implements StreamMetadataService {

    private final SchemaStore schemaStore;
    private final StatsCache statsCache;
    private final SchemaCache schemaCache;
    private final CompactionCoordinator compaction;
    private final StatsNormalizer statsNormalizer;
    private final StreamDescriptorBuilder descriptorBuilder;
    private final SettingsCodec settingsCodec;

    @Override
    public StreamDescriptor getStream(String orgId, String streamName, StreamType streamType) {
        log.debug("Getting stream {}/{}/{}", orgId, streamType, streamName);

        Schema schema = schemaStore.get(orgId, streamName, streamType);
        if (schema.isEmpty()) {
            throw new StreamNotFoundException(streamName);
        }

        StreamStats stats = statsNormalizer.normalize(statsCache.getStats(orgId, streamName, streamType));
        return descriptorBuilder.build(streamName, streamType, schema, Optional.of(stats));
    }

    @Override
    public List<StreamDescriptor> listStreams(String orgId, Optional<StreamType> streamType, boolean fetchSchema) {
        log.debug("Listing streams of org {} (type={}, fetchSchema={})",
                orgId, streamType.map(StreamType::toString).orElse("any"), fetchSchema);

        List<StreamLocation> locations = schemaStore.list(orgId, streamType, fetchSchema);
        List<StreamDescriptor> streams = new ArrayList<>(locations.size());
        StreamStats noUsage = new StreamStats();

        for (StreamLocation location : locations) {
            StreamStats raw = statsCache.getStats(orgId, location.getStreamName(), location.getStreamType());
            Optional<StreamStats> stats = raw.equals(noUsage)
                    ? Optional.empty()
                    : Optional.of(statsNormalizer.normalize(raw));
            streams.add(descriptorBuilder.build(
                    location.getStreamName(), location.getStreamType(), location.getSchema(), stats));
        }
        return streams;
    }

    @Override
    public void saveStreamSettings(String orgId, String streamName, StreamType streamType,
                                   StreamSettings settings) {
        if (compaction.isPendingDelete(orgId, streamName, streamType)) {
            throw new StreamConflictException(streamName);
        }

        Schema schema = schemaStore.get(orgId, streamName, streamType);
        if (schema.isEmpty()) {
            throw new StreamNotFoundException(streamName);
        }

        Map<String, String> metadata = settingsCodec.encode(schema.getMetadata(), settings);
        Schema updated = schema.withMetadata(metadata);

        log.info("Saving settings for stream {}/{}/{}", orgId, streamType, streamName);
        schemaStore.set(orgId, streamName, streamType, updated);
        schemaCache.put(orgId, streamType, streamName, updated);
    }

    @Override
    public void deleteStream(String orgId, String streamName, StreamType streamType) {
        log.info("Deleting stream {}/{}/{}", orgId, streamType, streamName);
        new StreamDeletion(orgId, streamName, streamType, schemaStore, schemaCache, statsCache, compaction)
                .run();
    }

    @Override
    public List<String> getFullTextSearchKeys(String orgId, String streamName, StreamType streamType) {
        // a cached schema may outlive a delete that stopped before the cache was cleared
        Optional<Schema> cached = compaction.isPendingDelete(orgId, streamName, streamType)
                ? Optional.empty()
                : schemaCache.get(orgId, streamType, streamName);
        Schema schema = cached.orElseGet(() -> schemaStore.get(orgId, streamName, streamType));
        return settingsCodec.fullTextSearchKeys(schema);
    }
}
