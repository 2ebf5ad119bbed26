package com.streammeta.metadata.service;

import com.streammeta.common.model.Schema;
import com.streammeta.common.model.StreamDescriptor;
import com.streammeta.common.model.StreamProperty;
import com.streammeta.common.model.StreamSettings;
import com.streammeta.common.model.StreamStats;
import com.streammeta.common.model.StreamType;
import com.streammeta.metadata.codec.SettingsCodec;
import com.streammeta.metadata.store.StorageBackend;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Composes the public view of a stream from its schema and (normalized) stats.
 */
@Component
@RequiredArgsConstructor
public class StreamDescriptorBuilder {

    private final SettingsCodec settingsCodec;
    private final StorageBackend storageBackend;

    /**
     * @param stats normalized stats, or empty when the stream has no recorded usage
     */
    public StreamDescriptor build(String streamName, StreamType streamType, Schema schema,
                                  Optional<StreamStats> stats) {
        List<StreamProperty> properties = schema.getFields().stream()
                .map(StreamProperty::from)
                .collect(Collectors.toList());

        // created_at is bookkeeping, never configuration
        Map<String, String> metadata = new HashMap<>(schema.getMetadata());
        metadata.remove(Schema.CREATED_AT_KEY);
        StreamSettings settings = settingsCodec.decode(metadata);

        return StreamDescriptor.builder()
                .name(streamName)
                .streamType(streamType)
                .storageType(storageBackend.label())
                .schema(properties)
                .stats(stats.orElseGet(StreamStats::new))
                .settings(settings)
                .build();
    }
}
