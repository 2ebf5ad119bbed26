package com.streammeta.metadata.service;

import com.streammeta.common.model.StreamDescriptor;
import com.streammeta.common.model.StreamSettings;
import com.streammeta.common.model.StreamType;

import java.util.List;
import java.util.Optional;

/**
 * Service interface for stream metadata operations
 */
public interface StreamMetadataService {

    /**
     * Get a stream with its normalized stats
     */
    StreamDescriptor getStream(String orgId, String streamName, StreamType streamType);

    /**
     * List streams in the schema store's listing order
     */
    List<StreamDescriptor> listStreams(String orgId, Optional<StreamType> streamType, boolean fetchSchema);

    /**
     * Replace the settings stored in the latest schema
     */
    void saveStreamSettings(String orgId, String streamName, StreamType streamType, StreamSettings settings);

    /**
     * Delete a stream and all of its associated records
     */
    void deleteStream(String orgId, String streamName, StreamType streamType);

    /**
     * Full-text-search fields of the latest schema
     */
    List<String> getFullTextSearchKeys(String orgId, String streamName, StreamType streamType);
}
