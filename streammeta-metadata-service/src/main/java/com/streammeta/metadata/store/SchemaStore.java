package com.streammeta.metadata.store;

import com.streammeta.common.model.Schema;
import com.streammeta.common.model.StreamLocation;
import com.streammeta.common.model.StreamType;

import java.util.List;
import java.util.Optional;

/**
 * Versioned persistence of stream schemas.
 * Implementations throw unchecked exceptions on storage failures.
 */
public interface SchemaStore {

    /**
     * Latest schema version, or {@link Schema#empty()} when the stream does not exist
     */
    Schema get(String orgId, String streamName, StreamType streamType);

    /**
     * All schema versions, oldest first. Empty when the stream does not exist.
     */
    List<Schema> getVersions(String orgId, String streamName, StreamType streamType);

    /**
     * Store the schema as the new latest version
     */
    void set(String orgId, String streamName, StreamType streamType, Schema schema);

    /**
     * Delete every version. Deleting a missing stream is a no-op.
     */
    void delete(String orgId, String streamName, StreamType streamType);

    /**
     * List the streams of an org, optionally restricted to one type.
     * Schemas are only loaded when {@code withSchema} is set.
     */
    List<StreamLocation> list(String orgId, Optional<StreamType> streamType, boolean withSchema);
}
