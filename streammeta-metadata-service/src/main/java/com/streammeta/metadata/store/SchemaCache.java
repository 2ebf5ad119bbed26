package com.streammeta.metadata.store;

import com.streammeta.common.model.Schema;
import com.streammeta.common.model.StreamType;

import java.util.Optional;

/**
 * In-process cache of the latest schema per stream
 */
public interface SchemaCache {

    Optional<Schema> get(String orgId, StreamType streamType, String streamName);

    void put(String orgId, StreamType streamType, String streamName, Schema schema);

    void remove(String orgId, StreamType streamType, String streamName);
}
