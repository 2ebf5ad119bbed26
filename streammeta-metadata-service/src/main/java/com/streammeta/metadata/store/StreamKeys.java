package com.streammeta.metadata.store;

import com.streammeta.common.model.StreamType;

/**
 * Cache and registry key of a stream: {@code org/type/name}.
 */
public final class StreamKeys {

    private StreamKeys() {
    }

    public static String of(String orgId, StreamType streamType, String streamName) {
        return orgId + "/" + streamType + "/" + streamName;
    }
}
