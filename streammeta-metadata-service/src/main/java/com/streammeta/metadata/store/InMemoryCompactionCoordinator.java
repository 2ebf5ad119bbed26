package com.streammeta.metadata.store;

import com.streammeta.common.model.StreamType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pending-deletion marks and compaction offsets kept in memory
 */
@Slf4j
@Component
public class InMemoryCompactionCoordinator implements CompactionCoordinator {

    private final Set<String> pendingDeletes = ConcurrentHashMap.newKeySet();
    private final Map<String, Long> offsets = new ConcurrentHashMap<>();

    @Override
    public void markPendingDelete(String orgId, String streamName, StreamType streamType) {
        String key = StreamKeys.of(orgId, streamType, streamName);
        if (pendingDeletes.add(key)) {
            log.info("Marked {} as pending deletion for compaction", key);
        }
    }

    @Override
    public void clearPendingDelete(String orgId, String streamName, StreamType streamType) {
        String key = StreamKeys.of(orgId, streamType, streamName);
        if (pendingDeletes.remove(key)) {
            log.info("Cleared pending deletion of {}", key);
        }
    }

    @Override
    public boolean isPendingDelete(String orgId, String streamName, StreamType streamType) {
        return pendingDeletes.contains(StreamKeys.of(orgId, streamType, streamName));
    }

    @Override
    public long getOffset(String orgId, String streamName, StreamType streamType) {
        return offsets.getOrDefault(StreamKeys.of(orgId, streamType, streamName), 0L);
    }

    @Override
    public void setOffset(String orgId, String streamName, StreamType streamType, long offset) {
        offsets.put(StreamKeys.of(orgId, streamType, streamName), offset);
    }

    @Override
    public void deleteOffset(String orgId, String streamName, StreamType streamType) {
        offsets.remove(StreamKeys.of(orgId, streamType, streamName));
    }
}
