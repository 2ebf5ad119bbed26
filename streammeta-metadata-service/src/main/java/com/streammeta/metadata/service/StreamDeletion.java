package com.streammeta.metadata.service;

import com.streammeta.common.exception.StreamNotFoundException;
import com.streammeta.common.exception.SubsystemFailureException;
import com.streammeta.common.model.Schema;
import com.streammeta.common.model.StreamType;
import com.streammeta.metadata.store.CompactionCoordinator;
import com.streammeta.metadata.store.SchemaCache;
import com.streammeta.metadata.store.SchemaStore;
import com.streammeta.metadata.store.StatsCache;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * One run of the stream delete workflow.
 *
 * <p>Steps run in a fixed order and the first failing step ends the run. Completed steps are not
 * rolled back. Every step is idempotent, so a fresh deletion for the same stream completes the
 * work when the failed one stopped before the schema was deleted. After that point a fresh run
 * reports not found, and the remaining records belong to the compactor, which holds the
 * pending-deletion mark. A stream left marked for deletion but not deleted is an accepted
 * intermediate state.
 */
@Slf4j
public class StreamDeletion {

    private final String orgId;
    private final String streamName;
    private final StreamType streamType;
    private final SchemaStore schemaStore;
    private final SchemaCache schemaCache;
    private final StatsCache statsCache;
    private final CompactionCoordinator compaction;

    private DeletionStage stage = DeletionStage.START;
    private DeletionStage failedStage;

    public StreamDeletion(String orgId, String streamName, StreamType streamType,
                          SchemaStore schemaStore, SchemaCache schemaCache,
                          StatsCache statsCache, CompactionCoordinator compaction) {
        this.orgId = orgId;
        this.streamName = streamName;
        this.streamType = streamType;
        this.schemaStore = schemaStore;
        this.schemaCache = schemaCache;
        this.statsCache = statsCache;
        this.compaction = compaction;
    }

    /**
     * Run every step.
     *
     * @throws StreamNotFoundException if the stream has no schema versions; nothing is mutated
     * @throws SubsystemFailureException naming the stage that could not be reached
     */
    public void run() {
        if (stage != DeletionStage.START) {
            throw new IllegalStateException("Deletion of " + streamName + " already ran, stage " + stage);
        }

        step(DeletionStage.SCHEMA_CHECKED, () -> {
            List<Schema> versions = schemaStore.getVersions(orgId, streamName, streamType);
            if (versions.isEmpty()) {
                throw new StreamNotFoundException(streamName);
            }
        });
        step(DeletionStage.COMPACTION_MARKED,
                () -> compaction.markPendingDelete(orgId, streamName, streamType));
        step(DeletionStage.SCHEMA_DELETED,
                () -> schemaStore.delete(orgId, streamName, streamType));
        step(DeletionStage.CACHE_CLEARED, () -> {
            schemaCache.remove(orgId, streamType, streamName);
            statsCache.removeStats(orgId, streamName, streamType);
        });
        step(DeletionStage.OFFSET_DELETED,
                () -> compaction.deleteOffset(orgId, streamName, streamType));

        stage = DeletionStage.DONE;
        log.info("Stream {}/{}/{} deleted", orgId, streamType, streamName);
    }

    private void step(DeletionStage target, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            if (target == DeletionStage.SCHEMA_CHECKED && e instanceof StreamNotFoundException) {
                throw e;
            }
            failedStage = target;
            log.error("Deleting stream {}/{}/{} failed before {} (last completed: {})",
                    orgId, streamType, streamName, target, stage, e);
            throw new SubsystemFailureException(target.name(), streamName, e);
        }
        stage = target;
        log.info("Deleting stream {}/{}/{}: {}", orgId, streamType, streamName, target);
    }

    /**
     * Last stage reached successfully
     */
    public DeletionStage getStage() {
        return stage;
    }

    public Optional<DeletionStage> getFailedStage() {
        return Optional.ofNullable(failedStage);
    }
}
