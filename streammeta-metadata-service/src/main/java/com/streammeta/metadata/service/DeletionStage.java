package com.streammeta.metadata.service;

/**
 * States of the stream delete workflow, in the order they are reached.
 */
public enum DeletionStage {
    START,
    SCHEMA_CHECKED,
    COMPACTION_MARKED,
    SCHEMA_DELETED,
    CACHE_CLEARED,
    OFFSET_DELETED,
    DONE
}
