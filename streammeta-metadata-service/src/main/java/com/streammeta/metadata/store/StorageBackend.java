package com.streammeta.metadata.store;

/**
 * Deployment capability: whether stream data lives on local disk or in remote object storage.
 */
public interface StorageBackend {

    String LOCAL_LABEL = "disk";
    String REMOTE_LABEL = "s3";

    boolean isLocalDisk();

    default String label() {
        return isLocalDisk() ? LOCAL_LABEL : REMOTE_LABEL;
    }
}
