package com.streamfirst.dataset.unpublish.domain;

/** Lifecycle event kinds recorded while a dataset is retracted or deleted. */
public enum EventKind {
    /** Registry purged all metadata for the dataset */
    REGISTRY_DELETE_SUCCEEDED,
    /** Registry rejected a delete */
    REGISTRY_DELETE_FAILED,
    /** Registry withdrew the dataset from discovery */
    REGISTRY_RETRACT_SUCCEEDED,
    /** Registry rejected a retraction */
    REGISTRY_RETRACT_FAILED,
    /** A serving-layer catalog file was removed */
    SERVING_CATALOG_ENTRY_REMOVED,
    /** The dataset and all its versions were removed from the local catalog */
    DATASET_DELETED,
    /** One version was removed from the local catalog */
    DATASET_VERSION_DELETED;

    public boolean isRegistryFailure() {
        return this == REGISTRY_DELETE_FAILED || this == REGISTRY_RETRACT_FAILED;
    }
}
