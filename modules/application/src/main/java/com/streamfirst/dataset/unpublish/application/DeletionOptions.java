package com.streamfirst.dataset.unpublish.application;

import com.streamfirst.dataset.unpublish.domain.RegistryOperation;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Per-run switches of {@link DeletionCoordinator#run}. */
@Value
@Builder(toBuilder = true)
public class DeletionOptions {

    /** Registry operation; {@link RegistryOperation#NO_OPERATION} skips the registry phase */
    @Builder.Default RegistryOperation operation = RegistryOperation.RETRACT;

    /** Remove serving-layer catalog files and regenerate the serving index */
    @Builder.Default boolean servingLayer = true;

    /** Reinitialize the discovery service */
    @Builder.Default boolean discoveryReinit = false;

    /** Delete dataset and version rows from the local catalog */
    @Builder.Default boolean localDelete = false;

    /** Remove every version of each requested dataset */
    @Builder.Default boolean forceDeleteAll = false;

    /** Report the versions to republish as new latest versions */
    @Builder.Default boolean republish = false;

    /** Identifiers are composite "master_id.version|data_node" identifiers */
    @Builder.Default boolean compositeIdentifiers = false;

    @NonNull @Builder.Default ProgressListener progressListener = ProgressListener.NONE;

    @Builder.Default double progressInitial = 0.0;

    @Builder.Default double progressFinal = 1.0;
}
