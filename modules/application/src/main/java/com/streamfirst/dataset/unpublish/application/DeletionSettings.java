package com.streamfirst.dataset.unpublish.application;

import com.streamfirst.dataset.unpublish.ports.RegistryPortFactory;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Deployment settings of a {@link DeletionCoordinator}, fixed at construction. */
@Value
@Builder
public class DeletionSettings {

    /** Registry transport flavor used for the registry phase */
    @NonNull @Builder.Default
    RegistryPortFactory.Transport transport = RegistryPortFactory.Transport.LEGACY_RPC;

    /**
     * True to address the registry with one call per dataset name; false to call it once per
     * version name. Registries without versioned records need dataset-level calls.
     */
    @Builder.Default boolean deleteAtDatasetLevel = true;

    public static DeletionSettings defaults() {
        return builder().build();
    }
}
