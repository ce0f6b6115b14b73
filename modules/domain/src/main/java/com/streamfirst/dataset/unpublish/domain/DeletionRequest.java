package com.streamfirst.dataset.unpublish.domain;

import java.util.Objects;

/**
 * A caller's request to remove a dataset or one of its versions.
 *
 * @param identifier dataset name, or a composite "id|node" identifier
 * @param version version number, or {@link Dataset#ALL_VERSIONS} for every version
 */
public record DeletionRequest(String identifier, int version) {
    public DeletionRequest {
        Objects.requireNonNull(identifier, "Identifier cannot be null");
        if (identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier cannot be empty");
        }
    }

    public static DeletionRequest allVersions(String identifier) {
        return new DeletionRequest(identifier, Dataset.ALL_VERSIONS);
    }
}
