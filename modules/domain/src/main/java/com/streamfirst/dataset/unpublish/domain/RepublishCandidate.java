package com.streamfirst.dataset.unpublish.domain;

import java.util.Objects;

/**
 * A version that becomes the latest once the previous latest version is deleted and should be
 * republished.
 */
public record RepublishCandidate(String datasetName, int version) {
    public RepublishCandidate {
        Objects.requireNonNull(datasetName, "Dataset name cannot be null");
    }
}
