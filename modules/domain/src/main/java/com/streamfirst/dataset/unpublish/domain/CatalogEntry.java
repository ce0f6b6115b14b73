package com.streamfirst.dataset.unpublish.domain;

import java.util.Objects;

/**
 * Serving-layer catalog file of one dataset version. The file itself belongs to the serving
 * layer; the entry is tracked in the local catalog so the file can be cleaned up.
 *
 * @param datasetName the dataset name
 * @param version the version number
 * @param location path of the catalog file, relative to the serving layer's root
 */
public record CatalogEntry(String datasetName, int version, String location) {
    public CatalogEntry {
        Objects.requireNonNull(datasetName, "Dataset name cannot be null");
        Objects.requireNonNull(location, "Catalog location cannot be null");
        if (location.isBlank()) {
            throw new IllegalArgumentException("Catalog location cannot be empty");
        }
    }
}
