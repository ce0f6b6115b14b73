package com.streamfirst.dataset.unpublish.domain;

import java.util.Objects;

/**
 * A single published version of a dataset. Version numbers are assigned at publication time and
 * are never renumbered; removing a version may change which remaining version is the latest, but
 * never the numbers of the others.
 *
 * @param datasetName name of the owning dataset
 * @param version the version number
 */
public record DatasetVersion(String datasetName, int version) {
    public DatasetVersion {
        Objects.requireNonNull(datasetName, "Dataset name cannot be null");
        if (version < 0) {
            throw new IllegalArgumentException("Version number cannot be negative: " + version);
        }
    }

    /**
     * Returns the identifier the registry knows this version by, in the form "name.vN". Used when
     * deletions are expressed at version granularity.
     */
    public String versionName() {
        return datasetName + ".v" + version;
    }

    @Override
    public String toString() {
        return versionName();
    }
}
