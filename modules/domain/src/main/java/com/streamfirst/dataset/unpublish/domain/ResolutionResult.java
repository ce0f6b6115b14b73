package com.streamfirst.dataset.unpublish.domain;

import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * What a deletion request resolves to in the local catalog. Computed once per request and reused
 * by every phase of a deletion run so the phases agree on their targets.
 */
@Value
public class ResolutionResult {
    /** True when the whole dataset is to be removed rather than one version */
    boolean forceDeleteAll;

    /** The dataset as found in the local catalog, or null when it only exists remotely */
    Dataset dataset;

    /** Versions to remove, in ascending order; empty when nothing is known locally */
    @NonNull List<DatasetVersion> targetVersions;

    /** True when the single requested version is the dataset's latest */
    boolean latestVersion;

    public static ResolutionResult notFound(boolean forceDeleteAll) {
        return new ResolutionResult(forceDeleteAll, null, List.of(), false);
    }

    public Optional<Dataset> getDataset() {
        return Optional.ofNullable(dataset);
    }

    public boolean isResolved() {
        return dataset != null;
    }

    public boolean hasTargets() {
        return !targetVersions.isEmpty();
    }
}
