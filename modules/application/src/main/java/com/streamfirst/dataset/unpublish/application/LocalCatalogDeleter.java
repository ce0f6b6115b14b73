package com.streamfirst.dataset.unpublish.application;

import com.streamfirst.dataset.unpublish.domain.*;
import com.streamfirst.dataset.unpublish.ports.CatalogSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Removes dataset and version rows from the local catalog. When the latest version goes away the
 * next remaining version becomes latest and may be proposed for republication.
 */
@Slf4j
@RequiredArgsConstructor
public class LocalCatalogDeleter {

    private final CatalogSession session;
    private final Clock clock;

    /**
     * Deletes the records of one resolved request. Does not commit.
     *
     * @param dataset the resolved dataset
     * @param targetVersions the versions to delete
     * @param isLatestVersion whether the single target version was the latest one when resolved
     * @param isFullDatasetDelete whether the whole dataset goes away
     * @param wantRepublish whether a republish candidate should be computed
     * @return the version that becomes latest and should be republished, if any
     */
    public Optional<RepublishCandidate> deleteRecords(
            Dataset dataset,
            List<DatasetVersion> targetVersions,
            boolean isLatestVersion,
            boolean isFullDatasetDelete,
            boolean wantRepublish) {
        // Earlier requests of the same batch may already have changed the dataset
        Optional<Dataset> current = session.findDataset(dataset.getName());
        if (current.isEmpty()) {
            log.warn("Dataset {} already removed from the local catalog", dataset.getName());
            return Optional.empty();
        }

        if (isFullDatasetDelete) {
            deleteDataset(current.get());
            return Optional.empty();
        }

        if (targetVersions.isEmpty()) {
            log.debug("No local version of {} to delete", dataset.getName());
            return Optional.empty();
        }
        return deleteVersion(current.get(), targetVersions.get(0), isLatestVersion, wantRepublish);
    }

    private void deleteDataset(Dataset dataset) {
        log.info("Deleting existing dataset: {}", dataset.getName());
        session.appendEvent(
                new DatasetEvent(
                        dataset.getName(),
                        dataset.latestVersionNumber(),
                        EventKind.DATASET_DELETED,
                        clock.instant()));
        session.deleteDataset(dataset.getName());
    }

    private Optional<RepublishCandidate> deleteVersion(
            Dataset dataset, DatasetVersion target, boolean isLatestVersion, boolean wantRepublish) {
        if (dataset.findVersion(target.version()).isEmpty()) {
            log.warn("Version {} already removed from the local catalog", target);
            return Optional.empty();
        }

        // An earlier deletion of the batch may have made the target the latest version
        boolean latest = isLatestVersion || dataset.isLatest(target);

        Optional<RepublishCandidate> candidate = Optional.empty();
        if (latest && wantRepublish) {
            candidate = nextLatest(dataset, target);
            candidate.ifPresent(
                    c -> log.info("Version {} of {} becomes latest", c.version(), c.datasetName()));
        }

        log.info(
                "Deleting existing dataset version: {} (version {})",
                dataset.getName(),
                target.version());
        session.appendEvent(
                new DatasetEvent(
                        dataset.getName(),
                        target.version(),
                        EventKind.DATASET_VERSION_DELETED,
                        clock.instant()));
        session.deleteVersion(target);

        if (latest) {
            session.deleteVariables(dataset.getName());
        }
        return candidate;
    }

    /** Highest version left once {@code deleted} is gone. */
    private Optional<RepublishCandidate> nextLatest(Dataset dataset, DatasetVersion deleted) {
        return dataset.getVersions().stream()
                .filter(v -> v.version() != deleted.version())
                .reduce((first, second) -> second)
                .map(v -> new RepublishCandidate(dataset.getName(), v.version()));
    }
}
