package com.streamfirst.dataset.unpublish.application;

import com.streamfirst.dataset.unpublish.domain.*;
import com.streamfirst.dataset.unpublish.ports.CatalogSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Turns a user-supplied identifier into the local dataset and the versions to remove. A dataset
 * missing from the local catalog is not an error: it may still exist in the registry or the
 * serving layer, so resolution only warns.
 */
@Slf4j
@RequiredArgsConstructor
public class NameResolver {

    private final CatalogSession session;

    /**
     * Resolves a deletion request.
     *
     * @param identifier dataset name, or composite "master_id.version|data_node" identifier
     * @param version requested version, {@link Dataset#ALL_VERSIONS} for every version
     * @param forceDeleteAll true to remove every version regardless of {@code version}
     * @param useCompositeId true if {@code identifier} is a composite identifier
     * @return the resolution, never null
     */
    public ResolutionResult resolve(
            String identifier, int version, boolean forceDeleteAll, boolean useCompositeId) {
        String name = identifier;
        if (useCompositeId) {
            CompositeDatasetId composite = CompositeDatasetId.parse(identifier, version);
            if (composite.getDataNode().isEmpty()) {
                log.warn(
                        "Dataset {}: composite identifiers should have the form dataset_id|data_node",
                        identifier);
            }
            name = composite.name();
            version = composite.version();
        }

        boolean deleteAll = forceDeleteAll || version == Dataset.ALL_VERSIONS;

        Optional<Dataset> found = session.findDataset(name);
        if (found.isEmpty()) {
            log.debug("No local dataset named {}", name);
            return ResolutionResult.notFound(deleteAll);
        }
        Dataset dataset = found.get();

        Optional<DatasetVersion> versionRecord = dataset.findVersion(version);
        boolean latest = false;
        if (versionRecord.isPresent()) {
            latest = dataset.isLatest(versionRecord.get());
        } else if (version != Dataset.ALL_VERSIONS) {
            log.warn("Version {} of dataset {} not found", version, dataset.getName());
        }

        // Deleting the only version is deleting the dataset
        deleteAll = deleteAll || dataset.versionCount() == 1;

        List<DatasetVersion> targets;
        if (deleteAll) {
            targets = dataset.getVersions();
        } else {
            targets = versionRecord.map(List::of).orElse(List.of());
        }

        log.debug(
                "Resolved {} (version {}) to {} target version(s), deleteAll={}, latest={}",
                identifier,
                version,
                targets.size(),
                deleteAll,
                latest);
        return new ResolutionResult(deleteAll, dataset, targets, latest);
    }
}
