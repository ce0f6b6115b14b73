package com.streamfirst.dataset.unpublish.application;

import com.streamfirst.dataset.unpublish.domain.*;
import com.streamfirst.dataset.unpublish.ports.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Removes serving-layer catalog files of deleted versions and refreshes the serving layer.
 * Pruning an already pruned version finds no entry and does nothing.
 */
@Slf4j
@RequiredArgsConstructor
public class CatalogPruner {

    private final CatalogSession session;
    private final FileStorePort fileStore;
    private final ServingIndexPort servingIndex;
    private final DiscoveryServicePort discoveryService;
    private final Clock clock;

    /**
     * Removes the catalog entries of the given versions and their backing files.
     *
     * @return number of catalog files deleted
     */
    public int prune(Dataset dataset, List<DatasetVersion> targetVersions) {
        int removed = 0;
        for (DatasetVersion version : targetVersions) {
            Optional<CatalogEntry> entry =
                    session.findCatalogEntry(dataset.getName(), version.version());
            if (entry.isEmpty()) {
                log.debug("No serving-layer catalog for {}", version);
                continue;
            }

            String location = entry.get().location();
            if (fileStore.exists(location)) {
                log.info("Deleting serving-layer catalog: {}", location);
                fileStore.delete(location);
                session.appendEvent(
                        new DatasetEvent(
                                dataset.getName(),
                                version.version(),
                                EventKind.SERVING_CATALOG_ENTRY_REMOVED,
                                clock.instant()));
                removed++;
            } else {
                log.debug("Catalog file {} of {} already gone", location, version);
            }
            session.deleteCatalogEntry(entry.get());
        }
        return removed;
    }

    /**
     * Commits the catalog changes made so far, regenerates the serving layer's aggregate index and
     * optionally reinitializes the discovery service. Called once per batch.
     */
    public void finish(boolean reinitializeDiscovery) {
        session.commit();

        log.info("Regenerating serving-layer index");
        servingIndex.regenerateIndex();

        if (reinitializeDiscovery) {
            log.info("Reinitializing discovery service");
            discoveryService.reinitialize();
        }
    }
}
