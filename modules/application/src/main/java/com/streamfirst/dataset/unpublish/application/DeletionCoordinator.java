package com.streamfirst.dataset.unpublish.application;

import com.streamfirst.dataset.unpublish.domain.*;
import com.streamfirst.dataset.unpublish.ports.*;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Retracts or deletes a batch of datasets from the registry, the serving layer and the local
 * catalog.
 *
 * <p>Every request is resolved once against the local catalog; the registry, serving-layer and
 * local-catalog phases then run in that order over the same resolutions. A rejection or a missing
 * dataset only affects its own request. A registry transport fault ends the run, after the events
 * recorded so far have been committed.
 *
 * <p>The local catalog is changed through one session per run, committed after the serving-layer
 * phase and after each dataset of the local-catalog phase. Runs are not atomic across the batch
 * and must not overlap on the same datasets.
 */
@Slf4j
public class DeletionCoordinator {

    private final LocalCatalogPort localCatalog;
    private final RegistryPortFactory registryPortFactory;
    private final FileStorePort fileStore;
    private final ServingIndexPort servingIndex;
    private final DiscoveryServicePort discoveryService;
    private final DeletionSettings settings;
    private final Clock clock;

    public DeletionCoordinator(
            LocalCatalogPort localCatalog,
            RegistryPortFactory registryPortFactory,
            FileStorePort fileStore,
            ServingIndexPort servingIndex,
            DiscoveryServicePort discoveryService,
            DeletionSettings settings) {
        this(
                localCatalog,
                registryPortFactory,
                fileStore,
                servingIndex,
                discoveryService,
                settings,
                Clock.systemUTC());
    }

    public DeletionCoordinator(
            LocalCatalogPort localCatalog,
            RegistryPortFactory registryPortFactory,
            FileStorePort fileStore,
            ServingIndexPort servingIndex,
            DiscoveryServicePort discoveryService,
            DeletionSettings settings,
            Clock clock) {
        this.localCatalog = Objects.requireNonNull(localCatalog, "localCatalog");
        this.registryPortFactory = Objects.requireNonNull(registryPortFactory, "registryPortFactory");
        this.fileStore = Objects.requireNonNull(fileStore, "fileStore");
        this.servingIndex = Objects.requireNonNull(servingIndex, "servingIndex");
        this.discoveryService = Objects.requireNonNull(discoveryService, "discoveryService");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs a deletion batch.
     *
     * @param requests datasets or versions to remove, in processing order
     * @param options switches of this run
     * @return registry outcome per identifier, plus republish candidates if requested
     * @throws UnpublishException of kind {@code CONFIGURATION} for an invalid operation or an
     *     unconfigured registry transport, before any side effect, or of kind {@code
     *     TRANSPORT_FAULT} if the registry is unreachable
     */
    public DeletionReport run(List<DeletionRequest> requests, DeletionOptions options) {
        Objects.requireNonNull(requests, "requests");
        Objects.requireNonNull(options, "options");
        if (options.getOperation() == null) {
            throw UnpublishException.configuration("Invalid registry operation: null");
        }
        RegistryPort registry = null;
        if (options.getOperation().callsRegistry()) {
            registry = registryPortFactory.create(settings.getTransport());
            log.info("Using {} registry transport", settings.getTransport());
        }

        log.info(
                "Starting {} of {} dataset request(s): servingLayer={}, localDelete={}, deleteAll={}",
                options.getOperation(),
                requests.size(),
                options.isServingLayer(),
                options.isLocalDelete(),
                options.isForceDeleteAll());

        ProgressTracker progress =
                new ProgressTracker(
                        options.getProgressListener(),
                        options.getProgressInitial(),
                        options.getProgressFinal(),
                        countSteps(requests.size(), options));
        progress.start();

        Map<String, EventKind> outcomes = new LinkedHashMap<>();
        List<RepublishCandidate> republishList = new ArrayList<>();

        try (CatalogSession session = localCatalog.openSession()) {
            Map<String, ResolutionResult> resolved = resolveAll(session, requests, options, progress);

            if (options.getOperation().callsRegistry()) {
                runRegistryPhase(session, registry, resolved, options, outcomes, progress);
            } else {
                log.info("No registry operation requested, skipping registry phase");
            }

            if (options.isServingLayer()) {
                runServingLayerPhase(session, resolved, options, progress);
            } else if (options.isDiscoveryReinit()) {
                log.info("Reinitializing discovery service");
                discoveryService.reinitialize();
            }

            if (options.isLocalDelete()) {
                runLocalCatalogPhase(session, resolved, options, republishList, progress);
            }

            session.commit();
        }

        progress.finish();
        log.info("Finished {} run with outcomes {}", options.getOperation(), outcomes);
        return new DeletionReport(outcomes, options.isRepublish() ? republishList : null);
    }

    /** Resolves each identifier once; a repeated identifier keeps its last resolution. */
    private Map<String, ResolutionResult> resolveAll(
            CatalogSession session,
            List<DeletionRequest> requests,
            DeletionOptions options,
            ProgressTracker progress) {
        NameResolver resolver = new NameResolver(session);
        Map<String, ResolutionResult> resolved = new LinkedHashMap<>();
        for (DeletionRequest request : requests) {
            ResolutionResult result =
                    resolver.resolve(
                            request.identifier(),
                            request.version(),
                            options.isForceDeleteAll(),
                            options.isCompositeIdentifiers());
            if (!result.isResolved()) {
                log.warn("Dataset not found in local catalog: {}", request.identifier());
            }
            resolved.put(request.identifier(), result);
            progress.advance();
        }
        return resolved;
    }

    private void runRegistryPhase(
            CatalogSession session,
            RegistryPort registry,
            Map<String, ResolutionResult> resolved,
            DeletionOptions options,
            Map<String, EventKind> outcomes,
            ProgressTracker progress) {
        RegistryOperation operation = options.getOperation();
        RegistryDeletionClient client = new RegistryDeletionClient(registry, session, clock);

        for (Map.Entry<String, ResolutionResult> entry : resolved.entrySet()) {
            String identifier = entry.getKey();
            ResolutionResult resolution = entry.getValue();
            Dataset dataset = resolution.getDataset().orElse(null);
            try {
                if (!settings.isDeleteAtDatasetLevel() && dataset != null) {
                    for (DatasetVersion version : resolution.getTargetVersions()) {
                        RegistryOutcome outcome = client.apply(operation, version.versionName(), dataset);
                        log.info("  Result: {}", outcome.isSucceeded() ? "SUCCESSFUL" : "UNSUCCESSFUL");
                        outcomes.put(identifier, outcome.getEventKind());
                    }
                } else {
                    // Nothing known locally still gets a registry call under the raw identifier
                    String target =
                            dataset != null && !options.isCompositeIdentifiers() ? dataset.getName() : identifier;
                    RegistryOutcome outcome = client.apply(operation, target, dataset);
                    log.info("  Result: {}", outcome.isSucceeded() ? "SUCCESSFUL" : "UNSUCCESSFUL");
                    outcomes.put(identifier, outcome.getEventKind());
                }
            } catch (UnpublishException e) {
                if (e.kind() == UnpublishException.Kind.TRANSPORT_FAULT) {
                    log.error("Registry phase aborted at {}", identifier, e);
                    session.commit();
                    throw e;
                }
                log.error(
                        "Deletion/retraction failed for dataset/version {} with message: {}",
                        identifier,
                        e.firstLines(2));
            }
            progress.advance();
        }
    }

    private void runServingLayerPhase(
            CatalogSession session,
            Map<String, ResolutionResult> resolved,
            DeletionOptions options,
            ProgressTracker progress) {
        CatalogPruner pruner =
                new CatalogPruner(session, fileStore, servingIndex, discoveryService, clock);
        int removed = 0;
        for (ResolutionResult resolution : resolved.values()) {
            if (resolution.isResolved() && resolution.hasTargets()) {
                removed += pruner.prune(resolution.getDataset().get(), resolution.getTargetVersions());
            }
            progress.advance();
        }
        log.info("Removed {} serving-layer catalog file(s)", removed);
        pruner.finish(options.isDiscoveryReinit());
    }

    private void runLocalCatalogPhase(
            CatalogSession session,
            Map<String, ResolutionResult> resolved,
            DeletionOptions options,
            List<RepublishCandidate> republishList,
            ProgressTracker progress) {
        LocalCatalogDeleter deleter = new LocalCatalogDeleter(session, clock);
        for (ResolutionResult resolution : resolved.values()) {
            if (resolution.isResolved()) {
                Dataset dataset = resolution.getDataset().get();
                var candidate =
                        deleter.deleteRecords(
                                dataset,
                                resolution.getTargetVersions(),
                                resolution.isLatestVersion(),
                                resolution.isForceDeleteAll(),
                                options.isRepublish());
                session.commit();

                dropStaleCandidates(republishList, dataset, resolution);
                candidate.ifPresent(republishList::add);
            }
            progress.advance();
        }
    }

    /** A queued candidate is stale once a later request deletes it. */
    private void dropStaleCandidates(
            List<RepublishCandidate> republishList, Dataset dataset, ResolutionResult resolution) {
        republishList.removeIf(
                candidate ->
                        candidate.datasetName().equals(dataset.getName())
                                && (resolution.isForceDeleteAll()
                                        || resolution.getTargetVersions().stream()
                                                .anyMatch(v -> v.version() == candidate.version())));
    }

    private static int countSteps(int requestCount, DeletionOptions options) {
        int phases = 1;
        if (options.getOperation() != null && options.getOperation().callsRegistry()) {
            phases++;
        }
        if (options.isServingLayer()) {
            phases++;
        }
        if (options.isLocalDelete()) {
            phases++;
        }
        return phases * requestCount;
    }
}
