package com.streamfirst.dataset.unpublish.application;

import com.streamfirst.dataset.unpublish.adapters.InMemoryFileStoreAdapter;
import com.streamfirst.dataset.unpublish.adapters.InMemoryLocalCatalogAdapter;
import com.streamfirst.dataset.unpublish.adapters.InMemoryRegistryAdapter;
import com.streamfirst.dataset.unpublish.adapters.InMemoryServingLayerAdapters.InMemoryDiscoveryService;
import com.streamfirst.dataset.unpublish.adapters.InMemoryServingLayerAdapters.InMemoryServingIndex;
import com.streamfirst.dataset.unpublish.domain.*;
import com.streamfirst.dataset.unpublish.ports.RegistryPortFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeletionCoordinatorTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);

    private InMemoryLocalCatalogAdapter catalog;
    private InMemoryRegistryAdapter registry;
    private InMemoryFileStoreAdapter fileStore;
    private InMemoryServingIndex servingIndex;
    private InMemoryDiscoveryService discovery;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryLocalCatalogAdapter();
        registry = new InMemoryRegistryAdapter();
        fileStore = new InMemoryFileStoreAdapter();
        servingIndex = new InMemoryServingIndex();
        discovery = new InMemoryDiscoveryService();

        for (int v = 1; v <= 3; v++) {
            catalog.addVersion("a", v, "a/v" + v + ".xml");
            fileStore.put("a/v" + v + ".xml");
        }
        catalog.addVersion("b", 1, "b/v1.xml");
        fileStore.put("b/v1.xml");
        registry.publish("a");
        registry.publish("b");
    }

    private DeletionCoordinator coordinator(DeletionSettings settings) {
        return new DeletionCoordinator(
                catalog, registry, fileStore, servingIndex, discovery, settings, clock);
    }

    private DeletionCoordinator coordinator() {
        return coordinator(DeletionSettings.defaults());
    }

    @Test
    void missingOperationFailsBeforeAnySideEffect() {
        DeletionOptions options = DeletionOptions.builder().operation(null).localDelete(true).build();

        assertThatThrownBy(
                        () -> coordinator().run(List.of(DeletionRequest.allVersions("a")), options))
                .isInstanceOfSatisfying(
                        UnpublishException.class,
                        e -> assertThat(e.kind()).isEqualTo(UnpublishException.Kind.CONFIGURATION));
        assertThat(registry.getCalls()).isEmpty();
        assertThat(catalog.getCommitCount()).isZero();
        assertThat(catalog.getDataset("a")).isPresent();
    }

    @Test
    void noOperationSkipsRegistryPhase() {
        DeletionReport report =
                coordinator()
                        .run(
                                List.of(new DeletionRequest("a", 3)),
                                DeletionOptions.builder().operation(RegistryOperation.NO_OPERATION).build());

        assertThat(report.outcomes()).isEmpty();
        assertThat(registry.getCalls()).isEmpty();
        assertThat(registry.getRequestedTransports()).isEmpty();
        assertThat(fileStore.exists("a/v3.xml")).isFalse();
    }

    @Test
    void datasetLevelCallsUseDatasetName() {
        DeletionReport report =
                coordinator()
                        .run(
                                List.of(new DeletionRequest("a", 2), new DeletionRequest("b", 1)),
                                DeletionOptions.builder().operation(RegistryOperation.RETRACT).build());

        assertThat(registry.getCalls())
                .containsExactly(
                        new InMemoryRegistryAdapter.Call("retract", "a"),
                        new InMemoryRegistryAdapter.Call("retract", "b"));
        assertThat(report.outcomes())
                .containsEntry("a", EventKind.REGISTRY_RETRACT_SUCCEEDED)
                .containsEntry("b", EventKind.REGISTRY_RETRACT_SUCCEEDED);
        assertThat(registry.getRequestedTransports())
                .containsExactly(RegistryPortFactory.Transport.LEGACY_RPC);
    }

    @Test
    void versionLevelCallsUseVersionNames() {
        DeletionSettings settings =
                DeletionSettings.builder()
                        .transport(RegistryPortFactory.Transport.REST)
                        .deleteAtDatasetLevel(false)
                        .build();

        coordinator(settings)
                .run(
                        List.of(DeletionRequest.allVersions("a"), new DeletionRequest("unknown", 1)),
                        DeletionOptions.builder().operation(RegistryOperation.DELETE).servingLayer(false).build());

        assertThat(registry.getCalls())
                .extracting(InMemoryRegistryAdapter.Call::identifier)
                .containsExactly("a.v1", "a.v2", "a.v3", "unknown");
        assertThat(registry.getRequestedTransports())
                .containsExactly(RegistryPortFactory.Transport.REST);
    }

    @Test
    void compositeIdentifiersAreSentUnchanged() {
        DeletionReport report =
                coordinator()
                        .run(
                                List.of(new DeletionRequest("a.v3|node.example.org", -1)),
                                DeletionOptions.builder()
                                        .operation(RegistryOperation.RETRACT)
                                        .compositeIdentifiers(true)
                                        .localDelete(true)
                                        .republish(true)
                                        .build());

        assertThat(registry.getCalls())
                .containsExactly(new InMemoryRegistryAdapter.Call("retract", "a.v3|node.example.org"));
        assertThat(report.outcome("a.v3|node.example.org"))
                .contains(EventKind.REGISTRY_RETRACT_SUCCEEDED);
        assertThat(report.republishList()).contains(List.of(new RepublishCandidate("a", 2)));
    }

    @Test
    void rejectionIsRecordedAndBatchContinues() {
        registry.rejectWith("a", "Permission denied\nfor publisher");

        DeletionReport report =
                coordinator()
                        .run(
                                List.of(new DeletionRequest("a", 1), new DeletionRequest("b", 1)),
                                DeletionOptions.builder()
                                        .operation(RegistryOperation.DELETE)
                                        .servingLayer(false)
                                        .build());

        assertThat(report.outcomes())
                .containsEntry("a", EventKind.REGISTRY_DELETE_FAILED)
                .containsEntry("b", EventKind.REGISTRY_DELETE_SUCCEEDED);
        assertThat(report.allSucceeded()).isFalse();
        assertThat(registry.isPublished("b")).isFalse();
        assertThat(catalog.getWarnings("a")).hasSize(1);
        assertThat(catalog.getEvents("a"))
                .extracting(DatasetEvent::getKind)
                .containsExactly(EventKind.REGISTRY_DELETE_FAILED);
    }

    @Test
    void transportFaultAbortsRunButKeepsEarlierEvents() {
        registry.failTransportFor("b");

        assertThatThrownBy(
                        () ->
                                coordinator()
                                        .run(
                                                List.of(
                                                        new DeletionRequest("a", 3),
                                                        new DeletionRequest("b", 1),
                                                        new DeletionRequest("c", 1)),
                                                DeletionOptions.builder()
                                                        .operation(RegistryOperation.RETRACT)
                                                        .localDelete(true)
                                                        .build()))
                .isInstanceOfSatisfying(
                        UnpublishException.class,
                        e -> assertThat(e.kind()).isEqualTo(UnpublishException.Kind.TRANSPORT_FAULT));

        assertThat(registry.getCalls()).extracting(InMemoryRegistryAdapter.Call::identifier)
                .containsExactly("a", "b");
        assertThat(catalog.getEvents("a"))
                .extracting(DatasetEvent::getKind)
                .containsExactly(EventKind.REGISTRY_RETRACT_SUCCEEDED);
        // later phases never ran
        assertThat(fileStore.exists("a/v3.xml")).isTrue();
        assertThat(catalog.getDataset("a").orElseThrow().versionCount()).isEqualTo(3);
    }

    @Test
    void servingLayerRefreshedOncePerBatch() {
        coordinator()
                .run(
                        List.of(new DeletionRequest("a", 1), new DeletionRequest("b", 1)),
                        DeletionOptions.builder()
                                .operation(RegistryOperation.NO_OPERATION)
                                .discoveryReinit(true)
                                .build());

        assertThat(fileStore.exists("a/v1.xml")).isFalse();
        assertThat(fileStore.exists("b/v1.xml")).isFalse();
        assertThat(fileStore.exists("a/v2.xml")).isTrue();
        assertThat(servingIndex.getRegenerationCount()).isEqualTo(1);
        assertThat(discovery.getReinitializationCount()).isEqualTo(1);
    }

    @Test
    void discoveryReinitRunsWithoutServingLayerPhase() {
        coordinator()
                .run(
                        List.of(new DeletionRequest("a", 1)),
                        DeletionOptions.builder()
                                .operation(RegistryOperation.NO_OPERATION)
                                .servingLayer(false)
                                .discoveryReinit(true)
                                .build());

        assertThat(servingIndex.getRegenerationCount()).isZero();
        assertThat(discovery.getReinitializationCount()).isEqualTo(1);
        assertThat(fileStore.exists("a/v1.xml")).isTrue();
    }

    @Test
    void republishListOnlyWhenRequested() {
        DeletionOptions options =
                DeletionOptions.builder()
                        .operation(RegistryOperation.NO_OPERATION)
                        .servingLayer(false)
                        .localDelete(true)
                        .build();

        DeletionReport report = coordinator().run(List.of(new DeletionRequest("a", 3)), options);

        assertThat(report.republishList()).isEmpty();
        assertThat(catalog.getDataset("a").orElseThrow().latestVersionNumber()).isEqualTo(2);
    }

    @Test
    void laterDeletionInBatchDropsQueuedCandidate() {
        catalog.addVersion("c", 1);
        catalog.addVersion("c", 2);

        DeletionReport report =
                coordinator()
                        .run(
                                List.of(
                                        new DeletionRequest("a.v3|node", -1),
                                        new DeletionRequest("c.v2|node", -1),
                                        new DeletionRequest("a.v2|node", -1)),
                                DeletionOptions.builder()
                                        .operation(RegistryOperation.NO_OPERATION)
                                        .servingLayer(false)
                                        .localDelete(true)
                                        .republish(true)
                                        .compositeIdentifiers(true)
                                        .build());

        // a.v2 was proposed after a.v3 went away, then deleted itself in favour of a.v1
        assertThat(report.republishList())
                .contains(List.of(new RepublishCandidate("c", 1), new RepublishCandidate("a", 1)));
        assertThat(catalog.getDataset("a").orElseThrow().latestVersionNumber()).isEqualTo(1);
    }

    @Test
    void deletingLatestTwiceInBatchProposesRemainingVersion() {
        DeletionReport report =
                coordinator()
                        .run(
                                List.of(new DeletionRequest("a.v3|node", -1), new DeletionRequest("a.v2|node", -1)),
                                DeletionOptions.builder()
                                        .operation(RegistryOperation.NO_OPERATION)
                                        .servingLayer(false)
                                        .localDelete(true)
                                        .republish(true)
                                        .compositeIdentifiers(true)
                                        .build());

        assertThat(catalog.getDataset("a").orElseThrow().latestVersionNumber()).isEqualTo(1);
        assertThat(report.republishList()).contains(List.of(new RepublishCandidate("a", 1)));
    }

    @Test
    void fullDeleteCommitsPerDataset() {
        DeletionReport report =
                coordinator()
                        .run(
                                List.of(DeletionRequest.allVersions("a"), new DeletionRequest("b", 1)),
                                DeletionOptions.builder()
                                        .operation(RegistryOperation.DELETE)
                                        .localDelete(true)
                                        .republish(true)
                                        .build());

        assertThat(catalog.getDataset("a")).isEmpty();
        assertThat(catalog.getDataset("b")).isEmpty();
        assertThat(report.republishList()).contains(List.of());
        // serving-layer phase, each dataset of the local phase, and the final commit
        assertThat(catalog.getCommitCount()).isEqualTo(4);
        assertThat(catalog.getEvents("a"))
                .extracting(DatasetEvent::getKind)
                .containsExactly(
                        EventKind.REGISTRY_DELETE_SUCCEEDED,
                        EventKind.SERVING_CATALOG_ENTRY_REMOVED,
                        EventKind.SERVING_CATALOG_ENTRY_REMOVED,
                        EventKind.SERVING_CATALOG_ENTRY_REMOVED,
                        EventKind.DATASET_DELETED);
    }

    @Test
    void progressIsReportedWithinBounds() {
        List<Double> progress = new ArrayList<>();

        coordinator()
                .run(
                        List.of(new DeletionRequest("a", 1), new DeletionRequest("b", 1)),
                        DeletionOptions.builder()
                                .operation(RegistryOperation.RETRACT)
                                .localDelete(true)
                                .progressListener(progress::add)
                                .progressInitial(5)
                                .progressFinal(50)
                                .build());

        assertThat(progress).first().isEqualTo(5.0);
        assertThat(progress).last().isEqualTo(50.0);
        assertThat(progress).isSorted();
    }
}
