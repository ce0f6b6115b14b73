package com.streamfirst.dataset.unpublish.boot;

import com.streamfirst.dataset.unpublish.adapters.InMemoryFileStoreAdapter;
import com.streamfirst.dataset.unpublish.adapters.InMemoryLocalCatalogAdapter;
import com.streamfirst.dataset.unpublish.adapters.InMemoryServingLayerAdapters.InMemoryDiscoveryService;
import com.streamfirst.dataset.unpublish.adapters.InMemoryServingLayerAdapters.InMemoryServingIndex;
import com.streamfirst.dataset.unpublish.adapters.registry.http.HttpRegistryPortFactory;
import com.streamfirst.dataset.unpublish.adapters.registry.http.HttpRegistrySettings;
import com.streamfirst.dataset.unpublish.adapters.serving.http.HttpDiscoveryServiceAdapter;
import com.streamfirst.dataset.unpublish.adapters.serving.http.HttpServingIndexAdapter;
import com.streamfirst.dataset.unpublish.adapters.storage.local.LocalFileStoreAdapter;
import com.streamfirst.dataset.unpublish.application.*;
import com.streamfirst.dataset.unpublish.domain.RegistryOperation;
import com.streamfirst.dataset.unpublish.ports.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Wires the adapters and the deletion coordinator from {@link UnpublishProperties}. */
@Slf4j
@Configuration
@EnableConfigurationProperties(UnpublishProperties.class)
public class UnpublishAppConfiguration {

    // --- Adapter Beans ---

    @Bean
    public LocalCatalogPort localCatalog() {
        log.info("Creating local catalog bean (in-memory)");
        return new InMemoryLocalCatalogAdapter();
    }

    @Bean
    public RegistryPortFactory registryPortFactory(UnpublishProperties properties) {
        UnpublishProperties.Registry registry = properties.getRegistry();
        return new HttpRegistryPortFactory(
                HttpRegistrySettings.builder()
                        .legacyServiceUri(registry.getLegacyServiceUrl())
                        .restServiceUri(registry.getRestServiceUrl())
                        .certificatePath(registry.getCertificatePath())
                        .connectTimeout(registry.getConnectTimeout())
                        .requestTimeout(registry.getRequestTimeout())
                        .build());
    }

    @Bean
    public FileStorePort servingFileStore(UnpublishProperties properties) {
        if (properties.getServing().getCatalogRoot() == null) {
            log.info("No serving catalog root configured, using in-memory file store");
            return new InMemoryFileStoreAdapter();
        }
        log.info("Serving catalog root: {}", properties.getServing().getCatalogRoot());
        return new LocalFileStoreAdapter(properties.getServing().getCatalogRoot());
    }

    @Bean
    public ServingIndexPort servingIndex(UnpublishProperties properties) {
        UnpublishProperties.Serving serving = properties.getServing();
        if (serving.getRegenerateUrl() == null) {
            return new InMemoryServingIndex();
        }
        return new HttpServingIndexAdapter(
                serving.getRegenerateUrl(), serving.getConnectTimeout(), serving.getRequestTimeout());
    }

    @Bean
    public DiscoveryServicePort discoveryService(UnpublishProperties properties) {
        UnpublishProperties.Serving serving = properties.getServing();
        if (serving.getDiscoveryReinitUrl() == null) {
            return new InMemoryDiscoveryService();
        }
        return new HttpDiscoveryServiceAdapter(
                serving.getDiscoveryReinitUrl(), serving.getConnectTimeout(), serving.getRequestTimeout());
    }

    // --- Application Service Beans ---

    @Bean
    public DeletionSettings deletionSettings(UnpublishProperties properties) {
        return DeletionSettings.builder()
                .transport(properties.getRegistry().getTransport())
                .deleteAtDatasetLevel(properties.getRegistry().isDeleteAtDatasetLevel())
                .build();
    }

    /** Run options used when a caller does not build its own; validated at startup. */
    @Bean
    public DeletionOptions defaultDeletionOptions(UnpublishProperties properties) {
        return DeletionOptions.builder()
                .operation(RegistryOperation.parse(properties.getDefaultOperation()))
                .build();
    }

    @Bean
    public DeletionCoordinator deletionCoordinator(
            LocalCatalogPort localCatalog,
            RegistryPortFactory registryPortFactory,
            FileStorePort servingFileStore,
            ServingIndexPort servingIndex,
            DiscoveryServicePort discoveryService,
            DeletionSettings deletionSettings) {
        return new DeletionCoordinator(
                localCatalog,
                registryPortFactory,
                servingFileStore,
                servingIndex,
                discoveryService,
                deletionSettings,
                Clock.systemUTC());
    }
}
