package com.streamfirst.dataset.unpublish.boot;

import com.streamfirst.dataset.unpublish.ports.RegistryPortFactory;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/** Externalized settings bound from the {@code unpublish.*} properties. */
@Getter
@Setter
@ConfigurationProperties(prefix = "unpublish")
public class UnpublishProperties {

    /** Registry operation of runs that do not choose one: delete, retract or none */
    private String defaultOperation = "retract";

    private final Registry registry = new Registry();
    private final Serving serving = new Serving();

    @Getter
    @Setter
    public static class Registry {
        private RegistryPortFactory.Transport transport = RegistryPortFactory.Transport.LEGACY_RPC;

        /** Address the registry by dataset name rather than by version name */
        private boolean deleteAtDatasetLevel = true;

        private URI legacyServiceUrl;
        private URI restServiceUrl;
        private String certificatePath = "";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Serving {
        /** Directory holding the serving layer's catalog files; in-memory store when unset */
        private Path catalogRoot;

        /** Management URL rebuilding the serving index; no-op when unset */
        private URI regenerateUrl;

        /** Management URL reinitializing the discovery service; no-op when unset */
        private URI discoveryReinitUrl;

        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(120);
    }
}
