package com.streamfirst.dataset.unpublish.adapters.registry.http;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.net.URI;
import java.time.Duration;

/** Connection settings of the HTTP registry transports. */
@Value
@Builder
public class HttpRegistrySettings {
    /** Endpoint of the legacy remote-call service; null when that transport is not deployed */
    URI legacyServiceUri;

    /** Base URI of the REST publication service; null when that transport is not deployed */
    URI restServiceUri;

    /** Client certificate presented to the registry, reported in transport fault messages */
    @Builder.Default String certificatePath = "";

    @NonNull @Builder.Default Duration connectTimeout = Duration.ofSeconds(10);

    @NonNull @Builder.Default Duration requestTimeout = Duration.ofSeconds(60);
}
