package com.streamfirst.dataset.unpublish.adapters.registry.http;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.Map;
import java.util.Objects;

/**
 * Registry transport for the REST publication service: {@code POST <base>/ws/delete} and {@code
 * POST <base>/ws/retract} with the dataset identifier as form field {@code id}.
 */
public class RestRegistryAdapter extends AbstractHttpRegistryAdapter {

    private final URI baseUri;

    public RestRegistryAdapter(HttpRegistrySettings settings) {
        this(newClient(settings), settings);
    }

    RestRegistryAdapter(HttpClient client, HttpRegistrySettings settings) {
        super(client, settings);
        URI base =
                Objects.requireNonNull(
                        settings.getRestServiceUri(), "REST registry service URI is not configured");
        this.baseUri = base.toString().endsWith("/") ? base : URI.create(base + "/");
    }

    @Override
    public void delete(String identifier) {
        post(baseUri.resolve("ws/delete"), Map.of("id", identifier), identifier);
    }

    @Override
    public void retract(String identifier) {
        post(baseUri.resolve("ws/retract"), Map.of("id", identifier), identifier);
    }
}
