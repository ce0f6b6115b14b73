package com.streamfirst.dataset.unpublish.adapters.registry.http;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Registry transport for the legacy remote-call publication service. Every call is a POST of the
 * remote method name and its arguments to a single service endpoint.
 */
public class LegacyRpcRegistryAdapter extends AbstractHttpRegistryAdapter {

    private final URI serviceUri;

    public LegacyRpcRegistryAdapter(HttpRegistrySettings settings) {
        this(newClient(settings), settings);
    }

    LegacyRpcRegistryAdapter(HttpClient client, HttpRegistrySettings settings) {
        super(client, settings);
        this.serviceUri =
                Objects.requireNonNull(
                        settings.getLegacyServiceUri(), "Legacy registry service URI is not configured");
    }

    @Override
    public void delete(String identifier) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("method", "deleteDataset");
        form.put("datasetId", identifier);
        form.put("recursive", "true");
        form.put("message", "Deleting dataset");
        post(serviceUri, form, identifier);
    }

    @Override
    public void retract(String identifier) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("method", "retractDataset");
        form.put("datasetId", identifier);
        form.put("message", "Retracting dataset");
        post(serviceUri, form, identifier);
    }
}
