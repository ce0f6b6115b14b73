package com.streamfirst.dataset.unpublish.adapters.serving.http;

import com.streamfirst.dataset.unpublish.ports.DiscoveryServicePort;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

/** Reinitializes the discovery service through its management URL. */
public class HttpDiscoveryServiceAdapter implements DiscoveryServicePort {

    private final HttpTrigger trigger;

    public HttpDiscoveryServiceAdapter(URI reinitUri, Duration connectTimeout, Duration timeout) {
        this(HttpTrigger.newClient(connectTimeout), reinitUri, timeout);
    }

    HttpDiscoveryServiceAdapter(HttpClient client, URI reinitUri, Duration timeout) {
        this.trigger = new HttpTrigger(client, reinitUri, timeout);
    }

    @Override
    public void reinitialize() {
        trigger.fire("Discovery service reinitialization");
    }
}
