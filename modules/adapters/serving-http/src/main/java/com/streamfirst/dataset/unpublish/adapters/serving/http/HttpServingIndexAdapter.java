package com.streamfirst.dataset.unpublish.adapters.serving.http;

import com.streamfirst.dataset.unpublish.ports.ServingIndexPort;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

/** Asks the serving layer to rebuild its aggregate index through its management URL. */
public class HttpServingIndexAdapter implements ServingIndexPort {

    private final HttpTrigger trigger;

    public HttpServingIndexAdapter(URI regenerateUri, Duration connectTimeout, Duration timeout) {
        this(HttpTrigger.newClient(connectTimeout), regenerateUri, timeout);
    }

    HttpServingIndexAdapter(HttpClient client, URI regenerateUri, Duration timeout) {
        this.trigger = new HttpTrigger(client, regenerateUri, timeout);
    }

    @Override
    public void regenerateIndex() {
        trigger.fire("Serving index regeneration");
    }
}
