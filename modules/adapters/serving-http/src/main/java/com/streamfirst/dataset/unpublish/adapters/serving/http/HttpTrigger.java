package com.streamfirst.dataset.unpublish.adapters.serving.http;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Fires a GET request at a management URL of a downstream server, such as its reinitialization
 * endpoint. Anything but a 2xx answer is a failure.
 */
@Slf4j
final class HttpTrigger {

    private final HttpClient client;
    private final URI uri;
    private final Duration timeout;

    HttpTrigger(HttpClient client, URI uri, Duration timeout) {
        this.client = client;
        this.uri = Objects.requireNonNull(uri, "Trigger URI cannot be null");
        this.timeout = timeout;
    }

    static HttpClient newClient(Duration connectTimeout) {
        return HttpClient.newBuilder().connectTimeout(connectTimeout).build();
    }

    void fire(String description) {
        HttpRequest request = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new IllegalStateException(description + " failed: cannot reach " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(description + " interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new IllegalStateException(
                    description + " failed: " + uri + " answered HTTP " + response.statusCode());
        }
        log.debug("{} accepted by {}", description, uri);
    }
}
