package com.streamfirst.dataset.unpublish.adapters.registry.http;

import com.streamfirst.dataset.unpublish.domain.UnpublishException;
import com.streamfirst.dataset.unpublish.ports.RegistryPort;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Shared plumbing of the HTTP registry transports: form-encoded POST requests, with I/O failures
 * reported as transport faults and non-2xx responses as rejections of the target.
 */
@Slf4j
abstract class AbstractHttpRegistryAdapter implements RegistryPort {

    private final HttpClient client;
    private final HttpRegistrySettings settings;

    AbstractHttpRegistryAdapter(HttpClient client, HttpRegistrySettings settings) {
        this.client = client;
        this.settings = settings;
    }

    @Override
    public String credentialDescription() {
        return settings.getCertificatePath().isEmpty() ? "(none)" : settings.getCertificatePath();
    }

    /**
     * Posts a form to the registry.
     *
     * @param uri the endpoint
     * @param form form fields, encoded in iteration order
     * @param identifier the dataset the call is about, for rejection messages
     */
    protected void post(URI uri, Map<String, String> form, String identifier) {
        HttpRequest request =
                HttpRequest.newBuilder(uri)
                        .timeout(settings.getRequestTimeout())
                        .header("Content-Type", "application/x-www-form-urlencoded")
                        .POST(HttpRequest.BodyPublishers.ofString(encode(form)))
                        .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw UnpublishException.transportFault(
                    "Cannot reach registry at " + uri + ": " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw UnpublishException.transportFault("Interrupted calling registry at " + uri, e);
        }

        int status = response.statusCode();
        log.debug("Registry answered {} for {} {}", status, uri, identifier);
        if (status / 100 != 2) {
            String body = response.body() == null ? "" : response.body().strip();
            throw UnpublishException.remoteRejection(
                    identifier, body.isEmpty() ? "HTTP status " + status : body);
        }
    }

    static HttpClient newClient(HttpRegistrySettings settings) {
        return HttpClient.newBuilder()
                .connectTimeout(settings.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    private static String encode(Map<String, String> form) {
        return form.entrySet().stream()
                .map(
                        e ->
                                URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                                        + "="
                                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
