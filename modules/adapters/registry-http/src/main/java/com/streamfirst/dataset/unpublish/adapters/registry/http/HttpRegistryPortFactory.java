package com.streamfirst.dataset.unpublish.adapters.registry.http;

import com.streamfirst.dataset.unpublish.domain.UnpublishException;
import com.streamfirst.dataset.unpublish.ports.RegistryPort;
import com.streamfirst.dataset.unpublish.ports.RegistryPortFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Creates HTTP registry transports from one set of connection settings. */
@Slf4j
@RequiredArgsConstructor
public class HttpRegistryPortFactory implements RegistryPortFactory {

    private final HttpRegistrySettings settings;

    @Override
    public RegistryPort create(Transport transport) {
        switch (transport) {
            case LEGACY_RPC:
                requireConfigured(settings.getLegacyServiceUri() != null, transport);
                log.debug("Creating legacy registry client for {}", settings.getLegacyServiceUri());
                return new LegacyRpcRegistryAdapter(settings);
            case REST:
                requireConfigured(settings.getRestServiceUri() != null, transport);
                log.debug("Creating REST registry client for {}", settings.getRestServiceUri());
                return new RestRegistryAdapter(settings);
            default:
                throw UnpublishException.configuration("Unknown registry transport " + transport);
        }
    }

    private static void requireConfigured(boolean configured, Transport transport) {
        if (!configured) {
            throw UnpublishException.configuration(
                    "No service URI configured for registry transport " + transport);
        }
    }
}
