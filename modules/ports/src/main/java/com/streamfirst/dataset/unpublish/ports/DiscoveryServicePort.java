package com.streamfirst.dataset.unpublish.ports;

/** Port for the downstream discovery service caching the serving layer's index. */
public interface DiscoveryServicePort {

    /**
     * Asks the discovery service to reload its view of the serving layer.
     *
     * @throws IllegalStateException if the service cannot be reached
     */
    void reinitialize();
}
