package com.streamfirst.dataset.unpublish.ports;

/** Creates registry clients for a transport flavor. */
public interface RegistryPortFactory {

    /** Registry transport flavors. */
    enum Transport {
        /** Remote-procedure-call service of older registry deployments */
        LEGACY_RPC,
        /** REST publication service */
        REST
    }

    /**
     * Creates a registry client.
     *
     * @param transport the transport flavor to use
     * @return a client bound to that transport
     * @throws com.streamfirst.dataset.unpublish.domain.UnpublishException of kind {@code
     *     CONFIGURATION} if the transport is not configured
     */
    RegistryPort create(Transport transport);
}
