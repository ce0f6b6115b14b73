package com.streamfirst.dataset.unpublish.ports;

/**
 * Port for the remote metadata registry that makes published datasets discoverable.
 *
 * <p>Both operations are idempotent from the caller's point of view. Failures are reported as
 * {@link com.streamfirst.dataset.unpublish.domain.UnpublishException}: kind {@code
 * REMOTE_REJECTION} when the registry refused the request for this identifier, kind {@code
 * TRANSPORT_FAULT} when the registry could not be reached at all.
 */
public interface RegistryPort {

    /**
     * Purges all registry metadata of a dataset or dataset version.
     *
     * @param identifier the dataset name, version name or composite identifier
     */
    void delete(String identifier);

    /**
     * Withdraws a dataset or dataset version from discovery.
     *
     * @param identifier the dataset name, version name or composite identifier
     */
    void retract(String identifier);

    /** Describes the credentials the transport presents, for diagnostics. */
    default String credentialDescription() {
        return "none";
    }
}
