package com.streamfirst.dataset.unpublish.domain;

import java.util.Locale;

/** What to do with a dataset in the remote registry. */
public enum RegistryOperation {
    /** Purge all registry metadata */
    DELETE(EventKind.REGISTRY_DELETE_SUCCEEDED, EventKind.REGISTRY_DELETE_FAILED),
    /** Withdraw discoverability, keeping the underlying records */
    RETRACT(EventKind.REGISTRY_RETRACT_SUCCEEDED, EventKind.REGISTRY_RETRACT_FAILED),
    /** Leave the registry untouched */
    NO_OPERATION(null, null);

    private final EventKind successEvent;
    private final EventKind failureEvent;

    RegistryOperation(EventKind successEvent, EventKind failureEvent) {
        this.successEvent = successEvent;
        this.failureEvent = failureEvent;
    }

    public EventKind successEvent() {
        requireRemoteCall();
        return successEvent;
    }

    public EventKind failureEvent() {
        requireRemoteCall();
        return failureEvent;
    }

    public boolean callsRegistry() {
        return this != NO_OPERATION;
    }

    private void requireRemoteCall() {
        if (!callsRegistry()) {
            throw new IllegalStateException(this + " does not call the registry");
        }
    }

    /**
     * Parses an operation name from configuration. Accepts the constant names case-insensitively,
     * plus "unpublish" for {@link #RETRACT} and "none" for {@link #NO_OPERATION}.
     *
     * @throws UnpublishException of kind {@link UnpublishException.Kind#CONFIGURATION} for any
     *     other value
     */
    public static RegistryOperation parse(String value) {
        if (value == null) {
            throw UnpublishException.configuration("Registry operation is not set");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        switch (normalized) {
            case "UNPUBLISH":
                return RETRACT;
            case "NONE":
                return NO_OPERATION;
            default:
                try {
                    return valueOf(normalized);
                } catch (IllegalArgumentException e) {
                    throw UnpublishException.configuration("Invalid registry operation: " + value);
                }
        }
    }
}
