package com.streamfirst.dataset.unpublish.domain;

import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * Result of one registry call. A failure carries the truncated rejection message reported by the
 * registry.
 */
@Value
public class RegistryOutcome {
    @NonNull String target;
    @NonNull EventKind eventKind;
    boolean succeeded;
    String reason;

    public static RegistryOutcome succeeded(String target, EventKind eventKind) {
        return new RegistryOutcome(target, eventKind, true, null);
    }

    public static RegistryOutcome failed(String target, EventKind eventKind, String reason) {
        return new RegistryOutcome(target, eventKind, false, reason);
    }

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return succeeded
                ? "RegistryOutcome.succeeded(" + target + ", " + eventKind + ")"
                : "RegistryOutcome.failed(" + target + ", " + eventKind + ", " + reason + ")";
    }
}
