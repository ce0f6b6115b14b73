package com.streamfirst.dataset.unpublish.domain;

import java.util.Objects;

/**
 * Failure raised while retracting or deleting datasets. The {@link Kind} tells callers how to
 * react; the message of the underlying failure is preserved unchanged in {@link
 * #originalMessage()} so nobody has to parse the formatted message.
 */
public class UnpublishException extends RuntimeException {

    public enum Kind {
        /** No local dataset or version matches an identifier */
        NOT_FOUND,
        /** Connectivity or credential failure talking to the registry; affects the whole batch */
        TRANSPORT_FAULT,
        /** The registry refused the operation for one target */
        REMOTE_REJECTION,
        /** Invalid settings, detected before any side effect */
        CONFIGURATION
    }

    private final Kind kind;
    private final String originalMessage;

    public UnpublishException(Kind kind, String message, String originalMessage, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.originalMessage = originalMessage == null ? "" : originalMessage;
    }

    public static UnpublishException configuration(String message) {
        return new UnpublishException(Kind.CONFIGURATION, message, message, null);
    }

    public static UnpublishException remoteRejection(String target, String registryMessage) {
        return new UnpublishException(
                Kind.REMOTE_REJECTION,
                "Registry rejected the request for " + target + ": " + registryMessage,
                registryMessage,
                null);
    }

    public static UnpublishException transportFault(String message, Throwable cause) {
        String original = cause == null ? message : String.valueOf(cause.getMessage());
        return new UnpublishException(Kind.TRANSPORT_FAULT, message, original, cause);
    }

    public Kind kind() {
        return kind;
    }

    public String originalMessage() {
        return originalMessage;
    }

    /** Returns the first {@code count} lines of the original message joined by spaces. */
    public String firstLines(int count) {
        String[] lines = originalMessage.split("\\R");
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < Math.min(count, lines.length); i++) {
            if (i > 0) {
                result.append(' ');
            }
            result.append(lines[i].trim());
        }
        return result.toString();
    }
}
