package com.streamfirst.dataset.unpublish.application;

import com.streamfirst.dataset.unpublish.domain.*;
import com.streamfirst.dataset.unpublish.ports.CatalogSession;
import com.streamfirst.dataset.unpublish.ports.RegistryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Deletes or retracts single targets in the remote registry and records the outcome on the local
 * dataset, when there is one.
 *
 * <p>A rejection by the registry concerns one target only and is returned as a failed outcome.
 * A transport fault means the registry cannot be reached at all and is rethrown with the
 * credentials in use, since every following call would fail the same way.
 */
@Slf4j
@RequiredArgsConstructor
public class RegistryDeletionClient {

    /** Lines of a rejection message kept in the dataset warning */
    static final int WARNING_LINES = 2;

    private final RegistryPort registry;
    private final CatalogSession session;
    private final Clock clock;

    /**
     * Applies a registry operation to one target.
     *
     * @param operation {@link RegistryOperation#DELETE} or {@link RegistryOperation#RETRACT}
     * @param target the identifier sent to the registry
     * @param dataset the local dataset the target belongs to, or null if unknown locally
     * @return the outcome; failed if the registry rejected the request
     * @throws UnpublishException of kind {@code TRANSPORT_FAULT} if the registry is unreachable
     */
    public RegistryOutcome apply(RegistryOperation operation, String target, Dataset dataset) {
        if (!operation.callsRegistry()) {
            throw new IllegalArgumentException("Operation " + operation + " does not call the registry");
        }

        if (dataset != null) {
            session.clearWarnings(dataset.getName(), DatasetWarning.Module.PUBLISH);
        }

        try {
            if (operation == RegistryOperation.DELETE) {
                log.info("Deleting {}", target);
                registry.delete(target);
            } else {
                log.info("Retracting {}", target);
                registry.retract(target);
            }
        } catch (UnpublishException e) {
            switch (e.kind()) {
                case REMOTE_REJECTION:
                    return recordRejection(operation, target, dataset, e);
                case TRANSPORT_FAULT:
                    throw UnpublishException.transportFault(
                            "Registry unreachable while processing "
                                    + target
                                    + ": "
                                    + e.originalMessage()
                                    + "\nAre the client credentials "
                                    + registry.credentialDescription()
                                    + " valid?",
                            e);
                default:
                    throw e;
            }
        }

        EventKind successEvent = operation.successEvent();
        if (dataset != null) {
            recordEvent(dataset, successEvent);
        }
        return RegistryOutcome.succeeded(target, successEvent);
    }

    private RegistryOutcome recordRejection(
            RegistryOperation operation, String target, Dataset dataset, UnpublishException e) {
        String reason = e.firstLines(WARNING_LINES);
        EventKind failureEvent = operation.failureEvent();
        log.error("Deletion/retraction failed for dataset {} with message: {}", target, reason);
        if (dataset != null) {
            session.addWarning(
                    new DatasetWarning(
                            dataset.getName(),
                            DatasetWarning.Module.PUBLISH,
                            DatasetWarning.Level.ERROR,
                            "Deletion/retraction failed for dataset "
                                    + target
                                    + " with message: "
                                    + reason));
            recordEvent(dataset, failureEvent);
        }
        return RegistryOutcome.failed(target, failureEvent, reason);
    }

    private void recordEvent(Dataset dataset, EventKind kind) {
        session.appendEvent(
                new DatasetEvent(dataset.getName(), dataset.latestVersionNumber(), kind, clock.instant()));
    }
}
