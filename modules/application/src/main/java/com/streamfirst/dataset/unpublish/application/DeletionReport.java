package com.streamfirst.dataset.unpublish.application;

import com.streamfirst.dataset.unpublish.domain.EventKind;
import com.streamfirst.dataset.unpublish.domain.RepublishCandidate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of a deletion run.
 *
 * <p>{@link #outcomes()} maps each requested identifier to the registry event recorded for it. An
 * identifier without an entry never reached the registry. {@link #republishList()} is present
 * only when the run asked for republish candidates.
 */
public final class DeletionReport {

    private final Map<String, EventKind> outcomes;
    private final List<RepublishCandidate> republishList;

    DeletionReport(Map<String, EventKind> outcomes, List<RepublishCandidate> republishList) {
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        this.republishList = republishList == null ? null : List.copyOf(republishList);
    }

    public Map<String, EventKind> outcomes() {
        return outcomes;
    }

    public Optional<EventKind> outcome(String identifier) {
        return Optional.ofNullable(outcomes.get(identifier));
    }

    public Optional<List<RepublishCandidate>> republishList() {
        return Optional.ofNullable(republishList);
    }

    /** Returns true if every registry call of the run succeeded. */
    public boolean allSucceeded() {
        return outcomes.values().stream().noneMatch(EventKind::isRegistryFailure);
    }

    @Override
    public String toString() {
        return "DeletionReport{outcomes=" + outcomes + ", republishList=" + republishList + '}';
    }
}
