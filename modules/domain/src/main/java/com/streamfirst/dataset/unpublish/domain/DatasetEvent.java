package com.streamfirst.dataset.unpublish.domain;

import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/** Immutable entry of a dataset's append-only lifecycle history. */
@Value
public class DatasetEvent {
    @NonNull String datasetName;

    /** The version the event refers to */
    int version;

    @NonNull EventKind kind;

    @NonNull Instant timestamp;

    @Override
    public String toString() {
        return "DatasetEvent{" + kind + " " + datasetName + " v" + version + " at " + timestamp + '}';
    }
}
