package com.streamfirst.dataset.unpublish.application;

/** Receives progress of a deletion run, for display only. */
@FunctionalInterface
public interface ProgressListener {

    /** A listener that ignores all reports. */
    ProgressListener NONE = value -> {};

    void onProgress(double value);
}
