package com.streamfirst.dataset.unpublish.application;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps completed steps onto the caller's progress range. Reported values never decrease and stay
 * within [initial, last]. Listener failures are logged and otherwise ignored.
 */
@Slf4j
class ProgressTracker {

    private final ProgressListener listener;
    private final double initial;
    private final double last;
    private final int totalSteps;
    private int completedSteps;

    ProgressTracker(ProgressListener listener, double initial, double last, int totalSteps) {
        this.listener = listener;
        this.initial = initial;
        this.last = last;
        this.totalSteps = Math.max(totalSteps, 1);
    }

    void start() {
        report(initial);
    }

    void advance() {
        if (completedSteps < totalSteps) {
            completedSteps++;
        }
        report(initial + (last - initial) * completedSteps / totalSteps);
    }

    void finish() {
        completedSteps = totalSteps;
        report(last);
    }

    private void report(double value) {
        try {
            listener.onProgress(value);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed at {}", value, e);
        }
    }
}
