package com.streamfirst.dataset.unpublish.domain;

import lombok.NonNull;
import lombok.Value;

/**
 * A status note attached to a dataset, such as a failed registry call. Warnings are grouped by
 * the module that raised them so a module can clear its own notes before retrying.
 */
@Value
public class DatasetWarning {
    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    public enum Module {
        /** Registry publication and retraction */
        PUBLISH,
        /** Serving-layer catalog generation */
        SERVING
    }

    @NonNull String datasetName;
    @NonNull Module module;
    @NonNull Level level;
    @NonNull String message;
}
