package com.streamfirst.dataset.unpublish.ports;

/** Port for the serving layer's aggregate index built from the local catalog. */
public interface ServingIndexPort {

    /**
     * Regenerates the aggregate index so it no longer references removed catalog files.
     *
     * @throws IllegalStateException if the serving layer cannot be reached
     */
    void regenerateIndex();
}
