package com.streamfirst.dataset.unpublish.ports;

/** Port for the file store holding the serving layer's catalog files. */
public interface FileStorePort {

    /**
     * Checks whether a catalog file exists.
     *
     * @param location path relative to the store root
     * @return true if the file exists
     */
    boolean exists(String location);

    /**
     * Deletes a catalog file.
     *
     * @param location path relative to the store root
     * @return true if a file was deleted, false if there was none
     * @throws java.io.UncheckedIOException if the file exists but cannot be deleted
     */
    boolean delete(String location);
}
