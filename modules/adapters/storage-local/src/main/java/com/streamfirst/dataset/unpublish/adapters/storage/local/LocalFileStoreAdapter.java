package com.streamfirst.dataset.unpublish.adapters.storage.local;

import com.streamfirst.dataset.unpublish.ports.FileStorePort;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * FileStorePort over a directory tree on the local file system, such as the root directory the
 * serving layer renders its catalog files into. Locations are resolved against the root and may
 * not escape it.
 */
@Slf4j
public final class LocalFileStoreAdapter implements FileStorePort {

    private final Path root;

    public LocalFileStoreAdapter(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public boolean exists(String location) {
        return Files.isRegularFile(resolve(location));
    }

    @Override
    public boolean delete(String location) {
        Path path = resolve(location);
        try {
            boolean deleted = Files.deleteIfExists(path);
            log.debug("Delete {}: {}", path, deleted ? "removed" : "not present");
            return deleted;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete catalog file " + path, e);
        }
    }

    public Path getRoot() {
        return root;
    }

    private Path resolve(String location) {
        Path path = root.resolve(location).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException(
                    "Catalog location " + location + " is outside the store root " + root);
        }
        return path;
    }
}
