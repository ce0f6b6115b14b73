package com.streamfirst.dataset.unpublish.adapters;

import com.streamfirst.dataset.unpublish.ports.FileStorePort;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory implementation of FileStorePort for testing and development. */
@Slf4j
public class InMemoryFileStoreAdapter implements FileStorePort {

    private final Set<String> files = ConcurrentHashMap.newKeySet();

    public void put(String location) {
        files.add(location);
    }

    @Override
    public boolean exists(String location) {
        return files.contains(location);
    }

    @Override
    public boolean delete(String location) {
        boolean deleted = files.remove(location);
        log.debug("Delete {}: {}", location, deleted ? "removed" : "not present");
        return deleted;
    }
}
