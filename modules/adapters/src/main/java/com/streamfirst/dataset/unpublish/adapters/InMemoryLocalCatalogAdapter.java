package com.streamfirst.dataset.unpublish.adapters;

import com.streamfirst.dataset.unpublish.domain.*;
import com.streamfirst.dataset.unpublish.ports.CatalogSession;
import com.streamfirst.dataset.unpublish.ports.LocalCatalogPort;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * In-memory implementation of LocalCatalogPort for testing and development. Each session works on
 * a private copy of the catalog which replaces the shared state on commit. Data is lost when the
 * application stops - not suitable for production use.
 */
@Slf4j
public class InMemoryLocalCatalogAdapter implements LocalCatalogPort {

    private CatalogState committed = new CatalogState();
    private int commitCount;

    @Override
    public CatalogSession openSession() {
        return new Session();
    }

    /** Registers a dataset version together with its serving-layer catalog location. */
    public synchronized void addVersion(String datasetName, int version, String catalogLocation) {
        committed.versions.computeIfAbsent(datasetName, k -> new TreeSet<>()).add(version);
        if (catalogLocation != null) {
            committed.catalogEntries.put(
                    key(datasetName, version), new CatalogEntry(datasetName, version, catalogLocation));
        }
        log.debug("Added version {} of dataset {}", version, datasetName);
    }

    /** Registers a dataset version without a serving-layer catalog. */
    public void addVersion(String datasetName, int version) {
        addVersion(datasetName, version, null);
    }

    /** Records the derived variables of a dataset's latest version. */
    public synchronized void addVariables(String datasetName, String... variables) {
        committed.variables
                .computeIfAbsent(datasetName, k -> new ArrayList<>())
                .addAll(Arrays.asList(variables));
    }

    public synchronized Optional<Dataset> getDataset(String name) {
        return committed.dataset(name);
    }

    public synchronized Optional<CatalogEntry> getCatalogEntry(String datasetName, int version) {
        return Optional.ofNullable(committed.catalogEntries.get(key(datasetName, version)));
    }

    public synchronized List<DatasetEvent> getEvents(String datasetName) {
        return committed.events(datasetName);
    }

    /** Returns every committed event, oldest first. */
    public synchronized List<DatasetEvent> getAllEvents() {
        return List.copyOf(committed.events);
    }

    public synchronized List<DatasetWarning> getWarnings(String datasetName) {
        return committed.warnings(datasetName);
    }

    public synchronized List<String> getVariables(String datasetName) {
        return List.copyOf(committed.variables.getOrDefault(datasetName, List.of()));
    }

    /** Gets the number of commits made through sessions. */
    public synchronized int getCommitCount() {
        return commitCount;
    }

    private synchronized CatalogState snapshot() {
        return committed.copy();
    }

    private synchronized void replace(CatalogState state) {
        committed = state.copy();
        commitCount++;
    }

    private static String key(String datasetName, int version) {
        return datasetName + "#" + version;
    }

    private class Session implements CatalogSession {
        private CatalogState working = snapshot();
        private boolean closed;

        @Override
        public Optional<Dataset> findDataset(String name) {
            checkOpen();
            return working.dataset(name);
        }

        @Override
        public Optional<CatalogEntry> findCatalogEntry(String datasetName, int version) {
            checkOpen();
            return Optional.ofNullable(working.catalogEntries.get(key(datasetName, version)));
        }

        @Override
        public void deleteCatalogEntry(CatalogEntry entry) {
            checkOpen();
            working.catalogEntries.remove(key(entry.datasetName(), entry.version()));
        }

        @Override
        public void deleteVersion(DatasetVersion version) {
            checkOpen();
            SortedSet<Integer> versions = working.versions.get(version.datasetName());
            if (versions == null || !versions.remove(version.version())) {
                throw new IllegalArgumentException("Version " + version + " does not exist");
            }
            if (versions.isEmpty()) {
                // a dataset row never outlives its last version
                working.versions.remove(version.datasetName());
                working.variables.remove(version.datasetName());
            }
        }

        @Override
        public void deleteDataset(String datasetName) {
            checkOpen();
            if (working.versions.remove(datasetName) == null) {
                throw new IllegalArgumentException("Dataset " + datasetName + " does not exist");
            }
            working.variables.remove(datasetName);
            working.warnings.removeIf(w -> w.getDatasetName().equals(datasetName));
        }

        @Override
        public void deleteVariables(String datasetName) {
            checkOpen();
            working.variables.remove(datasetName);
        }

        @Override
        public List<String> listVariables(String datasetName) {
            checkOpen();
            return List.copyOf(working.variables.getOrDefault(datasetName, List.of()));
        }

        @Override
        public void appendEvent(DatasetEvent event) {
            checkOpen();
            working.events.add(event);
        }

        @Override
        public List<DatasetEvent> listEvents(String datasetName) {
            checkOpen();
            return working.events(datasetName);
        }

        @Override
        public void addWarning(DatasetWarning warning) {
            checkOpen();
            working.warnings.add(warning);
        }

        @Override
        public void clearWarnings(String datasetName, DatasetWarning.Module module) {
            checkOpen();
            working.warnings.removeIf(
                    w -> w.getDatasetName().equals(datasetName) && w.getModule() == module);
        }

        @Override
        public List<DatasetWarning> listWarnings(String datasetName) {
            checkOpen();
            return working.warnings(datasetName);
        }

        @Override
        public void commit() {
            checkOpen();
            replace(working);
            log.debug("Committed catalog session");
        }

        @Override
        public void rollback() {
            checkOpen();
            working = snapshot();
            log.debug("Rolled back catalog session");
        }

        @Override
        public void close() {
            closed = true;
        }

        private void checkOpen() {
            if (closed) {
                throw new IllegalStateException("Catalog session is closed");
            }
        }
    }

    /** Mutable catalog contents; copied on session open and commit. */
    private static final class CatalogState {
        final Map<String, SortedSet<Integer>> versions = new TreeMap<>();
        final Map<String, CatalogEntry> catalogEntries = new HashMap<>();
        final Map<String, List<String>> variables = new HashMap<>();
        final List<DatasetWarning> warnings = new ArrayList<>();
        final List<DatasetEvent> events = new ArrayList<>();

        CatalogState copy() {
            CatalogState copy = new CatalogState();
            versions.forEach((name, numbers) -> copy.versions.put(name, new TreeSet<>(numbers)));
            copy.catalogEntries.putAll(catalogEntries);
            variables.forEach((name, vars) -> copy.variables.put(name, new ArrayList<>(vars)));
            copy.warnings.addAll(warnings);
            copy.events.addAll(events);
            return copy;
        }

        Optional<Dataset> dataset(String name) {
            SortedSet<Integer> numbers = versions.get(name);
            if (numbers == null || numbers.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(
                    Dataset.of(name, numbers.stream().mapToInt(Integer::intValue).toArray()));
        }

        List<DatasetEvent> events(String datasetName) {
            return events.stream().filter(e -> e.getDatasetName().equals(datasetName)).toList();
        }

        List<DatasetWarning> warnings(String datasetName) {
            return warnings.stream().filter(w -> w.getDatasetName().equals(datasetName)).toList();
        }
    }
}
