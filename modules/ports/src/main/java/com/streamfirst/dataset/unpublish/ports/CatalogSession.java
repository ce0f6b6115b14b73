package com.streamfirst.dataset.unpublish.ports;

import com.streamfirst.dataset.unpublish.domain.*;

import java.util.List;
import java.util.Optional;

/**
 * Unit of work against the local catalog. Reads observe the session's own uncommitted changes.
 * Closing a session discards anything not yet committed.
 */
public interface CatalogSession extends AutoCloseable {

    /**
     * Looks up a dataset with all of its current versions.
     *
     * @param name the dataset name
     * @return the dataset, or empty if the catalog has no such dataset
     */
    Optional<Dataset> findDataset(String name);

    /**
     * Finds the serving-layer catalog entry of a dataset version.
     *
     * @return the entry, or empty if the version never had one
     */
    Optional<CatalogEntry> findCatalogEntry(String datasetName, int version);

    /** Removes a catalog entry record. Removing a missing entry does nothing. */
    void deleteCatalogEntry(CatalogEntry entry);

    /**
     * Removes one version row of a dataset.
     *
     * @throws IllegalArgumentException if the dataset has no such version
     */
    void deleteVersion(DatasetVersion version);

    /**
     * Removes the dataset row together with its owned child records (versions, variables and
     * warnings). Catalog entries and events are kept.
     *
     * @throws IllegalArgumentException if the dataset does not exist
     */
    void deleteDataset(String datasetName);

    /** Removes the derived variable records of a dataset's latest-version projection. */
    void deleteVariables(String datasetName);

    /** Lists the variable names currently recorded for a dataset. */
    List<String> listVariables(String datasetName);

    /** Appends an event to the catalog's event log. */
    void appendEvent(DatasetEvent event);

    /** Lists the events recorded for a dataset, oldest first. */
    List<DatasetEvent> listEvents(String datasetName);

    /** Attaches a warning to a dataset. */
    void addWarning(DatasetWarning warning);

    /** Removes the warnings a module attached to a dataset. */
    void clearWarnings(String datasetName, DatasetWarning.Module module);

    /** Lists the warnings attached to a dataset. */
    List<DatasetWarning> listWarnings(String datasetName);

    /** Makes the session's changes durable. The session stays usable afterwards. */
    void commit();

    /** Discards changes made since the last commit. */
    void rollback();

    /** Releases the session, discarding uncommitted changes. */
    @Override
    void close();
}
