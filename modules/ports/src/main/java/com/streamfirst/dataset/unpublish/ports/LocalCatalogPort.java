package com.streamfirst.dataset.unpublish.ports;

/**
 * Port for the relational catalog of datasets held on this node. All reads and writes go through
 * a {@link CatalogSession}, the catalog's unit of work.
 */
public interface LocalCatalogPort {

    /**
     * Opens a new unit of work. Changes made through the session become visible to other sessions
     * only after {@link CatalogSession#commit()}.
     *
     * @return a new session; the caller must close it
     */
    CatalogSession openSession();
}
