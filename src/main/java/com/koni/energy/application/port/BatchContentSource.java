package com.koni.energy.application.port;

/**
 * Port interface for reading batch contents from wherever the scheduler left them.
 * Implemented by infrastructure adapters (local filesystem, object storage, ...).
 */
public interface BatchContentSource {

    /**
     * Reads the full contents of a batch.
     *
     * @param batchLocator opaque reference carried by the intake event
     * @return the batch contents as text
     * @throws com.koni.energy.domain.exception.BatchFetchException if the contents cannot be read
     */
    String fetch(String batchLocator);
}
