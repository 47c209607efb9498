package com.koni.energy.application.port;

/**
 * Port interface for handing new batch contents over to storage, where the content source
 * later reads them from.
 */
public interface BatchContentStore {

    /**
     * Writes a batch under the given name.
     *
     * @param batchName name of the batch relative to the storage root
     * @param content the batch contents
     * @return the locator under which the batch can be fetched
     * @throws com.koni.energy.domain.exception.BatchStoreException if the contents cannot be written
     */
    String store(String batchName, String content);
}
