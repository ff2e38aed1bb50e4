package com.eyelevel.sheetextractor.storage;

import com.eyelevel.sheetextractor.exception.StorageException;

import java.io.InputStream;

/**
 * Read access to uploaded document bytes.
 */
public interface ObjectStore {

    /**
     * Opens the object stored under {@code storageRef}. The caller closes the stream.
     *
     * @throws StorageException if the object is missing or cannot be read.
     */
    InputStream get(String storageRef);
}
