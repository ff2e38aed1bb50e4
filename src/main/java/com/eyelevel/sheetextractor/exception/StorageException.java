package com.eyelevel.sheetextractor.exception;

import java.io.Serial;

/**
 * The object store could not serve a document's bytes.
 */
public class StorageException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 5069117380236424471L;

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
