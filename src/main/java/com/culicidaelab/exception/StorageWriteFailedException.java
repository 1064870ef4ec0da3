package com.culicidaelab.exception;

/**
 * A write to the document store failed; the record was not stored
 */
public class StorageWriteFailedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StorageWriteFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
