package com.culicidaelab.store;

/**
 * A store call did not complete within its bounded timeout
 */
public class StoreTimeoutException extends StoreException {

    private static final long serialVersionUID = 1L;

    public StoreTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
