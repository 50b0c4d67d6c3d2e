package com.isobolt.generator.store;

/**
 * Thrown when a store lookup, create or delete cannot be carried out.
 */
public class StoreOperationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StoreOperationException(String message) {
        super(message);
    }

    public StoreOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
