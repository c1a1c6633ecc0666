package com.baselinesentinel.core.spi;

/**
 * The cluster inventory could not be queried.
 */
public class InventoryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InventoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
