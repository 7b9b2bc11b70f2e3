package com.catalogresolver;

/**
 * Base of all failures a resolve call can surface to its caller.
 */
public class CatalogException extends Exception {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
