package com.catalogresolver;

/**
 * The credential exchange failed or returned data the client could not use.
 */
public class AuthException extends CatalogException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
