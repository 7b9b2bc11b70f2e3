package com.catalogresolver;

/**
 * The input does not match any URL shape the client understands, or names the wrong kind of resource.
 */
public class InvalidUrlException extends CatalogException {

    public InvalidUrlException(String message) {
        super(message);
    }
}
