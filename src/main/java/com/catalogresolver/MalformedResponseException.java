package com.catalogresolver;

/**
 * A provider document is missing a field the entity mappers cannot do without.
 */
public class MalformedResponseException extends RuntimeException {

    public MalformedResponseException(String message) {
        super(message);
    }
}
