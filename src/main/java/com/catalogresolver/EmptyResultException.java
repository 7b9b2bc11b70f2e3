package com.catalogresolver;

public class EmptyResultException extends CatalogException {

    public EmptyResultException(String message) {
        super(message);
    }
}
