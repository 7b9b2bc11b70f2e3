package com.catalogresolver.model;

/**
 * Anything a catalog URL can resolve to. Callers switch on {@link #getType()}.
 */
public interface CatalogEntity {

    EntityType getType();

    String getId();

    String getUri();
}
