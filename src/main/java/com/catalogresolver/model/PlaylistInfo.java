package com.catalogresolver.model;

/**
 * Descriptive reference from a track back to the playlist it was loaded from.
 */
public record PlaylistInfo(
        String id,
        String name,
        String uri
) {}
