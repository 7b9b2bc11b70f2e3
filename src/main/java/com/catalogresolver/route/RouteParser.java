package com.catalogresolver.route;

import com.catalogresolver.InvalidUrlException;

public interface RouteParser {

    /**
     * True if the URL has one of the shapes {@link #parse(String)} accepts.
     */
    boolean matches(String url);

    Route parse(String url) throws InvalidUrlException;
}
