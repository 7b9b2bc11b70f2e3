package com.catalogresolver.auth;

import com.catalogresolver.AuthException;

/**
 * Performs one blocking credential exchange against a provider.
 */
@FunctionalInterface
public interface TokenSource {

    AccessToken exchange() throws AuthException, InterruptedException;
}
