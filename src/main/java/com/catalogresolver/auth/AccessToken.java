package com.catalogresolver.auth;

import java.time.Instant;

/**
 * Bearer credential plus the instant from which it must no longer be used.
 */
public record AccessToken(
        String value,
        Instant expiresAt
) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public String bearerHeader() {
        return "Bearer " + value;
    }
}
