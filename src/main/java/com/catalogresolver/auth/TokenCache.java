package com.catalogresolver.auth;

import com.catalogresolver.AuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Holds one client's bearer token and refreshes it on demand.
 * <p>
 * Only one exchange runs per expiry window: callers arriving while a refresh is in progress
 * wait on the lock and then reuse the token it installed.
 */
public class TokenCache {

    private static final Logger log = LoggerFactory.getLogger(TokenCache.class);

    private final TokenSource source;
    private final Clock clock;
    private final Object refreshLock = new Object();
    private volatile AccessToken token;

    public TokenCache(TokenSource source) {
        this(source, Clock.systemUTC());
    }

    public TokenCache(TokenSource source, Clock clock) {
        this.source = source;
        this.clock = clock;
    }

    /**
     * Returns a token that is valid now, exchanging credentials first if none is held or the held one expired.
     */
    public AccessToken ensureValid() throws AuthException, InterruptedException {
        AccessToken cached = token;
        if (cached != null && !cached.isExpired(clock.instant())) {
            return cached;
        }

        synchronized (refreshLock) {
            cached = token;
            if (cached != null && !cached.isExpired(clock.instant())) {
                return cached;
            }

            AccessToken fresh = source.exchange();
            if (fresh == null || fresh.value() == null || fresh.value().isBlank() || fresh.expiresAt() == null) {
                throw new AuthException("Token exchange returned no usable token");
            }
            token = fresh;
            log.debug("Installed new access token valid until {}", fresh.expiresAt());
            return fresh;
        }
    }

    /**
     * The token currently held, without refreshing it.
     */
    public Optional<AccessToken> current() {
        return Optional.ofNullable(token);
    }

    /**
     * Drops the held token so the next {@link #ensureValid()} performs an exchange.
     */
    public void invalidate() {
        synchronized (refreshLock) {
            token = null;
        }
    }
}
