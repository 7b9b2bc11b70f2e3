package com.catalogresolver;

import java.time.Duration;

/**
 * Tuning knobs of one catalog client.
 *
 * @param playlistConcurrency maximum page requests in flight at once, clamped to at least 1
 * @param playlistPageLimit   maximum number of pages fetched after the first, or null for no cap
 * @param batchSize           size of the lists emitted by the streaming variant; does not change the API page size
 * @param maxCursorWaves      maximum waves spent following cursor chains
 * @param requestTimeout      timeout applied to every HTTP request
 */
public record ResolverSettings(
        int playlistConcurrency,
        Integer playlistPageLimit,
        int batchSize,
        int maxCursorWaves,
        Duration requestTimeout
) {

    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final int DEFAULT_MAX_CURSOR_WAVES = 50;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(15);

    public ResolverSettings {
        playlistConcurrency = Math.max(1, playlistConcurrency);
        playlistPageLimit = (playlistPageLimit != null) ? Math.max(0, playlistPageLimit) : null;
        batchSize = (batchSize > 0) ? batchSize : DEFAULT_BATCH_SIZE;
        maxCursorWaves = Math.max(0, maxCursorWaves);
        requestTimeout = (requestTimeout != null && !requestTimeout.isNegative() && !requestTimeout.isZero())
                ? requestTimeout
                : DEFAULT_REQUEST_TIMEOUT;
    }

    public static ResolverSettings defaults(int playlistConcurrency) {
        return new ResolverSettings(playlistConcurrency, null, DEFAULT_BATCH_SIZE, DEFAULT_MAX_CURSOR_WAVES, DEFAULT_REQUEST_TIMEOUT);
    }

    /**
     * Defaults overridden by whatever {@link Config} provides.
     */
    public static ResolverSettings fromConfig(int defaultConcurrency) {
        Integer concurrency = Config.getPlaylistConcurrency();
        Integer batch = Config.getPlaylistBatchSize();
        return new ResolverSettings(
                concurrency != null ? concurrency : defaultConcurrency,
                Config.getPlaylistPageLimit(),
                batch != null ? batch : DEFAULT_BATCH_SIZE,
                DEFAULT_MAX_CURSOR_WAVES,
                DEFAULT_REQUEST_TIMEOUT
        );
    }

    public ResolverSettings withPlaylistConcurrency(int value) {
        return new ResolverSettings(value, playlistPageLimit, batchSize, maxCursorWaves, requestTimeout);
    }

    public ResolverSettings withPlaylistPageLimit(Integer value) {
        return new ResolverSettings(playlistConcurrency, value, batchSize, maxCursorWaves, requestTimeout);
    }

    public ResolverSettings withBatchSize(int value) {
        return new ResolverSettings(playlistConcurrency, playlistPageLimit, value, maxCursorWaves, requestTimeout);
    }

    public ResolverSettings withMaxCursorWaves(int value) {
        return new ResolverSettings(playlistConcurrency, playlistPageLimit, batchSize, value, requestTimeout);
    }

    public ResolverSettings withRequestTimeout(Duration value) {
        return new ResolverSettings(playlistConcurrency, playlistPageLimit, batchSize, maxCursorWaves, value);
    }
}
