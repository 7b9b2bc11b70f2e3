package com.catalogresolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide configuration. Sources in increasing precedence:
 * {@code .env} in the working directory, {@code ~/CatalogResolver/config.properties}, environment variables.
 */
public final class Config {

    private static final Logger log = LoggerFactory.getLogger(Config.class);

    private static final Path DOT_ENV_FILE = Path.of(".env");
    private static final Path PROPERTIES_FILE = Path.of(System.getProperty("user.home"), "CatalogResolver", "config.properties");

    private static final Set<String> KNOWN_KEYS = Set.of(
            "SPOTIFY_CLIENT_ID",
            "SPOTIFY_CLIENT_SECRET",
            "SPOTIFY_MARKET",
            "APPLE_MUSIC_ENABLED",
            "PLAYLIST_CONCURRENCY",
            "PLAYLIST_PAGE_LIMIT",
            "PLAYLIST_BATCH_SIZE"
    );

    private static final Map<String, String> cache = new ConcurrentHashMap<>();
    private static final List<String> loadedSources = new ArrayList<>();
    private static volatile boolean initialized;

    private Config() {}

    private static synchronized void loadIfNeeded() {
        if (initialized) return;

        loadFromDotEnvIfPresent(DOT_ENV_FILE);
        loadFromPropertiesIfPresent(PROPERTIES_FILE);

        for (String key : KNOWN_KEYS) {
            String value = System.getenv(key);
            if (value != null && !value.isBlank()) {
                cache.put(key, value.trim());
            }
        }
        loadedSources.add("environment");
        initialized = true;
    }

    private static void loadFromDotEnvIfPresent(Path file) {
        if (!Files.isRegularFile(file)) return;
        try {
            for (String raw : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String line = raw.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                int idx = line.indexOf('=');
                if (idx <= 0) continue;
                String key = line.substring(0, idx).trim();
                if (!KNOWN_KEYS.contains(key)) continue;
                String value = stripQuotes(line.substring(idx + 1).trim());
                if (!value.isEmpty()) {
                    cache.put(key, value);
                }
            }
            loadedSources.add(file.toString());
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
        }
    }

    private static void loadFromPropertiesIfPresent(Path file) {
        if (!Files.isRegularFile(file)) return;
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return;
        }
        for (String key : KNOWN_KEYS) {
            String value = props.getProperty(key);
            if (value != null && !value.isBlank()) {
                cache.put(key, value.trim());
            }
        }
        loadedSources.add(file.toString());
    }

    private static String stripQuotes(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static String get(String key) {
        loadIfNeeded();
        return cache.get(key);
    }

    private static Integer getInt(String key) {
        String value = get(key);
        if (value == null) return null;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric value for {}: {}", key, value);
            return null;
        }
    }

    public static String getSpotifyClientId() {
        return get("SPOTIFY_CLIENT_ID");
    }

    public static String getSpotifyClientSecret() {
        return get("SPOTIFY_CLIENT_SECRET");
    }

    public static boolean hasSpotifyCredentials() {
        String id = getSpotifyClientId();
        String secret = getSpotifyClientSecret();
        return id != null && !id.isBlank() && secret != null && !secret.isBlank();
    }

    public static String getSpotifyMarket() {
        String market = get("SPOTIFY_MARKET");
        return (market == null || market.isBlank()) ? "US" : market.trim().toUpperCase();
    }

    public static boolean isAppleMusicEnabled() {
        String value = get("APPLE_MUSIC_ENABLED");
        return value == null || !value.trim().equalsIgnoreCase("false");
    }

    public static Integer getPlaylistConcurrency() {
        return getInt("PLAYLIST_CONCURRENCY");
    }

    public static Integer getPlaylistPageLimit() {
        return getInt("PLAYLIST_PAGE_LIMIT");
    }

    public static Integer getPlaylistBatchSize() {
        return getInt("PLAYLIST_BATCH_SIZE");
    }

    public static void printStatus() {
        loadIfNeeded();
        log.info("Configuration sources: {}", loadedSources);
        log.info("Spotify credentials: {}", hasSpotifyCredentials() ? "configured" : "missing");
        log.info("Apple Music: {}", isAppleMusicEnabled() ? "enabled" : "disabled");
    }
}
