package com.catalogresolver;

import com.catalogresolver.applemusic.AppleMusicClient;
import com.catalogresolver.applemusic.AppleMusicRouteParser;
import com.catalogresolver.model.CatalogEntity;
import com.catalogresolver.model.Track;
import com.catalogresolver.spotify.SpotifyClient;
import com.catalogresolver.spotify.SpotifyRouteParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Entry point for embedding code: hands each URL to the configured client that understands it.
 */
public class CatalogResolver implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CatalogResolver.class);
    private static final SpotifyRouteParser SPOTIFY_URLS = new SpotifyRouteParser();
    private static final AppleMusicRouteParser APPLE_MUSIC_URLS = new AppleMusicRouteParser();

    private final List<CatalogClient> clients;

    public CatalogResolver(List<CatalogClient> clients) {
        this.clients = List.copyOf(clients);
    }

    /**
     * Builds the clients {@link Config} enables: Spotify when credentials are present, Apple Music unless disabled.
     */
    public static CatalogResolver fromConfig() {
        List<CatalogClient> clients = new ArrayList<>();
        if (Config.hasSpotifyCredentials()) {
            clients.add(new SpotifyClient(
                    HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                    new ObjectMapper(),
                    Config.getSpotifyClientId(),
                    Config.getSpotifyClientSecret(),
                    ResolverSettings.fromConfig(SpotifyClient.DEFAULT_PLAYLIST_CONCURRENCY),
                    SpotifyClient.DEFAULT_API_BASE,
                    SpotifyClient.DEFAULT_ACCOUNTS_BASE,
                    Config.getSpotifyMarket(),
                    Clock.systemUTC()));
        } else {
            log.info("Spotify credentials missing, Spotify links will be rejected");
        }
        if (Config.isAppleMusicEnabled()) {
            clients.add(new AppleMusicClient(ResolverSettings.fromConfig(AppleMusicClient.DEFAULT_PLAYLIST_CONCURRENCY)));
        }
        return new CatalogResolver(clients);
    }

    public Optional<CatalogClient> findClient(String url) {
        for (CatalogClient client : clients) {
            if (client.supports(url)) {
                return Optional.of(client);
            }
        }
        return Optional.empty();
    }

    public CatalogEntity resolve(String url) throws CatalogException, InterruptedException {
        return requireClient(url).resolve(url);
    }

    public Stream<List<Track>> streamPlaylist(String url) throws CatalogException, InterruptedException {
        return requireClient(url).streamPlaylist(url);
    }

    public Stream<List<Track>> streamPlaylist(String url, int batchSize) throws CatalogException, InterruptedException {
        return requireClient(url).streamPlaylist(url, batchSize);
    }

    private CatalogClient requireClient(String url) throws CatalogException {
        String trimmed = (url == null) ? null : url.trim();
        Optional<CatalogClient> client = findClient(trimmed);
        if (client.isPresent()) {
            return client.get();
        }
        if (SPOTIFY_URLS.matches(trimmed)) {
            throw new AuthException("No Spotify client authorization was provided; set SPOTIFY_CLIENT_ID and SPOTIFY_CLIENT_SECRET.");
        }
        if (APPLE_MUSIC_URLS.matches(trimmed)) {
            throw new AuthException("An Apple Music link was passed in but Apple Music support is not enabled.");
        }
        throw new InvalidUrlException("No catalog provider recognises the link provided.");
    }

    @Override
    public void close() {
        for (CatalogClient client : clients) {
            client.close();
        }
    }
}
