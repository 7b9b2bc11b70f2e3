package com.catalogresolver.spotify;

import com.catalogresolver.AbstractCatalogClient;
import com.catalogresolver.CatalogException;
import com.catalogresolver.InvalidUrlException;
import com.catalogresolver.ResolverSettings;
import com.catalogresolver.auth.TokenCache;
import com.catalogresolver.model.Album;
import com.catalogresolver.model.Artist;
import com.catalogresolver.model.EntityType;
import com.catalogresolver.model.Track;
import com.catalogresolver.paging.Page;
import com.catalogresolver.paging.PageFetcher;
import com.catalogresolver.paging.Paginator;
import com.catalogresolver.paging.WaveSource;
import com.catalogresolver.route.Route;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Spotify Web API client. Playlists are paginated by offset: the first document reports the page
 * size and total, so every remaining offset is known before the first wave is sent.
 */
public class SpotifyClient extends AbstractCatalogClient {

    public static final String DEFAULT_API_BASE = "https://api.spotify.com";
    public static final String DEFAULT_ACCOUNTS_BASE = "https://accounts.spotify.com";
    public static final int DEFAULT_PLAYLIST_CONCURRENCY = 10;

    // Playlist pages after the first only need the fields the mapper reads.
    static final String PAGE_FIELDS =
            "items(track(name,duration_ms,id,type,is_local,external_urls,external_ids,artists(name),album(images))),next";

    private final String apiBase;
    private final String market;

    public SpotifyClient(String clientId, String clientSecret) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                new ObjectMapper(),
                clientId,
                clientSecret,
                ResolverSettings.defaults(DEFAULT_PLAYLIST_CONCURRENCY),
                DEFAULT_API_BASE,
                DEFAULT_ACCOUNTS_BASE,
                "US",
                Clock.systemUTC());
    }

    public SpotifyClient(HttpClient http, ObjectMapper mapper, String clientId, String clientSecret,
                         ResolverSettings settings, String apiBase, String accountsBase, String market, Clock clock) {
        super(http, mapper, settings, new SpotifyRouteParser(), new TokenCache(
                new SpotifyTokenSource(http, mapper, baseOrDefault(accountsBase, DEFAULT_ACCOUNTS_BASE),
                        clientId, clientSecret, settings.requestTimeout(), clock),
                clock));
        this.apiBase = baseOrDefault(apiBase, DEFAULT_API_BASE);
        this.market = (market == null || market.isBlank()) ? "US" : market.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public String getName() {
        return "Spotify";
    }

    @Override
    protected JsonNode fetchDocument(Route route) throws CatalogException, InterruptedException {
        return requireJson(resourceUri(route));
    }

    private URI resourceUri(Route route) {
        return URI.create(apiBase + "/v1/" + route.type().name().toLowerCase(Locale.ROOT) + "s/" + route.id());
    }

    @Override
    protected Track mapTrack(JsonNode document) {
        return SpotifyEntityMapper.track(document);
    }

    @Override
    protected Album mapAlbum(JsonNode document) {
        return SpotifyEntityMapper.album(document);
    }

    @Override
    protected Artist resolveArtist(Route route, JsonNode document) throws CatalogException, InterruptedException {
        JsonNode topTracks = requireJson(URI.create(resourceUri(route) + "/top-tracks?market=" + market));
        return SpotifyEntityMapper.artist(document, topTracks.path("tracks"));
    }

    @Override
    protected PlaylistPages openPlaylist(Route route, JsonNode document) {
        JsonNode tracks = document.path("tracks");
        List<Track> firstPage = SpotifyEntityMapper.playlistTracks(tracks.path("items"));
        int total = tracks.path("total").asInt(firstPage.size());
        int limit = tracks.path("limit").asInt(firstPage.size());

        List<Integer> offsets = Paginator.remainingOffsets(limit, total, settings.playlistPageLimit());
        PageFetcher<Integer, Track> fetcher = offset -> {
            JsonNode page = fetchPageJson(pageUri(route.id(), offset, limit));
            return Page.of(SpotifyEntityMapper.playlistTracks(page.path("items")));
        };
        WaveSource<Track> remaining = paginator.offsetWaves(offsets, fetcher);

        return new PlaylistPages(
                document.path("name").asText(null),
                document.path("owner").path("display_name").asText(null),
                document.path("id").asText(route.id()),
                document.path("external_urls").path("spotify").asText(null),
                SpotifyEntityMapper.firstImage(document.path("images")),
                total,
                firstPage,
                remaining
        );
    }

    private URI pageUri(String playlistId, int offset, int limit) {
        return URI.create(apiBase + "/v1/playlists/" + playlistId + "/tracks?offset=" + offset
                + "&limit=" + limit + "&fields=" + urlEncode(PAGE_FIELDS));
    }

    /**
     * Tracks Spotify recommends for the track behind {@code trackUrl}.
     */
    public List<Track> recommendations(String trackUrl) throws CatalogException, InterruptedException {
        tokens.ensureValid();
        Route route = parseRoute(trackUrl);
        if (route.type() != EntityType.TRACK) {
            throw new InvalidUrlException("The provided query is not a Spotify track.");
        }
        JsonNode root = requireJson(URI.create(apiBase + "/v1/recommendations?seed_tracks=" + route.id()));
        return SpotifyEntityMapper.tracks(root.path("tracks"));
    }

    /**
     * Free text track search.
     */
    public List<Track> searchTracks(String query) throws CatalogException, InterruptedException {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        tokens.ensureValid();
        JsonNode root = requireJson(URI.create(apiBase + "/v1/search?q=" + urlEncode(query.trim()) + "&type=track"));
        return SpotifyEntityMapper.tracks(root.path("tracks").path("items"));
    }

    private static String urlEncode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
