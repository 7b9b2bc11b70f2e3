package com.catalogresolver.applemusic;

import com.catalogresolver.AbstractCatalogClient;
import com.catalogresolver.CatalogException;
import com.catalogresolver.MalformedResponseException;
import com.catalogresolver.ResolverSettings;
import com.catalogresolver.auth.TokenCache;
import com.catalogresolver.model.Album;
import com.catalogresolver.model.Artist;
import com.catalogresolver.model.Track;
import com.catalogresolver.paging.Page;
import com.catalogresolver.paging.PageFetcher;
import com.catalogresolver.paging.WaveSource;
import com.catalogresolver.route.Route;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Apple Music catalog client. Playlist tracks are chained through {@code next} cursors, each one the
 * path of the following page, so pages are discovered wave by wave.
 */
public class AppleMusicClient extends AbstractCatalogClient {

    public static final String DEFAULT_API_BASE = "https://api.music.apple.com";
    public static final String DEFAULT_WEB_BASE = "https://music.apple.com";
    public static final int DEFAULT_PLAYLIST_CONCURRENCY = 6;

    private final String apiBase;

    public AppleMusicClient() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                new ObjectMapper(),
                ResolverSettings.defaults(DEFAULT_PLAYLIST_CONCURRENCY),
                DEFAULT_API_BASE,
                DEFAULT_WEB_BASE,
                Clock.systemUTC());
    }

    public AppleMusicClient(ResolverSettings settings) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                new ObjectMapper(),
                settings,
                DEFAULT_API_BASE,
                DEFAULT_WEB_BASE,
                Clock.systemUTC());
    }

    public AppleMusicClient(HttpClient http, ObjectMapper mapper, ResolverSettings settings,
                            String apiBase, String webBase, Clock clock) {
        super(http, mapper, settings, new AppleMusicRouteParser(), new TokenCache(
                new AppleMusicTokenSource(http, mapper, baseOrDefault(webBase, DEFAULT_WEB_BASE), settings.requestTimeout()),
                clock));
        this.apiBase = baseOrDefault(apiBase, DEFAULT_API_BASE);
    }

    @Override
    public String getName() {
        return "Apple Music";
    }

    @Override
    protected HttpRequest.Builder authorizedRequest(URI uri) {
        return super.authorizedRequest(uri).header("Origin", "https://apple.com");
    }

    @Override
    protected JsonNode fetchDocument(Route route) throws CatalogException, InterruptedException {
        JsonNode root = requireJson(resourceUri(route));
        JsonNode data = root.path("data");
        if (!data.isArray() || data.size() == 0) {
            throw new MalformedResponseException("Apple Music response for " + route.id() + " contains no data");
        }
        return data.get(0);
    }

    private URI resourceUri(Route route) {
        return URI.create(apiBase + "/v1/catalog/" + route.region() + "/"
                + AppleMusicRouteParser.apiType(route.type()) + "/" + route.id());
    }

    @Override
    protected Track mapTrack(JsonNode document) {
        return AppleMusicEntityMapper.song(document);
    }

    @Override
    protected Album mapAlbum(JsonNode document) {
        return AppleMusicEntityMapper.album(document);
    }

    @Override
    protected Artist resolveArtist(Route route, JsonNode document) throws CatalogException, InterruptedException {
        JsonNode topSongs = requireJson(URI.create(resourceUri(route) + "/view/top-songs"));
        return AppleMusicEntityMapper.artist(document, topSongs.path("data"));
    }

    @Override
    protected PlaylistPages openPlaylist(Route route, JsonNode document) {
        JsonNode trackData = document.path("relationships").path("tracks");
        List<Track> firstPage = AppleMusicEntityMapper.songs(trackData.path("data"));
        String firstCursor = trackData.path("next").asText(null);

        PageFetcher<String, Track> fetcher = cursor -> {
            JsonNode page = fetchPageJson(URI.create(apiBase + cursor));
            return Page.of(AppleMusicEntityMapper.songs(page.path("data")), page.path("next").asText(null));
        };
        WaveSource<Track> remaining = paginator.cursorWaves(firstCursor, settings.maxCursorWaves(), fetcher);

        JsonNode attributes = document.path("attributes");
        return new PlaylistPages(
                attributes.path("name").asText(null),
                attributes.path("curatorName").asText(null),
                document.path("id").asText(route.id()),
                attributes.path("url").asText(null),
                AppleMusicEntityMapper.artworkUrl(attributes.path("artwork")),
                trackData.path("meta").path("total").asInt(firstPage.size()),
                firstPage,
                remaining
        );
    }
}
