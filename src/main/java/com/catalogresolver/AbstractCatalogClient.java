package com.catalogresolver;

import com.catalogresolver.auth.AccessToken;
import com.catalogresolver.auth.TokenCache;
import com.catalogresolver.model.Album;
import com.catalogresolver.model.Artist;
import com.catalogresolver.model.CatalogEntity;
import com.catalogresolver.model.EntityType;
import com.catalogresolver.model.Playlist;
import com.catalogresolver.model.PlaylistInfo;
import com.catalogresolver.model.Track;
import com.catalogresolver.paging.PageResult;
import com.catalogresolver.paging.Paginator;
import com.catalogresolver.paging.WaveSource;
import com.catalogresolver.route.Route;
import com.catalogresolver.route.RouteParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Shared resolve flow: ensure token, parse route, fetch the resource document, map it and, for
 * playlists, paginate the rest. Providers supply the URL shapes, endpoints and mappers.
 */
public abstract class AbstractCatalogClient implements CatalogClient {

    private static final Logger log = LoggerFactory.getLogger(AbstractCatalogClient.class);

    protected final HttpClient http;
    protected final ObjectMapper mapper;
    protected final ResolverSettings settings;
    protected final TokenCache tokens;
    protected final Paginator paginator;
    private final RouteParser routeParser;

    protected AbstractCatalogClient(HttpClient http, ObjectMapper mapper, ResolverSettings settings,
                                    RouteParser routeParser, TokenCache tokens) {
        this.http = http;
        this.mapper = mapper;
        this.settings = settings;
        this.routeParser = routeParser;
        this.tokens = tokens;
        this.paginator = new Paginator(settings.playlistConcurrency());
    }

    @Override
    public boolean supports(String url) {
        return url != null && routeParser.matches(url.trim());
    }

    @Override
    public CatalogEntity resolve(String url) throws CatalogException, InterruptedException {
        tokens.ensureValid();
        Route route = parseRoute(url);
        JsonNode document = fetchDocument(route);
        log.debug("{} resolved {} {}", getName(), route.type(), route.id());

        return switch (route.type()) {
            case TRACK -> mapTrack(document);
            case ALBUM -> requireTracks(mapAlbum(document));
            case ARTIST -> resolveArtist(route, document);
            case PLAYLIST -> resolvePlaylist(route, document);
        };
    }

    @Override
    public Stream<List<Track>> streamPlaylist(String url) throws CatalogException, InterruptedException {
        return streamPlaylist(url, settings.batchSize());
    }

    @Override
    public Stream<List<Track>> streamPlaylist(String url, int batchSize) throws CatalogException, InterruptedException {
        tokens.ensureValid();
        Route route = parseRoute(url);
        if (route.type() != EntityType.PLAYLIST) {
            throw new InvalidUrlException("Provided query is not a valid " + getName() + " playlist URL.");
        }
        PlaylistPages pages = openPlaylist(route, fetchDocument(route));
        requireFirstPage(pages);

        PlaylistInfo info = pages.info();
        return paginator.stream(pages.firstPage(), pages.remaining(), batchSize)
                .map(batch -> linkTracks(batch, info));
    }

    protected Route parseRoute(String url) throws InvalidUrlException {
        if (url == null || url.isBlank()) {
            throw new InvalidUrlException("The " + getName() + " link provided is not valid.");
        }
        return routeParser.parse(url.trim());
    }

    private Playlist resolvePlaylist(Route route, JsonNode document) throws CatalogException, InterruptedException {
        PlaylistPages pages = openPlaylist(route, document);
        requireFirstPage(pages);
        PageResult<Track> result = paginator.collect(pages.firstPage(), pages.remaining());
        if (result.items().isEmpty()) {
            throw emptyPlaylist();
        }
        return pages.toPlaylist(result);
    }

    /**
     * A first page without playable tracks is only fatal when no later page can follow it; skipped
     * podcast episodes may fill the whole first page.
     */
    private void requireFirstPage(PlaylistPages pages) throws EmptyResultException {
        if (pages.firstPage().isEmpty() && !pages.remaining().hasNextWave()) {
            pages.remaining().close();
            throw emptyPlaylist();
        }
    }

    private static EmptyResultException emptyPlaylist() {
        return new EmptyResultException("This playlist is empty and therefore cannot be resolved.");
    }

    private Album requireTracks(Album album) throws EmptyResultException {
        if (album.getTracks().isEmpty()) {
            throw new EmptyResultException("This album has no tracks and therefore cannot be resolved.");
        }
        return album;
    }

    private static List<Track> linkTracks(List<Track> batch, PlaylistInfo info) {
        List<Track> linked = new ArrayList<>(batch.size());
        for (Track track : batch) {
            linked.add(track.withParentPlaylist(info));
        }
        return linked;
    }

    // =========================================================================
    // Provider hooks
    // =========================================================================

    /**
     * Fetches the document describing the routed resource. Failures are required-path failures.
     */
    protected abstract JsonNode fetchDocument(Route route) throws CatalogException, InterruptedException;

    protected abstract Track mapTrack(JsonNode document);

    protected abstract Album mapAlbum(JsonNode document);

    protected abstract Artist resolveArtist(Route route, JsonNode document) throws CatalogException, InterruptedException;

    /**
     * Maps the first page of a playlist document and prepares the waves that fetch the rest.
     */
    protected abstract PlaylistPages openPlaylist(Route route, JsonNode document);

    // =========================================================================
    // HTTP
    // =========================================================================

    protected HttpRequest.Builder baseRequest(URI uri) {
        return HttpRequest.newBuilder(uri)
                .timeout(settings.requestTimeout())
                .header("Accept", "application/json");
    }

    protected HttpRequest.Builder authorizedRequest(URI uri) {
        String bearer = tokens.current()
                .map(AccessToken::bearerHeader)
                .orElseThrow(() -> new IllegalStateException("No access token held by " + getName() + " client"));
        return baseRequest(uri).header("Authorization", bearer);
    }

    /**
     * GETs a JSON document on the required path: any failure surfaces as {@link RequestException}.
     */
    protected JsonNode requireJson(URI uri) throws RequestException, InterruptedException {
        HttpResponse<String> resp;
        try {
            resp = http.send(authorizedRequest(uri).GET().build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RequestException(e.getClass().getSimpleName() + " for " + uri.getPath(), e);
        }
        if (resp.statusCode() != 200) {
            throw new RequestException(resp.statusCode(), reasonPhrase(resp.statusCode()));
        }
        try {
            JsonNode root = mapper.readTree(resp.body());
            log.debug("Made request to {} API with status {}", getName(), resp.statusCode());
            return root;
        } catch (IOException e) {
            throw new RequestException("unreadable response body from " + uri.getPath(), e);
        }
    }

    /**
     * GETs one pagination page. Exceptions thrown here mark the page as failed.
     */
    protected JsonNode fetchPageJson(URI uri) throws IOException, InterruptedException, RequestException {
        HttpResponse<String> resp = http.send(authorizedRequest(uri).GET().build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (resp.statusCode() != 200) {
            throw new RequestException(resp.statusCode(), reasonPhrase(resp.statusCode()));
        }
        return mapper.readTree(resp.body());
    }

    /**
     * Trims a configured base URL and drops its trailing slash, falling back when it is blank.
     */
    protected static String baseOrDefault(String base, String fallback) {
        if (base == null || base.isBlank()) {
            return fallback;
        }
        String trimmed = base.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    static String reasonPhrase(int statusCode) {
        return switch (statusCode) {
            case 400 -> "Bad Request";
            case 401 -> "Unauthorized";
            case 403 -> "Forbidden";
            case 404 -> "Not Found";
            case 429 -> "Too Many Requests";
            case 500 -> "Internal Server Error";
            case 502 -> "Bad Gateway";
            case 503 -> "Service Unavailable";
            case 504 -> "Gateway Timeout";
            default -> "HTTP " + statusCode;
        };
    }

    @Override
    public void close() {
        paginator.close();
    }

    /**
     * First page of a playlist plus the source of its remaining pages.
     */
    public record PlaylistPages(
            String name,
            String owner,
            String id,
            String uri,
            String thumbnail,
            int reportedTotal,
            List<Track> firstPage,
            WaveSource<Track> remaining
    ) {

        PlaylistInfo info() {
            return new PlaylistInfo(id, name, uri);
        }

        Playlist toPlaylist(PageResult<Track> result) {
            return new Playlist(name, owner, id, uri, thumbnail, result.items(), reportedTotal, result.failedPages());
        }
    }
}
