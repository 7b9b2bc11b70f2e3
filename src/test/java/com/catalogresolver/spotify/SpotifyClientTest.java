package com.catalogresolver.spotify;

import com.catalogresolver.AuthException;
import com.catalogresolver.EmptyResultException;
import com.catalogresolver.InvalidUrlException;
import com.catalogresolver.RequestException;
import com.catalogresolver.ResolverSettings;
import com.catalogresolver.model.Album;
import com.catalogresolver.model.Artist;
import com.catalogresolver.model.Playlist;
import com.catalogresolver.model.Track;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SpotifyClientTest {

    private static final int PAGE_SIZE = 100;

    private HttpServer server;
    private ExecutorService serverPool;
    private String baseUrl;
    private SpotifyClient client;

    private final AtomicInteger tokenRequests = new AtomicInteger();
    private final AtomicInteger pageRequests = new AtomicInteger();
    private final AtomicInteger activePages = new AtomicInteger();
    private final AtomicInteger peakPages = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        serverPool = Executors.newFixedThreadPool(16);
        server.setExecutor(serverPool);

        server.createContext("/api/token", ex -> {
            tokenRequests.incrementAndGet();
            String expected = "Basic " + Base64.getEncoder()
                    .encodeToString("client-id:client-secret".getBytes(StandardCharsets.UTF_8));
            String body = new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            if (!"POST".equals(ex.getRequestMethod())
                    || !expected.equals(ex.getRequestHeaders().getFirst("Authorization"))
                    || !body.equals("grant_type=client_credentials")) {
                Json.respond(ex, 401, "{\"error\":\"invalid_client\"}");
                return;
            }
            Json.respond(ex, 200, "{\"access_token\":\"test-token\",\"token_type\":\"Bearer\",\"expires_in\":3600}");
        });
        server.createContext("/bad-accounts/api/token", ex -> Json.respond(ex, 401, "{\"error\":\"invalid_client\"}"));

        server.createContext("/v1/tracks", ex -> {
            if (!authorized(ex)) return;
            if (ex.getRequestURI().getPath().equals("/v1/tracks/track1")) {
                Json.respond(ex, 200, trackJson("track1"));
            } else {
                Json.respond(ex, 404, "{\"error\":{\"status\":404,\"message\":\"Non existing id\"}}");
            }
        });
        server.createContext("/v1/albums", ex -> {
            if (!authorized(ex)) return;
            String path = ex.getRequestURI().getPath();
            if (path.equals("/v1/albums/album1")) {
                Json.respond(ex, 200, """
                        {
                          "id": "album1",
                          "name": "Discovery",
                          "artists": [ { "name": "Daft Punk" } ],
                          "external_urls": { "spotify": "https://open.spotify.com/album/album1" },
                          "images": [ { "url": "https://i.scdn.co/image/cover" } ],
                          "tracks": { "items": [
                            { "id": "a1", "name": "One More Time", "duration_ms": 320000, "artists": [ { "name": "Daft Punk" } ] },
                            { "id": "a2", "name": "Aerodynamic", "duration_ms": 212000, "artists": [ { "name": "Daft Punk" } ] }
                          ] }
                        }
                        """);
            } else {
                Json.respond(ex, 200, "{\"id\":\"empty\",\"name\":\"Nothing\",\"tracks\":{\"items\":[]}}");
            }
        });
        server.createContext("/v1/artists", ex -> {
            if (!authorized(ex)) return;
            String path = ex.getRequestURI().getPath();
            if (path.equals("/v1/artists/artist1/top-tracks")) {
                String query = ex.getRequestURI().getRawQuery();
                if (!"market=DE".equals(query)) {
                    Json.respond(ex, 400, "{}");
                    return;
                }
                Json.respond(ex, 200, "{\"tracks\":[" + trackJson("top1") + "," + trackJson("top2") + "]}");
                return;
            }
            Json.respond(ex, 200, """
                    {
                      "id": "artist1",
                      "name": "Daft Punk",
                      "genres": [ "french house", "electro" ],
                      "external_urls": { "spotify": "https://open.spotify.com/artist/artist1" },
                      "images": [ { "url": "https://i.scdn.co/image/artist" } ]
                    }
                    """);
        });
        server.createContext("/v1/playlists", this::handlePlaylist);
        server.createContext("/v1/recommendations", ex -> {
            if (!authorized(ex)) return;
            if (!"seed_tracks=track1".equals(ex.getRequestURI().getRawQuery())) {
                Json.respond(ex, 400, "{}");
                return;
            }
            Json.respond(ex, 200, "{\"tracks\":[" + trackJson("rec1") + "," + trackJson("rec2") + "," + trackJson("rec3") + "]}");
        });
        server.createContext("/v1/search", ex -> {
            if (!authorized(ex)) return;
            String query = ex.getRequestURI().getRawQuery();
            if (query == null || !query.contains("q=daft+punk") || !query.contains("type=track")) {
                Json.respond(ex, 400, "{}");
                return;
            }
            Json.respond(ex, 200, "{\"tracks\":{\"items\":[" + trackJson("found1") + "]}}");
        });
        server.start();

        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        client = newClient(ResolverSettings.defaults(4), baseUrl);
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.stop(0);
        }
        if (serverPool != null) {
            serverPool.shutdownNow();
        }
    }

    @Test
    void resolvesTrack() throws Exception {
        Track track = (Track) client.resolve("https://open.spotify.com/track/track1?si=abc");

        assertEquals("Song track1", track.getTitle());
        assertEquals("Daft Punk, Pharrell Williams", track.getAuthor());
        assertEquals("track1", track.getIdentifier());
        assertEquals("https://open.spotify.com/track/track1", track.getUri());
        assertEquals(200000, track.getDurationMs());
        assertFalse(track.isStream());
        assertEquals("https://i.scdn.co/image/track1", track.getThumbnail().orElseThrow());
        assertEquals("ISRC-track1", track.getIsrc().orElseThrow());
    }

    @Test
    void resolvesAlbumWithCoverOnEveryTrack() throws Exception {
        Album album = (Album) client.resolve("https://open.spotify.com/album/album1");

        assertEquals("Discovery", album.getName());
        assertEquals("Daft Punk", album.getArtist());
        assertEquals(2, album.getTracks().size());
        assertEquals("Aerodynamic", album.getTracks().get(1).getTitle());
        assertEquals("https://i.scdn.co/image/cover", album.getTracks().get(0).getThumbnail().orElseThrow());
    }

    @Test
    void emptyAlbumIsRejected() {
        assertThrows(EmptyResultException.class, () -> client.resolve("https://open.spotify.com/album/emptyalbum"));
    }

    @Test
    void resolvesArtistWithTopTracksForMarket() throws Exception {
        Artist artist = (Artist) client.resolve("https://open.spotify.com/artist/artist1");

        assertEquals("Daft Punk", artist.getName());
        assertEquals(List.of("french house", "electro"), artist.getGenres());
        assertEquals(List.of("top1", "top2"),
                artist.getTopTracks().stream().map(Track::getIdentifier).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("250 tracks at 100 per page load completely with at most 4 requests in flight")
    void resolvesLargePlaylistInOrder() throws Exception {
        Playlist playlist = (Playlist) client.resolve("https://open.spotify.com/playlist/big250");

        assertEquals(250, playlist.getTrackCount());
        assertEquals(250, playlist.getReportedTotal());
        assertFalse(playlist.isDegraded());
        assertEquals("Big Playlist", playlist.getName());
        assertEquals("curator", playlist.getOwner());
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 250; i++) {
            expected.add("t" + i);
        }
        assertEquals(expected, playlist.getTracks().stream().map(Track::getIdentifier).collect(Collectors.toList()));
        assertEquals("big250", playlist.getTracks().get(249).getParentPlaylist().orElseThrow().id());
        assertEquals(2, pageRequests.get());
        assertTrue(peakPages.get() <= 4);
    }

    @Test
    void failingPageIsSkipped() throws Exception {
        Playlist playlist = (Playlist) client.resolve("https://open.spotify.com/playlist/broken250");

        assertEquals(150, playlist.getTrackCount());
        assertEquals(250, playlist.getReportedTotal());
        assertEquals(1, playlist.getFailedPages());
        assertTrue(playlist.isDegraded());
        assertEquals("t99", playlist.getTracks().get(99).getIdentifier());
        assertEquals("t200", playlist.getTracks().get(100).getIdentifier());
    }

    @Test
    void pageLimitCapsAdditionalPages() throws Exception {
        try (SpotifyClient limited = newClient(ResolverSettings.defaults(4).withPlaylistPageLimit(1), baseUrl)) {
            Playlist playlist = (Playlist) limited.resolve("https://open.spotify.com/playlist/big250");
            assertEquals(200, playlist.getTrackCount());
            assertEquals(250, playlist.getReportedTotal());
        }
    }

    @Test
    void podcastEpisodesAndRemovedTracksAreSkipped() throws Exception {
        Playlist playlist = (Playlist) client.resolve("https://open.spotify.com/playlist/mixed");

        assertEquals(1, playlist.getTrackCount());
        assertEquals("keep", playlist.getTracks().get(0).getIdentifier());
    }

    @Test
    void firstPageOfEpisodesStillLoadsLaterTracks() throws Exception {
        Playlist playlist = (Playlist) client.resolve("https://open.spotify.com/playlist/episodes250");

        assertEquals(150, playlist.getTrackCount());
        assertEquals("t100", playlist.getTracks().get(0).getIdentifier());
        assertFalse(playlist.isDegraded());

        List<Track> streamed;
        try (Stream<List<Track>> stream = client.streamPlaylist("https://open.spotify.com/playlist/episodes250", 50)) {
            streamed = stream.flatMap(List::stream).collect(Collectors.toList());
        }
        assertEquals(150, streamed.size());
    }

    @Test
    void emptyPlaylistIsRejected() {
        EmptyResultException e = assertThrows(EmptyResultException.class,
                () -> client.resolve("https://open.spotify.com/playlist/empty"));
        assertEquals("This playlist is empty and therefore cannot be resolved.", e.getMessage());
    }

    @Test
    void streamsPlaylistInBatches() throws Exception {
        List<List<Track>> batches;
        try (Stream<List<Track>> stream = client.streamPlaylist("https://open.spotify.com/playlist/big250", 40)) {
            batches = stream.collect(Collectors.toList());
        }

        int total = batches.stream().mapToInt(List::size).sum();
        assertEquals(250, total);
        assertTrue(batches.stream().allMatch(batch -> batch.size() <= 40));
        assertEquals("t0", batches.get(0).get(0).getIdentifier());
        assertEquals("Big Playlist", batches.get(0).get(0).getParentPlaylist().orElseThrow().name());
    }

    @Test
    void streamingRejectsNonPlaylistLinks() {
        InvalidUrlException e = assertThrows(InvalidUrlException.class,
                () -> client.streamPlaylist("https://open.spotify.com/track/track1"));
        assertEquals("Provided query is not a valid Spotify playlist URL.", e.getMessage());
    }

    @Test
    void tokenIsFetchedOnceAcrossRequests() throws Exception {
        client.resolve("https://open.spotify.com/track/track1");
        client.resolve("https://open.spotify.com/album/album1");
        client.resolve("https://open.spotify.com/playlist/big250");

        assertEquals(1, tokenRequests.get());
    }

    @Test
    void unknownTrackSurfacesStatus() {
        RequestException e = assertThrows(RequestException.class,
                () -> client.resolve("https://open.spotify.com/track/missing"));
        assertEquals(404, e.getStatusCode());
        assertEquals("Error while fetching results: 404 Not Found", e.getMessage());
    }

    @Test
    void rejectedCredentialsRaiseAuthException() {
        try (SpotifyClient badClient = newClient(ResolverSettings.defaults(4), baseUrl + "/bad-accounts")) {
            AuthException e = assertThrows(AuthException.class,
                    () -> badClient.resolve("https://open.spotify.com/track/track1"));
            assertEquals("Error fetching bearer token: 401", e.getMessage());
        }
    }

    @Test
    void invalidLinkIsRejected() {
        assertThrows(InvalidUrlException.class, () -> client.resolve("https://open.spotify.com/show/abc"));
        assertThrows(InvalidUrlException.class, () -> client.resolve("  "));
    }

    @Test
    void recommendationsUseTrackAsSeed() throws Exception {
        List<Track> tracks = client.recommendations("https://open.spotify.com/track/track1");

        assertEquals(3, tracks.size());
        assertEquals("rec1", tracks.get(0).getIdentifier());
        assertThrows(InvalidUrlException.class,
                () -> client.recommendations("https://open.spotify.com/album/album1"));
    }

    @Test
    void searchReturnsMatchingTracks() throws Exception {
        List<Track> tracks = client.searchTracks("daft punk");

        assertEquals(1, tracks.size());
        assertEquals("found1", tracks.get(0).getIdentifier());
        assertTrue(client.searchTracks(" ").isEmpty());
    }

    @Test
    void supportsOnlySpotifyLinks() {
        assertTrue(client.supports("https://open.spotify.com/track/track1"));
        assertFalse(client.supports("https://music.apple.com/us/song/x/1"));
        assertEquals("Spotify", client.getName());
    }

    private SpotifyClient newClient(ResolverSettings settings, String accountsBase) {
        return new SpotifyClient(
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(3)).build(),
                new ObjectMapper(),
                "client-id",
                "client-secret",
                settings,
                baseUrl,
                accountsBase,
                "de",
                Clock.systemUTC()
        );
    }

    private void handlePlaylist(HttpExchange ex) throws java.io.IOException {
        if (!authorized(ex)) return;
        String path = ex.getRequestURI().getPath();
        String[] parts = path.split("/");
        String id = parts[3];

        if (path.endsWith("/tracks")) {
            pageRequests.incrementAndGet();
            int now = activePages.incrementAndGet();
            peakPages.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
                int offset = Integer.parseInt(queryParam(ex, "offset"));
                if (id.equals("broken250") && offset == 100) {
                    Json.respond(ex, 500, "{}");
                    return;
                }
                Json.respond(ex, 200, "{\"items\":" + playlistItems(offset, Math.min(PAGE_SIZE, 250 - offset)) + "}");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                Json.respond(ex, 500, "{}");
            } finally {
                activePages.decrementAndGet();
            }
            return;
        }

        switch (id) {
            case "empty" -> Json.respond(ex, 200, playlistJson(id, "[]", 0));
            case "episodes250" -> Json.respond(ex, 200, playlistJson(id, episodeItems(PAGE_SIZE), 250));
            case "mixed" -> Json.respond(ex, 200, playlistJson(id, """
                    [
                      { "track": null },
                      { "track": { "type": "episode", "name": "A podcast", "id": "ep1" } },
                      { "track": %s }
                    ]
                    """.formatted(trackJson("keep")), 3));
            default -> Json.respond(ex, 200, playlistJson(id, playlistItems(0, PAGE_SIZE), 250));
        }
    }

    private static String playlistJson(String id, String items, int total) {
        return """
                {
                  "id": "%s",
                  "name": "Big Playlist",
                  "owner": { "display_name": "curator" },
                  "external_urls": { "spotify": "https://open.spotify.com/playlist/%s" },
                  "images": [ { "url": "https://i.scdn.co/image/playlist" } ],
                  "tracks": { "items": %s, "limit": %d, "total": %d }
                }
                """.formatted(id, id, items, PAGE_SIZE, total);
    }

    private static String playlistItems(int offset, int count) {
        List<String> items = new ArrayList<>();
        for (int i = offset; i < offset + count; i++) {
            items.add("{\"track\":" + trackJson("t" + i) + "}");
        }
        return "[" + String.join(",", items) + "]";
    }

    private static String episodeItems(int count) {
        List<String> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add("{\"track\":{\"type\":\"episode\",\"id\":\"ep" + i + "\",\"name\":\"Episode " + i + "\"}}");
        }
        return "[" + String.join(",", items) + "]";
    }

    private static String trackJson(String id) {
        return """
                {
                  "id": "%1$s",
                  "type": "track",
                  "name": "Song %1$s",
                  "duration_ms": 200000,
                  "artists": [ { "name": "Daft Punk" }, { "name": "Pharrell Williams" } ],
                  "external_urls": { "spotify": "https://open.spotify.com/track/%1$s" },
                  "external_ids": { "isrc": "ISRC-%1$s" },
                  "album": { "images": [ { "url": "https://i.scdn.co/image/%1$s" } ] }
                }
                """.formatted(id);
    }

    private static String queryParam(HttpExchange ex, String name) {
        String query = ex.getRequestURI().getRawQuery();
        if (query == null) return null;
        for (String pair : query.split("&")) {
            int idx = pair.indexOf('=');
            if (idx > 0 && pair.substring(0, idx).equals(name)) {
                return pair.substring(idx + 1);
            }
        }
        return null;
    }

    private static boolean authorized(HttpExchange ex) throws java.io.IOException {
        if (!"Bearer test-token".equals(ex.getRequestHeaders().getFirst("Authorization"))) {
            Json.respond(ex, 401, "{\"error\":{\"status\":401,\"message\":\"No token provided\"}}");
            return false;
        }
        return true;
    }

    private static final class Json {
        private static void respond(HttpExchange ex, int code, String body) throws java.io.IOException {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
            ex.sendResponseHeaders(code, bytes.length);
            try (var os = ex.getResponseBody()) {
                os.write(bytes);
            }
        }
    }
}
