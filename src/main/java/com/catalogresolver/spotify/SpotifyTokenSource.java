package com.catalogresolver.spotify;

import com.catalogresolver.AuthException;
import com.catalogresolver.auth.AccessToken;
import com.catalogresolver.auth.TokenSource;
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
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

/**
 * Client credentials flow against the Spotify accounts service.
 */
public class SpotifyTokenSource implements TokenSource {

    private static final Logger log = LoggerFactory.getLogger(SpotifyTokenSource.class);
    // Expire slightly early so a token is never sent in its last seconds.
    private static final long EXPIRY_MARGIN_SECONDS = 10;

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final URI tokenUri;
    private final String basicAuth;
    private final Duration timeout;
    private final Clock clock;

    public SpotifyTokenSource(HttpClient http, ObjectMapper mapper, String accountsBase,
                              String clientId, String clientSecret, Duration timeout, Clock clock) {
        this.http = http;
        this.mapper = mapper;
        this.tokenUri = URI.create(accountsBase + "/api/token");
        String credentials = trimOrEmpty(clientId) + ":" + trimOrEmpty(clientSecret);
        this.basicAuth = "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public AccessToken exchange() throws AuthException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(tokenUri)
                .timeout(timeout)
                .header("Authorization", basicAuth)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString("grant_type=client_credentials"))
                .build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new AuthException("Error fetching bearer token: " + e.getMessage(), e);
        }
        if (resp.statusCode() != 200) {
            throw new AuthException("Error fetching bearer token: " + resp.statusCode());
        }

        JsonNode root;
        try {
            root = mapper.readTree(resp.body());
        } catch (IOException e) {
            throw new AuthException("Bearer token response is not valid JSON", e);
        }
        String token = root.path("access_token").asText(null);
        JsonNode expiresIn = root.get("expires_in");
        if (token == null || token.isBlank() || expiresIn == null || !expiresIn.canConvertToLong()) {
            throw new AuthException("Bearer token response is missing access_token or expires_in");
        }

        long lifetime = Math.max(0, expiresIn.asLong() - EXPIRY_MARGIN_SECONDS);
        log.debug("Fetched Spotify bearer token successfully");
        return new AccessToken(token, clock.instant().plusSeconds(lifetime));
    }

    private static String trimOrEmpty(String s) {
        return (s == null) ? "" : s.trim();
    }
}
