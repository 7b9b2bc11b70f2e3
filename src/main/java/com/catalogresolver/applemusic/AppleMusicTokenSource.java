package com.catalogresolver.applemusic;

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
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Obtains the anonymous developer token the Apple Music web player embeds in its main script bundle.
 * No client credentials are involved; the token's expiry is read from its JWT {@code exp} claim.
 */
public class AppleMusicTokenSource implements TokenSource {

    private static final Logger log = LoggerFactory.getLogger(AppleMusicTokenSource.class);
    private static final Pattern SCRIPT_PATTERN = Pattern.compile("<script.*?src=\"(/assets/index-.*?)\"");
    private static final Pattern TOKEN_PATTERN = Pattern.compile("\"(eyJ.+?)\"");

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final String webBase;
    private final Duration timeout;

    public AppleMusicTokenSource(HttpClient http, ObjectMapper mapper, String webBase, Duration timeout) {
        this.http = http;
        this.mapper = mapper;
        this.webBase = webBase;
        this.timeout = timeout;
    }

    @Override
    public AccessToken exchange() throws AuthException, InterruptedException {
        String page = fetchText(webBase);
        Matcher script = SCRIPT_PATTERN.matcher(page);
        if (!script.find()) {
            throw new AuthException("Could not find valid script URL in response.");
        }

        String bundle = fetchText(webBase + script.group(1));
        Matcher token = TOKEN_PATTERN.matcher(bundle);
        if (!token.find()) {
            throw new AuthException("Could not find token in response.");
        }

        String value = token.group(1);
        AccessToken accessToken = new AccessToken(value, readExpiry(value));
        log.debug("Fetched Apple Music bearer token successfully");
        return accessToken;
    }

    /**
     * Decodes the payload segment of a JWT and returns its {@code exp} claim.
     */
    Instant readExpiry(String jwt) throws AuthException {
        String[] parts = jwt.split("\\.");
        if (parts.length < 2) {
            throw new AuthException("Apple Music token is not a JWT");
        }
        try {
            byte[] payload = Base64.getUrlDecoder().decode(parts[1]);
            JsonNode claims = mapper.readTree(new String(payload, StandardCharsets.UTF_8));
            JsonNode exp = claims.get("exp");
            if (exp == null || !exp.canConvertToLong()) {
                throw new AuthException("Apple Music token carries no exp claim");
            }
            return Instant.ofEpochSecond(exp.asLong());
        } catch (IllegalArgumentException | IOException e) {
            throw new AuthException("Apple Music token payload could not be decoded", e);
        }
    }

    private String fetchText(String url) throws AuthException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .GET()
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new AuthException("Error while fetching Apple Music token: " + e.getMessage(), e);
        }
        if (resp.statusCode() != 200) {
            throw new AuthException("Error while fetching Apple Music token: " + resp.statusCode());
        }
        return resp.body();
    }
}
