package com.catalogresolver.spotify;

import com.catalogresolver.InvalidUrlException;
import com.catalogresolver.model.EntityType;
import com.catalogresolver.route.Route;
import com.catalogresolver.route.RouteParser;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accepts {@code open.spotify.com} links, with or without an {@code intl-xx} locale segment,
 * trailing slash and query string.
 */
public class SpotifyRouteParser implements RouteParser {

    public static final Pattern URL_PATTERN = Pattern.compile(
            "https?://open\\.spotify\\.com/(?:intl-(?<locale>[a-zA-Z-]+)/)?(?<type>album|playlist|track|artist)/(?<id>[a-zA-Z0-9]+)/?(?:\\?.*)?$"
    );

    @Override
    public boolean matches(String url) {
        return url != null && URL_PATTERN.matcher(url).matches();
    }

    @Override
    public Route parse(String url) throws InvalidUrlException {
        Matcher m = (url == null) ? null : URL_PATTERN.matcher(url);
        if (m == null || !m.matches()) {
            throw new InvalidUrlException("The Spotify link provided is not valid.");
        }
        EntityType type = EntityType.valueOf(m.group("type").toUpperCase(Locale.ROOT));
        String locale = m.group("locale");
        return new Route(type, m.group("id"), locale != null ? locale.toLowerCase(Locale.ROOT) : null);
    }
}
