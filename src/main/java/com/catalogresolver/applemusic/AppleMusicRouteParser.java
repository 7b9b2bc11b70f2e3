package com.catalogresolver.applemusic;

import com.catalogresolver.InvalidUrlException;
import com.catalogresolver.model.EntityType;
import com.catalogresolver.route.Route;
import com.catalogresolver.route.RouteParser;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accepts {@code music.apple.com/{storefront}/{type}/{slug}/{id}} links.
 * <p>
 * Apple shares a single song as its album link plus {@code ?i={songId}}; such links are routed to the song.
 */
public class AppleMusicRouteParser implements RouteParser {

    public static final Pattern URL_PATTERN = Pattern.compile(
            "https?://music\\.apple\\.com/(?<country>[a-zA-Z]{2})/(?<type>album|playlist|song|artist)/(?<name>.+?)/(?<id>[^/?]+?)/?(?:\\?.*)?$"
    );
    public static final Pattern SINGLE_IN_ALBUM_PATTERN = Pattern.compile(
            "https?://music\\.apple\\.com/(?<country>[a-zA-Z]{2})/(?<type>album|playlist|song|artist)/(?<name>.+)/(?<id>[^/?]+)\\?i=(?<songId>[^&]+)(?:&.*)?$"
    );

    @Override
    public boolean matches(String url) {
        return url != null && URL_PATTERN.matcher(url).matches();
    }

    @Override
    public Route parse(String url) throws InvalidUrlException {
        Matcher m = (url == null) ? null : URL_PATTERN.matcher(url);
        if (m == null || !m.matches()) {
            throw new InvalidUrlException("The Apple Music link provided is not valid.");
        }
        String country = m.group("country").toLowerCase(Locale.ROOT);
        String type = m.group("type");

        if ("album".equals(type)) {
            Matcher single = SINGLE_IN_ALBUM_PATTERN.matcher(url);
            if (single.matches()) {
                return new Route(EntityType.TRACK, single.group("songId"), country);
            }
        }
        return new Route(toEntityType(type), m.group("id"), country);
    }

    private static EntityType toEntityType(String type) {
        return switch (type) {
            case "song" -> EntityType.TRACK;
            case "album" -> EntityType.ALBUM;
            case "playlist" -> EntityType.PLAYLIST;
            case "artist" -> EntityType.ARTIST;
            default -> throw new IllegalArgumentException("Unexpected Apple Music type: " + type);
        };
    }

    /**
     * Path segment the catalog API uses for an entity type.
     */
    static String apiType(EntityType type) {
        return switch (type) {
            case TRACK -> "songs";
            case ALBUM -> "albums";
            case PLAYLIST -> "playlists";
            case ARTIST -> "artists";
        };
    }
}
