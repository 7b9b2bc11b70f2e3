package com.catalogresolver.applemusic;

import com.catalogresolver.MalformedResponseException;
import com.catalogresolver.model.Album;
import com.catalogresolver.model.Artist;
import com.catalogresolver.model.Track;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts Apple Music catalog resources ({@code {id, type, attributes, relationships}}) into catalog entities.
 */
public final class AppleMusicEntityMapper {

    private AppleMusicEntityMapper() {}

    public static Track song(JsonNode resource) {
        JsonNode attributes = attributes(resource, "song");
        return new Track(
                attributes.path("name").asText(null),
                attributes.path("artistName").asText(null),
                attributes.path("url").asText(null),
                resource.path("id").asText(null),
                attributes.path("durationInMillis").asLong(0),
                false,
                artworkUrl(attributes.path("artwork")),
                attributes.path("isrc").asText(null)
        );
    }

    public static List<Track> songs(JsonNode array) {
        List<Track> songs = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode node : array) {
                if (node != null && !node.isNull()) {
                    songs.add(song(node));
                }
            }
        }
        return songs;
    }

    public static Album album(JsonNode resource) {
        JsonNode attributes = attributes(resource, "album");
        return new Album(
                attributes.path("name").asText(null),
                attributes.path("artistName").asText(null),
                resource.path("id").asText(null),
                attributes.path("url").asText(null),
                artworkUrl(attributes.path("artwork")),
                songs(resource.path("relationships").path("tracks").path("data"))
        );
    }

    public static Artist artist(JsonNode resource, JsonNode topSongs) {
        JsonNode attributes = attributes(resource, "artist");
        List<String> genres = new ArrayList<>();
        for (JsonNode genre : attributes.path("genreNames")) {
            genres.add(genre.asText());
        }
        return new Artist(
                attributes.path("name").asText(null),
                genres,
                resource.path("id").asText(null),
                attributes.path("url").asText(null),
                artworkUrl(attributes.path("artwork")),
                songs(topSongs)
        );
    }

    /**
     * Artwork URLs are templates with a {@code {w}x{h}} placeholder; fill it with the artwork's own size.
     */
    static String artworkUrl(JsonNode artwork) {
        String template = artwork.path("url").asText(null);
        if (template == null || template.isBlank()) {
            return null;
        }
        int width = artwork.path("width").asInt(0);
        int height = artwork.path("height").asInt(0);
        if (width <= 0 || height <= 0) {
            return template.replace("{w}x{h}", "1000x1000");
        }
        return template.replace("{w}x{h}", width + "x" + height);
    }

    private static JsonNode attributes(JsonNode resource, String kind) {
        if (resource == null || !resource.isObject()) {
            throw new MalformedResponseException("Apple Music " + kind + " resource is missing");
        }
        JsonNode attributes = resource.get("attributes");
        if (attributes == null || !attributes.isObject()) {
            throw new MalformedResponseException("Apple Music " + kind + " resource has no attributes");
        }
        return attributes;
    }
}
