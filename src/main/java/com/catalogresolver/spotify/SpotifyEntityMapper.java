package com.catalogresolver.spotify;

import com.catalogresolver.MalformedResponseException;
import com.catalogresolver.model.Album;
import com.catalogresolver.model.Artist;
import com.catalogresolver.model.Track;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts Spotify Web API documents into catalog entities.
 */
public final class SpotifyEntityMapper {

    private static final Logger log = LoggerFactory.getLogger(SpotifyEntityMapper.class);

    private SpotifyEntityMapper() {}

    public static Track track(JsonNode node) {
        return track(node, null);
    }

    /**
     * @param fallbackThumbnail cover used when the track document carries no album images (album track listings)
     */
    public static Track track(JsonNode node, String fallbackThumbnail) {
        if (node == null || !node.isObject()) {
            throw new MalformedResponseException("Spotify track document is missing");
        }
        String thumbnail = firstImage(node.path("album").path("images"));
        return new Track(
                optText(node, "name"),
                joinArtists(node.path("artists")),
                node.path("external_urls").path("spotify").asText(null),
                optText(node, "id"),
                node.path("duration_ms").asLong(0),
                false,
                thumbnail != null ? thumbnail : fallbackThumbnail,
                node.path("external_ids").path("isrc").asText(null)
        );
    }

    /**
     * Maps the {@code items} array of a playlist page. Removed tracks (null) and podcast episodes are skipped.
     */
    public static List<Track> playlistTracks(JsonNode items) {
        List<Track> tracks = new ArrayList<>();
        if (items == null || !items.isArray()) {
            return tracks;
        }
        for (JsonNode item : items) {
            JsonNode track = item.get("track");
            if (track == null || track.isNull()) {
                continue;
            }
            if ("episode".equals(track.path("type").asText())) {
                log.debug("Skipping podcast episode: {}", track.path("name").asText());
                continue;
            }
            tracks.add(track(track));
        }
        return tracks;
    }

    public static List<Track> tracks(JsonNode array) {
        List<Track> tracks = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode node : array) {
                if (node != null && !node.isNull()) {
                    tracks.add(track(node));
                }
            }
        }
        return tracks;
    }

    public static Album album(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedResponseException("Spotify album document is missing");
        }
        String cover = firstImage(node.path("images"));
        List<Track> tracks = new ArrayList<>();
        for (JsonNode item : node.path("tracks").path("items")) {
            if (item != null && !item.isNull()) {
                tracks.add(track(item, cover));
            }
        }
        return new Album(
                optText(node, "name"),
                joinArtists(node.path("artists")),
                optText(node, "id"),
                node.path("external_urls").path("spotify").asText(null),
                cover,
                tracks
        );
    }

    public static Artist artist(JsonNode node, JsonNode topTracks) {
        if (node == null || !node.isObject()) {
            throw new MalformedResponseException("Spotify artist document is missing");
        }
        List<String> genres = new ArrayList<>();
        for (JsonNode genre : node.path("genres")) {
            genres.add(genre.asText());
        }
        return new Artist(
                optText(node, "name"),
                genres,
                optText(node, "id"),
                node.path("external_urls").path("spotify").asText(null),
                firstImage(node.path("images")),
                tracks(topTracks)
        );
    }

    static String joinArtists(JsonNode artists) {
        if (artists == null || !artists.isArray() || artists.size() == 0) {
            return null;
        }
        List<String> names = new ArrayList<>();
        for (JsonNode artist : artists) {
            String name = artist.path("name").asText(null);
            if (name != null && !name.isBlank()) {
                names.add(name);
            }
        }
        return names.isEmpty() ? null : String.join(", ", names);
    }

    static String firstImage(JsonNode images) {
        if (images == null || !images.isArray() || images.size() == 0) {
            return null;
        }
        return images.get(0).path("url").asText(null);
    }

    private static String optText(JsonNode node, String field) {
        JsonNode v = node == null ? null : node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        return v.asText();
    }
}
