package com.catalogresolver.model;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

public class Album implements CatalogEntity {

    private final String name;
    private final String artist;
    private final String id;
    private final String uri;
    private final String thumbnail;
    private final List<Track> tracks;

    public Album(String name, String artist, String id, String uri, String thumbnail, List<Track> tracks) {
        this.name = (name != null && !name.isBlank()) ? name : "Unknown";
        this.artist = (artist != null && !artist.isBlank()) ? artist : "Unknown";
        this.id = id;
        this.uri = uri;
        this.thumbnail = thumbnail;
        this.tracks = (tracks != null) ? List.copyOf(tracks) : Collections.emptyList();
    }

    @Override
    public EntityType getType() {
        return EntityType.ALBUM;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getUri() {
        return uri;
    }

    public String getName() {
        return name;
    }

    public String getArtist() {
        return artist;
    }

    public Optional<String> getThumbnail() {
        return Optional.ofNullable(thumbnail);
    }

    public List<Track> getTracks() {
        return tracks;
    }

    @Override
    public String toString() {
        return "Album{name='" + name + "', artist='" + artist + "', tracks=" + tracks.size() + '}';
    }
}
