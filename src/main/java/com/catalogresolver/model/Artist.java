package com.catalogresolver.model;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

public class Artist implements CatalogEntity {

    private final String name;
    private final List<String> genres;
    private final String id;
    private final String uri;
    private final String thumbnail;
    private final List<Track> topTracks;

    public Artist(String name, List<String> genres, String id, String uri, String thumbnail, List<Track> topTracks) {
        this.name = (name != null && !name.isBlank()) ? name : "Unknown";
        this.genres = (genres != null) ? List.copyOf(genres) : Collections.emptyList();
        this.id = id;
        this.uri = uri;
        this.thumbnail = thumbnail;
        this.topTracks = (topTracks != null) ? List.copyOf(topTracks) : Collections.emptyList();
    }

    @Override
    public EntityType getType() {
        return EntityType.ARTIST;
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

    public List<String> getGenres() {
        return genres;
    }

    public Optional<String> getThumbnail() {
        return Optional.ofNullable(thumbnail);
    }

    public List<Track> getTopTracks() {
        return topTracks;
    }

    @Override
    public String toString() {
        return "Artist{name='" + name + "', topTracks=" + topTracks.size() + '}';
    }
}
