package com.catalogresolver.model;

import java.util.Optional;

public class Track implements CatalogEntity {

    private final String title;
    private final String author;
    private final String uri;
    private final String identifier;
    private final long durationMs;
    private final boolean stream;
    private final String thumbnail;
    private final String isrc;
    private final PlaylistInfo parentPlaylist;

    public Track(String title, String author, String uri, String identifier, long durationMs,
                 boolean stream, String thumbnail, String isrc) {
        this(title, author, uri, identifier, durationMs, stream, thumbnail, isrc, null);
    }

    public Track(String title, String author, String uri, String identifier, long durationMs,
                 boolean stream, String thumbnail, String isrc, PlaylistInfo parentPlaylist) {
        this.title = (title != null && !title.isBlank()) ? title : "Unknown";
        this.author = (author != null && !author.isBlank()) ? author : "Unknown";
        this.uri = uri;
        this.identifier = (identifier != null && !identifier.isBlank()) ? identifier : null;
        this.durationMs = Math.max(0, durationMs);
        this.stream = stream;
        this.thumbnail = thumbnail;
        this.isrc = (isrc != null && !isrc.isBlank()) ? isrc : null;
        this.parentPlaylist = parentPlaylist;
    }

    /**
     * Returns a copy of this track that points back at the given playlist.
     */
    public Track withParentPlaylist(PlaylistInfo playlist) {
        return new Track(title, author, uri, identifier, durationMs, stream, thumbnail, isrc, playlist);
    }

    @Override
    public EntityType getType() {
        return EntityType.TRACK;
    }

    @Override
    public String getId() {
        return identifier;
    }

    @Override
    public String getUri() {
        return uri;
    }

    public String getTitle() {
        return title;
    }

    public String getAuthor() {
        return author;
    }

    public String getIdentifier() {
        return identifier;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public boolean isStream() {
        return stream;
    }

    public Optional<String> getThumbnail() {
        return Optional.ofNullable(thumbnail);
    }

    public Optional<String> getIsrc() {
        return Optional.ofNullable(isrc);
    }

    public Optional<PlaylistInfo> getParentPlaylist() {
        return Optional.ofNullable(parentPlaylist);
    }

    @Override
    public String toString() {
        return "Track{" +
                "identifier='" + identifier + '\'' +
                ", title='" + title + '\'' +
                ", author='" + author + '\'' +
                ", durationMs=" + durationMs +
                '}';
    }
}
