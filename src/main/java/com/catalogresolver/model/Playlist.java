package com.catalogresolver.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A resolved playlist. Tracks appear in the order their pages were appended, which is not
 * guaranteed to be the provider's canonical order once more than one wave was needed.
 */
public class Playlist implements CatalogEntity {

    private final String name;
    private final String owner;
    private final String id;
    private final String uri;
    private final String thumbnail;
    private final List<Track> tracks;
    private final int reportedTotal;
    private final int failedPages;

    public Playlist(String name, String owner, String id, String uri, String thumbnail,
                    List<Track> tracks, int reportedTotal, int failedPages) {
        this.name = (name != null && !name.isBlank()) ? name : "Unknown Playlist";
        this.owner = (owner != null && !owner.isBlank()) ? owner : "Unknown";
        this.id = id;
        this.uri = uri;
        this.thumbnail = thumbnail;
        this.tracks = linkTracks(tracks, new PlaylistInfo(id, this.name, uri));
        this.reportedTotal = Math.max(reportedTotal, this.tracks.size());
        this.failedPages = Math.max(0, failedPages);
    }

    private static List<Track> linkTracks(List<Track> tracks, PlaylistInfo info) {
        if (tracks == null || tracks.isEmpty()) {
            return Collections.emptyList();
        }
        List<Track> linked = new ArrayList<>(tracks.size());
        for (Track track : tracks) {
            linked.add(track.withParentPlaylist(info));
        }
        return Collections.unmodifiableList(linked);
    }

    @Override
    public EntityType getType() {
        return EntityType.PLAYLIST;
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

    public String getOwner() {
        return owner;
    }

    public Optional<String> getThumbnail() {
        return Optional.ofNullable(thumbnail);
    }

    public List<Track> getTracks() {
        return tracks;
    }

    public int getTrackCount() {
        return tracks.size();
    }

    /**
     * Track count the provider reported, which may exceed {@link #getTrackCount()}.
     */
    public int getReportedTotal() {
        return reportedTotal;
    }

    public int getFailedPages() {
        return failedPages;
    }

    /**
     * True when at least one page was skipped while loading this playlist.
     */
    public boolean isDegraded() {
        return failedPages > 0;
    }

    public PlaylistInfo toInfo() {
        return new PlaylistInfo(id, name, uri);
    }

    @Override
    public String toString() {
        return "Playlist{name='" + name + "', tracks=" + tracks.size() + "/" + reportedTotal
                + ", failedPages=" + failedPages + '}';
    }
}
