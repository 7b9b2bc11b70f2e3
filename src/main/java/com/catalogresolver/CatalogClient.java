package com.catalogresolver;

import com.catalogresolver.model.CatalogEntity;
import com.catalogresolver.model.Track;

import java.util.List;
import java.util.stream.Stream;

/**
 * Resolves the catalog URLs of one metadata provider.
 */
public interface CatalogClient extends AutoCloseable {

    /**
     * Human readable provider name used in logs and error messages.
     */
    String getName();

    boolean supports(String url);

    /**
     * Resolves a track, album, artist or playlist URL. Playlists are fully materialised, with pages
     * that failed to load left out.
     */
    CatalogEntity resolve(String url) throws CatalogException, InterruptedException;

    /**
     * Streams the tracks of a playlist URL in batches of the configured batch size.
     */
    Stream<List<Track>> streamPlaylist(String url) throws CatalogException, InterruptedException;

    /**
     * Streams the tracks of a playlist URL in lists of at most {@code batchSize} tracks. The first
     * page is fetched before this method returns; later pages are fetched as the stream is consumed.
     * Close the stream when abandoning it early.
     */
    Stream<List<Track>> streamPlaylist(String url, int batchSize) throws CatalogException, InterruptedException;

    @Override
    void close();
}
