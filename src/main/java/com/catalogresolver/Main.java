package com.catalogresolver;

import com.catalogresolver.model.Album;
import com.catalogresolver.model.Artist;
import com.catalogresolver.model.CatalogEntity;
import com.catalogresolver.model.Playlist;
import com.catalogresolver.model.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves every URL given on the command line and logs what it resolved to.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            log.error("Usage: Main <catalog-url> [<catalog-url> ...]");
            System.exit(2);
        }
        Config.printStatus();

        int failures = 0;
        try (CatalogResolver resolver = CatalogResolver.fromConfig()) {
            for (String url : args) {
                try {
                    log.info("{} -> {}", url, describe(resolver.resolve(url)));
                } catch (CatalogException e) {
                    failures++;
                    log.error("{} -> {}: {}", url, e.getClass().getSimpleName(), e.getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while resolving");
            failures++;
        }
        if (failures > 0) {
            System.exit(1);
        }
    }

    static String describe(CatalogEntity entity) {
        if (entity instanceof Track track) {
            return "track '" + track.getTitle() + "' by " + track.getAuthor();
        } else if (entity instanceof Album album) {
            return "album '" + album.getName() + "' by " + album.getArtist() + " (" + album.getTracks().size() + " tracks)";
        } else if (entity instanceof Artist artist) {
            return "artist '" + artist.getName() + "' (" + artist.getTopTracks().size() + " top tracks)";
        } else if (entity instanceof Playlist playlist) {
            String degraded = playlist.isDegraded() ? ", " + playlist.getFailedPages() + " pages skipped" : "";
            return "playlist '" + playlist.getName() + "' (" + playlist.getTrackCount() + "/"
                    + playlist.getReportedTotal() + " tracks" + degraded + ")";
        }
        return String.valueOf(entity);
    }
}
