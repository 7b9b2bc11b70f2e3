package com.catalogresolver.paging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Pages chained through opaque "next" cursors. Each fetched page may enqueue one more cursor,
 * so the page count is only known once the queue drains. The wave cap guards against cursor
 * chains that never end.
 */
final class CursorWaveSource<T> extends AbstractWaveSource<String, T> {

    private static final Logger log = LoggerFactory.getLogger(CursorWaveSource.class);

    private final Deque<String> cursors = new ArrayDeque<>();
    private final int maxWaves;
    private int waves;

    CursorWaveSource(Paginator paginator, String firstCursor, int maxWaves, PageFetcher<String, T> fetcher) {
        super(paginator, fetcher);
        this.maxWaves = Math.max(0, maxWaves);
        if (firstCursor != null && !firstCursor.isBlank()) {
            cursors.add(firstCursor);
        }
    }

    @Override
    public boolean hasNextWave() {
        return !isClosed() && !cursors.isEmpty() && waves < maxWaves;
    }

    @Override
    public List<List<T>> nextWave() throws InterruptedException {
        List<String> wave = new ArrayList<>();
        while (!cursors.isEmpty() && wave.size() < waveSize()) {
            wave.add(cursors.poll());
        }
        waves++;

        List<Page<T>> pages = fetchWave(wave);
        for (Page<T> page : pages) {
            if (page.next() != null) {
                cursors.add(page.next());
            }
        }

        if (waves >= maxWaves && !cursors.isEmpty()) {
            log.warn("Stopped following page cursors after {} waves, {} cursors left unfetched", waves, cursors.size());
        }
        return successfulItems(pages);
    }

    int wavesRun() {
        return waves;
    }
}
