package com.catalogresolver.paging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Future;

abstract class AbstractWaveSource<K, T> implements WaveSource<T> {

    private final Paginator paginator;
    private final PageFetcher<K, T> fetcher;
    private volatile List<Future<Page<T>>> inFlight = Collections.emptyList();
    private volatile boolean closed;
    private int fetchedPages;
    private int failedPages;

    AbstractWaveSource(Paginator paginator, PageFetcher<K, T> fetcher) {
        this.paginator = paginator;
        this.fetcher = fetcher;
    }

    protected int waveSize() {
        return paginator.waveSize();
    }

    protected boolean isClosed() {
        return closed;
    }

    /**
     * Fetches one page per key concurrently and returns the pages in key order.
     */
    protected List<Page<T>> fetchWave(List<K> keys) throws InterruptedException {
        List<Future<Page<T>>> futures = paginator.submitWave(keys, fetcher);
        inFlight = futures;
        try {
            List<Page<T>> pages = paginator.awaitWave(futures);
            for (Page<T> page : pages) {
                fetchedPages++;
                if (page.failed()) {
                    failedPages++;
                }
            }
            return pages;
        } finally {
            inFlight = Collections.emptyList();
        }
    }

    protected static <T> List<List<T>> successfulItems(List<Page<T>> pages) {
        List<List<T>> items = new ArrayList<>(pages.size());
        for (Page<T> page : pages) {
            if (!page.failed() && !page.items().isEmpty()) {
                items.add(page.items());
            }
        }
        return items;
    }

    @Override
    public int fetchedPages() {
        return fetchedPages;
    }

    @Override
    public int failedPages() {
        return failedPages;
    }

    @Override
    public void close() {
        closed = true;
        for (Future<Page<T>> future : inFlight) {
            future.cancel(true);
        }
    }
}
