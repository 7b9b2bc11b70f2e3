package com.catalogresolver.paging;

import java.util.List;

/**
 * Produces the remaining pages of a resource one wave at a time.
 */
public interface WaveSource<T> extends AutoCloseable {

    boolean hasNextWave();

    /**
     * Fetches the next wave and returns the items of each successful page, in submission order.
     */
    List<List<T>> nextWave() throws InterruptedException;

    int fetchedPages();

    int failedPages();

    /**
     * Stops further waves and cancels requests still in flight.
     */
    @Override
    void close();
}
