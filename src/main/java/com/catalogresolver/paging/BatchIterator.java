package com.catalogresolver.paging;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CancellationException;

/**
 * Pull-driven batches over a first page plus a {@link WaveSource}. Single use.
 */
final class BatchIterator<T> implements Iterator<List<T>>, AutoCloseable {

    private final Deque<List<T>> ready = new ArrayDeque<>();
    private final WaveSource<T> waves;
    private final int batchSize;
    private boolean closed;

    BatchIterator(List<T> firstPage, WaveSource<T> waves, int batchSize) {
        this.waves = waves;
        this.batchSize = Math.max(1, batchSize);
        ready.addAll(Paginator.chunk(firstPage, this.batchSize));
    }

    @Override
    public boolean hasNext() {
        while (ready.isEmpty() && !closed && waves.hasNextWave()) {
            try {
                for (List<T> page : waves.nextWave()) {
                    ready.addAll(Paginator.chunk(page, batchSize));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                close();
                throw new CancellationException("Interrupted while fetching playlist pages");
            }
        }
        return !ready.isEmpty();
    }

    @Override
    public List<T> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return ready.poll();
    }

    @Override
    public void close() {
        closed = true;
        ready.clear();
        waves.close();
    }
}
