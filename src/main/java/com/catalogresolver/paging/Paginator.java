package com.catalogresolver.paging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Fetches the pages of a paginated resource in waves of {@code concurrency * 2} requests.
 * <p>
 * Every request holds one of {@code concurrency} semaphore permits while it runs, so no more than
 * {@code concurrency} requests are in flight at once no matter how large a wave is. The semaphore
 * is shared by every resource paginated through the same instance.
 */
public class Paginator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Paginator.class);
    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final int waveSize;
    private final Semaphore permits;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    public Paginator(int concurrency) {
        this(concurrency, Executors.newCachedThreadPool(daemonThreads()), true);
    }

    public Paginator(int concurrency, ExecutorService executor) {
        this(concurrency, executor, false);
    }

    private Paginator(int concurrency, ExecutorService executor, boolean ownsExecutor) {
        int permitCount = Math.max(1, concurrency);
        this.waveSize = (int) Math.min(Integer.MAX_VALUE, permitCount * 2L);
        this.permits = new Semaphore(permitCount);
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Pages requested per wave: twice the concurrency, capped at {@link Integer#MAX_VALUE}.
     */
    public int waveSize() {
        return waveSize;
    }

    /**
     * Permits not currently held by a running page request.
     */
    public int availablePermits() {
        return permits.availablePermits();
    }

    /**
     * Offsets of every page after the first: multiples of {@code limit} from {@code limit} up to,
     * but excluding, {@code total}. At most {@code maxPages} offsets are returned when it is set.
     */
    public static List<Integer> remainingOffsets(int limit, int total, Integer maxPages) {
        if (limit <= 0 || total <= limit) {
            return Collections.emptyList();
        }
        List<Integer> offsets = new ArrayList<>();
        for (int offset = limit; offset < total; offset += limit) {
            if (maxPages != null && offsets.size() >= maxPages) {
                break;
            }
            offsets.add(offset);
        }
        return offsets;
    }

    public <T> WaveSource<T> offsetWaves(List<Integer> offsets, PageFetcher<Integer, T> fetcher) {
        return new OffsetWaveSource<>(this, offsets, fetcher);
    }

    public <T> WaveSource<T> cursorWaves(String firstCursor, int maxWaves, PageFetcher<String, T> fetcher) {
        return new CursorWaveSource<>(this, firstCursor, maxWaves, fetcher);
    }

    /**
     * Drains {@code waves} and appends every successful page to {@code firstPage}.
     */
    public <T> PageResult<T> collect(List<T> firstPage, WaveSource<T> waves) throws InterruptedException {
        List<T> items = new ArrayList<>(firstPage);
        try (waves) {
            while (waves.hasNextWave()) {
                for (List<T> page : waves.nextWave()) {
                    items.addAll(page);
                }
            }
        }
        if (waves.failedPages() > 0) {
            log.warn("{} of {} pages could not be fetched, returning {} items",
                    waves.failedPages(), waves.fetchedPages(), items.size());
        }
        return new PageResult<>(items, waves.fetchedPages(), waves.failedPages());
    }

    /**
     * Lazily emits {@code firstPage} and then every later page, sliced into lists of at most
     * {@code batchSize} items. A wave is only requested once the batches of the previous one are
     * consumed. Closing the stream stops further waves and cancels requests still in flight.
     */
    public <T> Stream<List<T>> stream(List<T> firstPage, WaveSource<T> waves, int batchSize) {
        BatchIterator<T> iterator = new BatchIterator<>(firstPage, waves, batchSize);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                false
        ).onClose(iterator::close);
    }

    public static <T> List<List<T>> chunk(List<T> items, int size) {
        int safeSize = Math.max(1, size);
        List<List<T>> chunks = new ArrayList<>();
        for (int i = 0; i < items.size(); i += safeSize) {
            chunks.add(List.copyOf(items.subList(i, Math.min(i + safeSize, items.size()))));
        }
        return chunks;
    }

    <K, T> List<Future<Page<T>>> submitWave(List<K> keys, PageFetcher<K, T> fetcher) {
        List<Future<Page<T>>> futures = new ArrayList<>(keys.size());
        for (K key : keys) {
            futures.add(executor.submit(() -> fetchGated(key, fetcher)));
        }
        return futures;
    }

    /**
     * Waits for every future of a wave, keeping submission order. If the caller is interrupted the
     * unfinished requests of the wave are cancelled.
     */
    <T> List<Page<T>> awaitWave(List<Future<Page<T>>> futures) throws InterruptedException {
        List<Page<T>> pages = new ArrayList<>(futures.size());
        try {
            for (Future<Page<T>> future : futures) {
                pages.add(await(future));
            }
        } catch (InterruptedException e) {
            for (Future<Page<T>> future : futures) {
                future.cancel(true);
            }
            throw e;
        }
        return pages;
    }

    private static <T> Page<T> await(Future<Page<T>> future) throws InterruptedException {
        try {
            return future.get();
        } catch (CancellationException e) {
            return Page.failure();
        } catch (ExecutionException e) {
            log.warn("Page request failed unexpectedly: {}", String.valueOf(e.getCause()));
            return Page.failure();
        }
    }

    private <K, T> Page<T> fetchGated(K key, PageFetcher<K, T> fetcher) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Page.failure();
        }
        try {
            Page<T> page = fetcher.fetch(key);
            return (page != null) ? page : Page.of(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Page.failure();
        } catch (Exception e) {
            log.warn("Skipping page {} due to {}", key, e.getMessage());
            return Page.failure();
        } finally {
            permits.release();
        }
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    private static ThreadFactory daemonThreads() {
        int pool = POOL_COUNTER.incrementAndGet();
        AtomicInteger threadCounter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "catalog-pages-" + pool + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
