package com.catalogresolver.paging;

/**
 * Fetches the page addressed by {@code key} (an offset or a cursor).
 * Any exception marks the page as failed; it is never propagated to the resolve caller.
 */
@FunctionalInterface
public interface PageFetcher<K, T> {

    Page<T> fetch(K key) throws Exception;
}
