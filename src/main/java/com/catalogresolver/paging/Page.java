package com.catalogresolver.paging;

import java.util.Collections;
import java.util.List;

/**
 * One fetched page of results.
 *
 * @param items  entities on the page, in provider order
 * @param next   continuation cursor for cursor-style providers, or null
 * @param failed true if the fetch failed and the page contributes nothing
 */
public record Page<T>(
        List<T> items,
        String next,
        boolean failed
) {

    public Page {
        items = (items != null) ? List.copyOf(items) : Collections.emptyList();
        next = (next != null && !next.isBlank()) ? next : null;
    }

    public static <T> Page<T> of(List<T> items) {
        return new Page<>(items, null, false);
    }

    public static <T> Page<T> of(List<T> items, String next) {
        return new Page<>(items, next, false);
    }

    public static <T> Page<T> failure() {
        return new Page<>(null, null, true);
    }
}
