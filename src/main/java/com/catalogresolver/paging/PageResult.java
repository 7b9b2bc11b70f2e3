package com.catalogresolver.paging;

import java.util.List;

/**
 * Aggregated outcome of paginating one resource.
 *
 * @param items        first page followed by every successful later page
 * @param fetchedPages later pages that were requested
 * @param failedPages  later pages that were requested but skipped
 */
public record PageResult<T>(
        List<T> items,
        int fetchedPages,
        int failedPages
) {

    public boolean isDegraded() {
        return failedPages > 0;
    }
}
