package com.caselink.model;

import java.time.Instant;

/**
 * Paging hints for a single adapter fetch. Null fields fall back to the
 * adapter's own defaults.
 */
public record FetchOptions(Integer page, Integer maxPages, Instant since) {

    public static FetchOptions defaults() {
        return new FetchOptions(null, null, null);
    }

    public static FetchOptions maxPages(Integer maxPages) {
        return new FetchOptions(null, maxPages, null);
    }

    public int pageOr(int fallback) {
        return page != null && page > 0 ? page : fallback;
    }

    public int maxPagesOr(int fallback) {
        return maxPages != null && maxPages > 0 ? maxPages : fallback;
    }
}
