package com.paxkun.pulldb.store;

import java.util.List;

/**
 * One page of raw query results. {@code nextCursor} is empty when nothing remains.
 */
public record QueryPage<T>(List<T> results, String nextCursor, boolean moreResults) {

    public QueryPage {
        results = List.copyOf(results);
        nextCursor = nextCursor == null ? "" : nextCursor;
    }
}
