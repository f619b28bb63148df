package com.paxkun.pulldb.service.page;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One page of (possibly hydrated) rows. {@code nextCursor} is empty once the result set is exhausted;
 * {@code total} is only present when it was requested.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Page<R>(List<R> results, String nextCursor, boolean moreResults, Long total) {

    public Page {
        results = List.copyOf(results);
        nextCursor = nextCursor == null ? "" : nextCursor;
    }
}
