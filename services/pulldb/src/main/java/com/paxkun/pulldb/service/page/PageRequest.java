package com.paxkun.pulldb.service.page;

/**
 * Caller's paging parameters.
 *
 * @param limit      requested page size, {@code null} or non-positive for the default
 * @param cursor     continuation from the previous page, empty for the first page
 * @param context    whether rows are hydrated with their related records
 * @param countTotal whether a total count is computed alongside the page
 */
public record PageRequest(Integer limit, String cursor, boolean context, boolean countTotal) {

    public PageRequest {
        cursor = cursor == null ? "" : cursor;
    }

    public static PageRequest first(int limit) {
        return new PageRequest(limit, "", false, false);
    }

    public PageRequest withCursor(String next) {
        return new PageRequest(limit, next, context, countTotal);
    }

    public PageRequest withContext(boolean hydrate) {
        return new PageRequest(limit, cursor, hydrate, countTotal);
    }

    public PageRequest withTotal(boolean total) {
        return new PageRequest(limit, cursor, context, total);
    }
}
