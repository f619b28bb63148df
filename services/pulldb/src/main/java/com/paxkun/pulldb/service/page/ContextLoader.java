package com.paxkun.pulldb.service.page;

/**
 * Turns a stored row into its response form, with or without related records.
 * {@link #hydrate} runs on the fan-out pool once per row, so it must do its own
 * lookups sequentially.
 *
 * @param <T> stored row type
 * @param <R> response row type
 */
public interface ContextLoader<T, R> {

    /** Response form with every related-record field left empty. */
    R bare(T row);

    /** Response form with related records loaded. */
    R hydrate(T row);
}
