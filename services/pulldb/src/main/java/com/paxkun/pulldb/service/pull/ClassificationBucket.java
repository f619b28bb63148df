package com.paxkun.pulldb.service.pull;

import java.util.Locale;

/**
 * Outcome label for one item of a batch operation.
 */
public enum ClassificationBucket {
    /** A new record was created. */
    ADDED,
    /** An existing record changed. */
    UPDATED,
    /** Nothing to do: the record was already in the requested state. */
    SKIPPED,
    /** Could not be done: unknown issue, missing record, or malformed input. */
    FAILED,
    /** An existing record was deleted. */
    REMOVED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
