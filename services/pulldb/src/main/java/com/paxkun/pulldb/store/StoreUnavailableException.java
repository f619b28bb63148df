package com.paxkun.pulldb.store;

/**
 * Raised when a round-trip to the backing store fails. Nothing read in the same call can be trusted
 * once this is thrown, so callers let it propagate.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
