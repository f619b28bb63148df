package com.paxkun.pulldb.service.pull;

/**
 * Thrown when a caller asks for a maintenance operation reserved for trusted callers.
 */
public class UntrustedUserException extends RuntimeException {

    public UntrustedUserException(String message) {
        super(message);
    }
}
