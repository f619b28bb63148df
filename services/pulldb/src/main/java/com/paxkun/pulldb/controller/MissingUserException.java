package com.paxkun.pulldb.controller;

/**
 * The request carried no caller identity.
 */
public class MissingUserException extends RuntimeException {

    public MissingUserException(String message) {
        super(message);
    }
}
