package com.paxkun.pulldb.service.pull;

import java.util.Locale;

/**
 * Named pull listings.
 */
public enum PullListType {
    /** Every pull of the user. */
    ALL,
    /** Not yet pulled; ignored pulls only when explicitly included. */
    NEW,
    /** Pulled, not ignored, not read. */
    UNREAD,
    /** Ignored pulls. */
    IGNORED;

    /**
     * @throws IllegalArgumentException for an unknown listing name
     */
    public static PullListType fromWireName(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (PullListType type : values()) {
                if (type.name().equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown pull listing: " + value);
    }
}
