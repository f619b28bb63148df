package com.paxkun.pulldb.model;

/**
 * The three state booleans of a pull.
 * Valid combinations satisfy {@code read -> pulled} and {@code ignored -> !pulled}.
 */
public record PullFlags(boolean pulled, boolean read, boolean ignored) {

    public static final PullFlags NEW = new PullFlags(false, false, false);

    public boolean isValid() {
        return (!read || pulled) && !(ignored && pulled);
    }

    /**
     * Repairs an invalid combination. Being ignored takes precedence over being pulled,
     * and an unpulled issue cannot be read.
     */
    public PullFlags normalized() {
        boolean normalizedPulled = pulled && !ignored;
        boolean normalizedRead = read && normalizedPulled;
        return new PullFlags(normalizedPulled, normalizedRead, ignored);
    }

    public PullState state() {
        return PullState.of(this);
    }
}
