package com.paxkun.pulldb.service.pull;

import com.paxkun.pulldb.model.PullFlags;

import java.util.Locale;
import java.util.Optional;

/**
 * State transitions a caller can apply to existing pulls.
 * Declaration order is the order a multi-operation request is applied in.
 *
 * Author: Pax
 */
public enum PullOperation {
    PULL,
    UNPULL,
    READ,
    UNREAD,
    IGNORE,
    UNIGNORE;

    /**
     * True when the record already has this operation's effect, so applying it would change nothing.
     */
    public boolean isConverged(PullFlags flags) {
        return switch (this) {
            case PULL -> flags.pulled();
            case UNPULL -> !flags.pulled();
            case READ -> flags.read();
            case UNREAD -> !flags.read();
            case IGNORE -> flags.ignored();
            case UNIGNORE -> !flags.ignored();
        };
    }

    /**
     * The flags after this operation. The operation's own effect wins over any flag it conflicts
     * with: pulling or reading clears {@code ignored}, unpulling or ignoring clears {@code read}.
     * Unignoring never restores {@code pulled}.
     */
    public PullFlags apply(PullFlags flags) {
        return switch (this) {
            case PULL -> new PullFlags(true, flags.read(), false);
            case UNPULL -> new PullFlags(false, false, flags.ignored());
            case READ -> new PullFlags(true, true, false);
            case UNREAD -> new PullFlags(flags.pulled(), false, flags.ignored());
            case IGNORE -> new PullFlags(false, false, true);
            case UNIGNORE -> new PullFlags(flags.pulled(), flags.read(), false);
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<PullOperation> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (PullOperation operation : values()) {
            if (operation.name().equals(normalized)) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }
}
