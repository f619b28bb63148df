package com.paxkun.pulldb.model;

/**
 * The four reachable states of a pull, derived from its flags.
 */
public enum PullState {
    NEW,
    PULLED,
    READ,
    IGNORED;

    /**
     * @throws IllegalStateException for a combination no transition may produce
     */
    public static PullState of(PullFlags flags) {
        if (!flags.isValid()) {
            throw new IllegalStateException("Unreachable pull flags: " + flags);
        }
        if (flags.ignored()) {
            return IGNORED;
        }
        if (flags.read()) {
            return READ;
        }
        return flags.pulled() ? PULLED : NEW;
    }
}
