package com.paxkun.pulldb.service.stream;

/**
 * Membership changes for one named stream. Any of the three changes may be {@code null}.
 */
public record StreamUpdate(String name, MembershipChange publishers, MembershipChange volumes, MembershipChange issues) {

    MembershipChange changeFor(StreamMember member) {
        return switch (member) {
            case PUBLISHER -> publishers;
            case VOLUME -> volumes;
            case ISSUE -> issues;
        };
    }
}
