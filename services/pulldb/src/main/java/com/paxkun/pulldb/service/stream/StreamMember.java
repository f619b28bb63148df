package com.paxkun.pulldb.service.stream;

import com.paxkun.pulldb.model.Stream;

import java.util.List;
import java.util.function.Function;

/**
 * The kinds of catalog record a stream can hold.
 */
public enum StreamMember {
    PUBLISHER("publisher", Stream::getPublishers),
    VOLUME("volume", Stream::getVolumes),
    ISSUE("issue", Stream::getIssues);

    private final String wireName;
    private final Function<Stream, List<Long>> members;

    StreamMember(String wireName, Function<Stream, List<Long>> members) {
        this.wireName = wireName;
        this.members = members;
    }

    public String wireName() {
        return wireName;
    }

    List<Long> membersOf(Stream stream) {
        return members.apply(stream);
    }
}
