package com.paxkun.pulldb.model;

import com.paxkun.pulldb.store.EntityKey;
import com.paxkun.pulldb.store.StoredEntity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A user-named reading stream grouping publishers, volumes and single issues.
 * A pull belongs to the stream when its issue, its volume or its volume's publisher is a member.
 *
 * Author: Pax
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Stream implements StoredEntity {

    public static final String KIND = "Stream";

    private String user;

    /** Unique per user; also the key id. */
    private String name;

    private List<Long> publishers = new ArrayList<>();

    private List<Long> volumes = new ArrayList<>();

    private List<Long> issues = new ArrayList<>();

    /** Unread pulls in the stream as of the last refresh. */
    private long length;

    public Stream(String user, String name) {
        this(user, name, new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), 0);
    }

    public static EntityKey keyFor(String userId, String name) {
        return UserIdentity.keyFor(userId).child(KIND, name);
    }

    @Override
    public EntityKey key() {
        return keyFor(user, name);
    }

    /**
     * Whether a pull on {@code issueId} in {@code volumeId} (published by {@code publisherId}) is in this stream.
     */
    public boolean includes(long issueId, Long volumeId, Long publisherId) {
        return issues.contains(issueId)
                || (volumeId != null && volumes.contains(volumeId))
                || (publisherId != null && publishers.contains(publisherId));
    }
}
