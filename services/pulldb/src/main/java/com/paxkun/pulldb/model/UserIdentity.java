package com.paxkun.pulldb.model;

import com.paxkun.pulldb.store.EntityKey;

import java.util.Objects;

/**
 * Caller identity as resolved by the authentication layer in front of PullDB.
 *
 * @param id      stable user identifier
 * @param trusted whether the caller may run maintenance operations
 */
public record UserIdentity(String id, boolean trusted) {

    public static final String KIND = "User";

    public UserIdentity {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("User id must not be blank");
        }
    }

    public static UserIdentity of(String id) {
        return new UserIdentity(id, false);
    }

    public EntityKey key() {
        return keyFor(id);
    }

    public static EntityKey keyFor(String userId) {
        return EntityKey.of(KIND, userId);
    }
}
