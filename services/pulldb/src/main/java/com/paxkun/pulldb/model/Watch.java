package com.paxkun.pulldb.model;

import com.paxkun.pulldb.store.EntityKey;
import com.paxkun.pulldb.store.StoredEntity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A user's subscription to a volume or story arc. Issues published after {@code startDate}
 * without a pull are "new" for this user.
 *
 * Author: Pax
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Watch implements StoredEntity {

    public static final String KIND = "Watch";

    private String user;

    private CollectionType collectionType;

    private long collectionId;

    /** Exclusive lower bound for new issues. */
    private LocalDate startDate;

    public Watch(String user, CollectionRef collection, LocalDate startDate) {
        this(user, collection.type(), collection.id(), startDate);
    }

    /**
     * Derives the key from the (user, collection) pair, which is what keeps watches unique.
     */
    public static EntityKey keyFor(String userId, CollectionRef collection) {
        return UserIdentity.keyFor(userId)
                .child(KIND, collection.type().wireName() + "-" + collection.id());
    }

    public CollectionRef collection() {
        return new CollectionRef(collectionType, collectionId);
    }

    @Override
    public EntityKey key() {
        return keyFor(user, collection());
    }
}
