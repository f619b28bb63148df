package com.paxkun.pulldb.model;

import com.paxkun.pulldb.store.EntityKey;
import com.paxkun.pulldb.store.StoredEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A story arc spanning issues from one or more volumes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoryArc implements StoredEntity {

    public static final String KIND = "StoryArc";

    private long identifier;

    private String name;

    private Long publisher;

    private boolean complete;

    private boolean indexed;

    public static EntityKey keyFor(long identifier) {
        return EntityKey.of(KIND, identifier);
    }

    @Override
    public EntityKey key() {
        return keyFor(identifier);
    }
}
