package com.paxkun.pulldb.model;

import com.paxkun.pulldb.store.EntityKey;
import com.paxkun.pulldb.store.StoredEntity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Comic publisher as mirrored from the catalog.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Publisher implements StoredEntity {

    public static final String KIND = "Publisher";

    private long identifier;

    private String name;

    public static EntityKey keyFor(long identifier) {
        return EntityKey.of(KIND, identifier);
    }

    @Override
    public EntityKey key() {
        return keyFor(identifier);
    }
}
