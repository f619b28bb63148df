package com.paxkun.pulldb.model;

import com.paxkun.pulldb.store.EntityKey;
import com.paxkun.pulldb.store.StoredEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A catalog volume (a run of issues). Owned by catalog sync; PullDB only reads it.
 *
 * Author: Pax
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Volume implements StoredEntity {

    public static final String KIND = "Volume";

    /** Catalog-assigned identifier. */
    private long identifier;

    private String name;

    /** Owning publisher, when known. */
    private Long publisher;

    private Integer startYear;

    /** False while catalog sync still has issues to fetch for this volume. */
    private boolean complete;

    /** False until the volume has been added to the search index. */
    private boolean indexed;

    public static EntityKey keyFor(long identifier) {
        return EntityKey.of(KIND, identifier);
    }

    @Override
    public EntityKey key() {
        return keyFor(identifier);
    }
}
