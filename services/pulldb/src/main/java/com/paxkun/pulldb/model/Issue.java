package com.paxkun.pulldb.model;

import com.paxkun.pulldb.store.EntityKey;
import com.paxkun.pulldb.store.StoredEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * A single catalog issue.
 *
 * Author: Pax
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Issue implements StoredEntity {

    public static final String KIND = "Issue";

    /** Catalog-assigned identifier. */
    private long identifier;

    /** Owning volume. Older records may be missing it. */
    private Long volume;

    /** Story arcs this issue belongs to. */
    private List<Long> arcs;

    private String name;

    /** Printed issue number (e.g. "1", "12.5", "Annual 2"). */
    private String issueNumber;

    /** Publication (cover) date. */
    private LocalDate pubdate;

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
