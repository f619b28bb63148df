package com.paxkun.pulldb.model;

import com.paxkun.pulldb.store.EntityKey;
import com.paxkun.pulldb.store.StoredEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One user's acquisition/read/ignore state for one catalog issue.
 * Keyed by (user, issue), so there is never more than one pull per pair.
 *
 * Author: Pax
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Pull implements StoredEntity {

    public static final String KIND = "Pull";

    /** Owning user id. */
    private String user;

    /** Identifier of the pulled issue; also the key id. */
    private long identifier;

    /**
     * Owning volume of the issue. Missing on records written before it was denormalized;
     * see {@code PullMaintenanceService} for how it is back-filled.
     */
    private Long volume;

    /** Key path of the watch that led to this pull, if any. */
    private String watch;

    /** Watched collection this pull is listed under (e.g. {@code volume:42}). */
    private String collection;

    /** Key path of the stream this pull is grouped into, set when the stream is refreshed. */
    private String stream;

    private boolean pulled;

    private boolean read;

    private boolean ignored;

    /** Ranking hint; only meaningful while pulled. */
    private double weight;

    /** Publication date copied from the issue, used for ordering. */
    private LocalDate pubdate;

    public static EntityKey keyFor(String userId, long issueId) {
        return UserIdentity.keyFor(userId).child(KIND, issueId);
    }

    @Override
    public EntityKey key() {
        return keyFor(user, identifier);
    }

    public EntityKey issueKey() {
        return Issue.keyFor(identifier);
    }

    public PullFlags flags() {
        return new PullFlags(pulled, read, ignored);
    }

    public void applyFlags(PullFlags flags) {
        this.pulled = flags.pulled();
        this.read = flags.read();
        this.ignored = flags.ignored();
    }
}
