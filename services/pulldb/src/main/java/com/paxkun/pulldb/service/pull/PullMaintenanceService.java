package com.paxkun.pulldb.service.pull;

import com.paxkun.pulldb.concurrent.KeyedLocks;
import com.paxkun.pulldb.model.Issue;
import com.paxkun.pulldb.model.Pull;
import com.paxkun.pulldb.model.PullFlags;
import com.paxkun.pulldb.model.UserIdentity;
import com.paxkun.pulldb.model.Watch;
import com.paxkun.pulldb.service.LoggerService;
import com.paxkun.pulldb.store.EntityKey;
import com.paxkun.pulldb.store.EntityQuery;
import com.paxkun.pulldb.store.EntityStore;
import com.paxkun.pulldb.util.Identifiers;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Repairs pull records written by older versions: back-fills the volume reference and
 * normalizes flag combinations that break the ledger invariants.
 *
 * Author: Pax
 */
@Service
@RequiredArgsConstructor
public class PullMaintenanceService {

    private static final String TAG = "REFRESH";

    private final EntityStore store;
    private final KeyedLocks locks;
    private final PullContextLoader contextLoader;
    private final LoggerService logger;

    /**
     * Refreshes one pull of the user.
     *
     * @return the pulls that changed (empty when none did or the pull does not exist)
     */
    public List<Pull> refreshPull(UserIdentity user, long issueId) {
        EntityKey key = Pull.keyFor(user.id(), issueId);
        try (KeyedLocks.Held held = locks.lockAll(List.of(key))) {
            Optional<Pull> pull = store.get(key, Pull.class);
            return pull.map(this::refreshLocked).orElseGet(List::of);
        }
    }

    /**
     * Refreshes every pull of the user. Only trusted callers may run this.
     */
    public List<Pull> refreshAll(UserIdentity user) {
        if (!user.trusted()) {
            throw new UntrustedUserException("Refreshing all pulls requires a trusted caller");
        }
        List<Pull> pulls = store.fetchAll(EntityQuery.of(Pull.class, Pull.KIND).ancestor(user.key()));
        List<EntityKey> keys = new ArrayList<>(pulls.size());
        for (Pull pull : pulls) {
            keys.add(pull.key());
        }
        List<Pull> changed = new ArrayList<>();
        try (KeyedLocks.Held held = locks.lockAll(keys)) {
            List<Pull> current = store.getMany(keys, Pull.class);
            for (Pull pull : current) {
                if (pull != null && repair(pull)) {
                    changed.add(pull);
                }
            }
            if (!changed.isEmpty()) {
                store.putMany(changed);
            }
        }
        logger.info(TAG, "Refreshed " + changed.size() + " of " + pulls.size() + " pulls for "
                + Identifiers.sanitizeForLog(user.id()));
        return changed;
    }

    private List<Pull> refreshLocked(Pull pull) {
        if (!repair(pull)) {
            return List.of();
        }
        store.put(pull);
        logger.info(TAG, "Refreshed pull " + pull.key());
        return List.of(pull);
    }

    /**
     * Applies the repairs in place.
     *
     * @return whether anything changed
     */
    boolean repair(Pull pull) {
        boolean changed = false;
        if (pull.getVolume() == null) {
            Issue issue = store.get(pull.issueKey(), Issue.class).orElse(null);
            Watch watch = contextLoader.loadWatch(pull).orElse(null);
            Optional<Long> volume = PullContextLoader.volumeId(pull, issue, watch);
            if (volume.isPresent()) {
                logger.debug(TAG, "Adding missing volume " + volume.get() + " to pull " + pull.key());
                pull.setVolume(volume.get());
                changed = true;
            }
        }
        PullFlags flags = pull.flags();
        if (!flags.isValid()) {
            pull.applyFlags(flags.normalized());
            changed = true;
        }
        return changed;
    }
}
