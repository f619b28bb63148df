package com.paxkun.pulldb.service.pull;

import com.paxkun.pulldb.model.CollectionType;
import com.paxkun.pulldb.model.Issue;
import com.paxkun.pulldb.model.Pull;
import com.paxkun.pulldb.model.Volume;
import com.paxkun.pulldb.model.Watch;
import com.paxkun.pulldb.service.page.ContextLoader;
import com.paxkun.pulldb.store.EntityKey;
import com.paxkun.pulldb.store.EntityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Loads the issue, volume and originating watch of a pull.
 *
 * Author: Pax
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PullContextLoader implements ContextLoader<Pull, PullContext> {

    private final EntityStore store;

    @Override
    public PullContext bare(Pull pull) {
        return PullContext.bare(pull);
    }

    @Override
    public PullContext hydrate(Pull pull) {
        Issue issue = store.get(pull.issueKey(), Issue.class).orElse(null);
        Watch watch = loadWatch(pull).orElse(null);
        Volume volume = volumeId(pull, issue, watch)
                .flatMap(id -> store.get(Volume.keyFor(id), Volume.class))
                .orElse(null);
        return new PullContext(pull, issue, volume, watch);
    }

    /**
     * Resolves the owning volume of a pull: the pull's own reference first, then the issue's
     * volume, then the volume its originating watch is on. The fallbacks only matter for
     * records written before the reference was stored on the pull.
     */
    public static Optional<Long> volumeId(Pull pull, Issue issue, Watch watch) {
        if (pull.getVolume() != null) {
            return Optional.of(pull.getVolume());
        }
        if (issue != null && issue.getVolume() != null) {
            return Optional.of(issue.getVolume());
        }
        if (watch != null && watch.getCollectionType() == CollectionType.VOLUME) {
            return Optional.of(watch.getCollectionId());
        }
        return Optional.empty();
    }

    Optional<Watch> loadWatch(Pull pull) {
        if (pull.getWatch() == null || pull.getWatch().isBlank()) {
            return Optional.empty();
        }
        EntityKey key;
        try {
            key = EntityKey.parsePath(pull.getWatch());
        } catch (IllegalArgumentException e) {
            log.warn("Pull {} has an unreadable watch reference: {}", pull.key(), e.getMessage());
            return Optional.empty();
        }
        return store.get(key, Watch.class);
    }
}
