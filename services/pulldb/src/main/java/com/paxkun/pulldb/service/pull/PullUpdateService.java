package com.paxkun.pulldb.service.pull;

import com.paxkun.pulldb.concurrent.FanOut;
import com.paxkun.pulldb.concurrent.KeyedLocks;
import com.paxkun.pulldb.model.CollectionRef;
import com.paxkun.pulldb.model.Issue;
import com.paxkun.pulldb.model.Pull;
import com.paxkun.pulldb.model.PullFlags;
import com.paxkun.pulldb.model.UserIdentity;
import com.paxkun.pulldb.model.Watch;
import com.paxkun.pulldb.service.LoggerService;
import com.paxkun.pulldb.store.EntityKey;
import com.paxkun.pulldb.store.EntityStore;
import com.paxkun.pulldb.util.Identifiers;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Bulk state transition engine for pulls.
 * <p>
 * Every call follows the same shape: parse ids, lock the affected pull keys, prefetch the issues and
 * pulls concurrently, classify each item, then issue a single batched write. Nothing is written
 * if any read fails. Per-item problems (malformed id, unknown issue, missing pull) become
 * {@code failed} entries instead of exceptions.
 *
 * Author: Pax
 */
@Service
@RequiredArgsConstructor
public class PullUpdateService {

    private static final String TAG = "PULLS";

    private final EntityStore store;
    private final FanOut fanOut;
    private final KeyedLocks locks;
    private final LoggerService logger;

    /**
     * Applies state operations to existing pulls. Operations run in {@link PullOperation} declaration
     * order, and a later operation sees the state left by an earlier one. Each operation's outcome is
     * classified separately, so an id listed under two operations appears once per operation.
     */
    public BatchResult updatePulls(UserIdentity user, Map<PullOperation, ? extends List<?>> request) {
        BatchResult result = BatchResult.forUpdates();
        Map<Object, OptionalLong> parsed = new HashMap<>();
        Set<Long> issueIds = new LinkedHashSet<>();
        for (List<?> rawIds : request.values()) {
            for (Object raw : rawIds) {
                OptionalLong id = parsed.computeIfAbsent(raw, Identifiers::parseId);
                id.ifPresent(issueIds::add);
            }
        }

        List<Long> orderedIds = new ArrayList<>(issueIds);
        Map<Long, Pull> dirty = new LinkedHashMap<>();
        try (KeyedLocks.Held held = locks.lockAll(pullKeys(user, orderedIds))) {
            Prefetch prefetch = prefetch(user, orderedIds);

            for (PullOperation operation : PullOperation.values()) {
                List<?> rawIds = request.get(operation);
                if (rawIds == null) {
                    continue;
                }
                BatchResult opResult = BatchResult.forUpdates();
                for (Object raw : rawIds) {
                    OptionalLong id = parsed.get(raw);
                    if (id.isEmpty()) {
                        opResult.record(ClassificationBucket.FAILED, String.valueOf(raw));
                        continue;
                    }
                    long issueId = id.getAsLong();
                    Pull pull = prefetch.pulls().get(issueId);
                    if (prefetch.issues().get(issueId) == null || pull == null) {
                        opResult.record(ClassificationBucket.FAILED, issueId);
                        continue;
                    }
                    PullFlags current = pull.flags();
                    if (operation.isConverged(current)) {
                        opResult.record(ClassificationBucket.SKIPPED, issueId);
                        continue;
                    }
                    pull.applyFlags(operation.apply(current));
                    dirty.put(issueId, pull);
                    opResult.record(ClassificationBucket.UPDATED, issueId);
                }
                logger.debug(TAG, operation.wireName() + " for " + Identifiers.sanitizeForLog(user.id()) + ": " + opResult);
                result.merge(opResult);
            }

            if (!dirty.isEmpty()) {
                store.putMany(dirty.values());
            }
        }
        logger.info(TAG, "Updated " + dirty.size() + " pulls for " + Identifiers.sanitizeForLog(user.id()));
        return result;
    }

    /**
     * Creates new-state pulls for the given issues. Existing pulls are skipped, unknown issues fail.
     * Each new pull records the watch it belongs to: a watch on the issue's volume first,
     * then a watch on one of its story arcs.
     */
    public BatchResult addPulls(UserIdentity user, List<?> rawIds) {
        BatchResult result = BatchResult.forAdds();
        List<Long> issueIds = parseAll(rawIds, result);

        List<Pull> created = new ArrayList<>();
        try (KeyedLocks.Held held = locks.lockAll(pullKeys(user, issueIds))) {
            Prefetch prefetch = prefetch(user, issueIds);
            Map<EntityKey, Watch> watches = prefetchWatches(user, prefetch.issues().values());

            Set<Long> seen = new LinkedHashSet<>();
            for (Long issueId : issueIds) {
                Issue issue = prefetch.issues().get(issueId);
                if (issue == null) {
                    logger.debug(TAG, "Unable to add pull, issue " + issueId + " not found");
                    result.record(ClassificationBucket.FAILED, issueId);
                } else if (prefetch.pulls().get(issueId) != null || !seen.add(issueId)) {
                    result.record(ClassificationBucket.SKIPPED, issueId);
                } else {
                    created.add(newPull(user, issue, watches));
                    result.record(ClassificationBucket.ADDED, issueId);
                }
            }

            if (!created.isEmpty()) {
                store.putMany(created);
            }
        }
        logger.info(TAG, "Added " + created.size() + " pulls for " + Identifiers.sanitizeForLog(user.id()));
        return result;
    }

    /**
     * Deletes pulls. Ids without a pull are skipped; the catalog is not consulted.
     */
    public BatchResult removePulls(UserIdentity user, List<?> rawIds) {
        BatchResult result = BatchResult.forRemovals();
        List<Long> issueIds = parseAll(rawIds, result);

        List<EntityKey> doomed = new ArrayList<>();
        List<EntityKey> keys = pullKeys(user, issueIds);
        try (KeyedLocks.Held held = locks.lockAll(keys)) {
            List<Pull> existing = store.getMany(keys, Pull.class);
            Set<EntityKey> seen = new LinkedHashSet<>();
            for (int i = 0; i < issueIds.size(); i++) {
                EntityKey key = keys.get(i);
                if (existing.get(i) != null && seen.add(key)) {
                    doomed.add(key);
                    result.record(ClassificationBucket.REMOVED, issueIds.get(i));
                } else {
                    result.record(ClassificationBucket.SKIPPED, issueIds.get(i));
                }
            }

            if (!doomed.isEmpty()) {
                store.deleteMany(doomed);
            }
        }
        logger.info(TAG, "Removed " + doomed.size() + " pulls for " + Identifiers.sanitizeForLog(user.id()));
        return result;
    }

    private List<Long> parseAll(List<?> rawIds, BatchResult result) {
        List<Long> issueIds = new ArrayList<>(rawIds.size());
        for (Object raw : rawIds) {
            OptionalLong id = Identifiers.parseId(raw);
            if (id.isPresent()) {
                issueIds.add(id.getAsLong());
            } else {
                result.record(ClassificationBucket.FAILED, String.valueOf(raw));
            }
        }
        return issueIds;
    }

    private static List<EntityKey> pullKeys(UserIdentity user, List<Long> issueIds) {
        List<EntityKey> keys = new ArrayList<>(issueIds.size());
        for (Long issueId : issueIds) {
            keys.add(Pull.keyFor(user.id(), issueId));
        }
        return keys;
    }

    /**
     * Loads the issues and the user's pulls for {@code issueIds} as two concurrent batched reads.
     */
    private Prefetch prefetch(UserIdentity user, List<Long> issueIds) {
        if (issueIds.isEmpty()) {
            return new Prefetch(Map.of(), Map.of());
        }
        List<EntityKey> issueKeys = new ArrayList<>(issueIds.size());
        for (Long issueId : issueIds) {
            issueKeys.add(Issue.keyFor(issueId));
        }
        List<EntityKey> pullKeys = pullKeys(user, issueIds);

        CompletableFuture<List<Issue>> issuesFuture = fanOut.submit(() -> store.getMany(issueKeys, Issue.class));
        CompletableFuture<List<Pull>> pullsFuture = fanOut.submit(() -> store.getMany(pullKeys, Pull.class));
        fanOut.awaitAll(List.of(issuesFuture, pullsFuture));
        List<Issue> issueList = fanOut.join(issuesFuture);
        List<Pull> pullList = fanOut.join(pullsFuture);

        Map<Long, Issue> issues = new HashMap<>();
        Map<Long, Pull> pulls = new HashMap<>();
        for (int i = 0; i < issueIds.size(); i++) {
            if (issueList.get(i) != null) {
                issues.put(issueIds.get(i), issueList.get(i));
            }
            if (pullList.get(i) != null) {
                pulls.put(issueIds.get(i), pullList.get(i));
            }
        }
        return new Prefetch(issues, pulls);
    }

    private Map<EntityKey, Watch> prefetchWatches(UserIdentity user, Iterable<Issue> issues) {
        Set<EntityKey> keys = new LinkedHashSet<>();
        for (Issue issue : issues) {
            for (CollectionRef candidate : watchCandidates(issue)) {
                keys.add(Watch.keyFor(user.id(), candidate));
            }
        }
        if (keys.isEmpty()) {
            return Map.of();
        }
        List<EntityKey> ordered = new ArrayList<>(keys);
        List<Watch> found = store.getMany(ordered, Watch.class);
        Map<EntityKey, Watch> watches = new HashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            if (found.get(i) != null) {
                watches.put(ordered.get(i), found.get(i));
            }
        }
        return watches;
    }

    private static List<CollectionRef> watchCandidates(Issue issue) {
        List<CollectionRef> candidates = new ArrayList<>();
        if (issue.getVolume() != null) {
            candidates.add(CollectionRef.volume(issue.getVolume()));
        }
        if (issue.getArcs() != null) {
            for (Long arc : issue.getArcs()) {
                if (arc != null) {
                    candidates.add(CollectionRef.arc(arc));
                }
            }
        }
        return candidates;
    }

    private static Pull newPull(UserIdentity user, Issue issue, Map<EntityKey, Watch> watches) {
        Pull.PullBuilder pull = Pull.builder()
                .user(user.id())
                .identifier(issue.getIdentifier())
                .volume(issue.getVolume())
                .pubdate(issue.getPubdate());
        for (CollectionRef candidate : watchCandidates(issue)) {
            Watch watch = watches.get(Watch.keyFor(user.id(), candidate));
            if (watch != null) {
                pull.watch(watch.key().path()).collection(candidate.toString());
                break;
            }
        }
        return pull.build();
    }

    private record Prefetch(Map<Long, Issue> issues, Map<Long, Pull> pulls) {
    }
}
