package com.paxkun.pulldb.service.watch;

import com.paxkun.pulldb.concurrent.FanOut;
import com.paxkun.pulldb.concurrent.KeyedLocks;
import com.paxkun.pulldb.model.CollectionRef;
import com.paxkun.pulldb.model.CollectionType;
import com.paxkun.pulldb.model.UserIdentity;
import com.paxkun.pulldb.model.Watch;
import com.paxkun.pulldb.service.LoggerService;
import com.paxkun.pulldb.service.page.Page;
import com.paxkun.pulldb.service.page.PageRequest;
import com.paxkun.pulldb.service.page.PagedQueryService;
import com.paxkun.pulldb.service.pull.BatchResult;
import com.paxkun.pulldb.service.pull.ClassificationBucket;
import com.paxkun.pulldb.store.EntityKey;
import com.paxkun.pulldb.store.EntityQuery;
import com.paxkun.pulldb.store.EntityStore;
import com.paxkun.pulldb.store.StoredEntity;
import com.paxkun.pulldb.util.Identifiers;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Subscription registry: which volumes and story arcs a user watches, and from which date.
 * Results are reported per collection as {@code volume:<id>} / {@code arc:<id>}.
 * Removing a watch leaves the pulls it produced in place.
 *
 * Author: Pax
 */
@Service
@RequiredArgsConstructor
public class WatchService {

    private static final String TAG = "WATCHES";

    private final EntityStore store;
    private final FanOut fanOut;
    private final KeyedLocks locks;
    private final PagedQueryService pages;
    private final WatchContextLoader contextLoader;
    private final LoggerService logger;
    private final Clock clock;

    /**
     * Starts watching the given volumes and arcs.
     *
     * @param startDate exclusive lower bound for new issues; today when {@code null}
     */
    public BatchResult addWatches(UserIdentity user, List<?> volumeIds, List<?> arcIds, LocalDate startDate) {
        BatchResult result = BatchResult.forAdds();
        List<CollectionRef> collections = parseCollections(volumeIds, arcIds, result);
        LocalDate start = startDate != null ? startDate : LocalDate.now(clock);

        List<EntityKey> watchKeys = watchKeys(user, collections);
        List<Watch> created = new ArrayList<>();
        try (KeyedLocks.Held held = locks.lockAll(watchKeys)) {
            CompletableFuture<List<Watch>> existingFuture = fanOut.submit(() -> store.getMany(watchKeys, Watch.class));
            List<CompletableFuture<Boolean>> collectionFutures = new ArrayList<>(collections.size());
            for (CollectionRef collection : collections) {
                collectionFutures.add(fanOut.submit(() -> collectionExists(collection)));
            }
            List<CompletableFuture<?>> all = new ArrayList<>(collectionFutures);
            all.add(existingFuture);
            fanOut.awaitAll(all);
            List<Watch> existing = fanOut.join(existingFuture);

            Set<CollectionRef> seen = new LinkedHashSet<>();
            for (int i = 0; i < collections.size(); i++) {
                CollectionRef collection = collections.get(i);
                if (!fanOut.join(collectionFutures.get(i))) {
                    result.record(ClassificationBucket.FAILED, collection.toString());
                } else if (existing.get(i) != null || !seen.add(collection)) {
                    result.record(ClassificationBucket.SKIPPED, collection.toString());
                } else {
                    created.add(new Watch(user.id(), collection, start));
                    result.record(ClassificationBucket.ADDED, collection.toString());
                }
            }
            if (!created.isEmpty()) {
                store.putMany(created);
            }
        }
        logger.info(TAG, "Added " + created.size() + " watches for " + Identifiers.sanitizeForLog(user.id()));
        return result;
    }

    public BatchResult removeWatches(UserIdentity user, List<?> volumeIds, List<?> arcIds) {
        BatchResult result = BatchResult.forRemovals();
        List<CollectionRef> collections = parseCollections(volumeIds, arcIds, result);

        List<EntityKey> watchKeys = watchKeys(user, collections);
        List<EntityKey> doomed = new ArrayList<>();
        try (KeyedLocks.Held held = locks.lockAll(watchKeys)) {
            List<Watch> existing = store.getMany(watchKeys, Watch.class);
            for (int i = 0; i < collections.size(); i++) {
                EntityKey key = watchKeys.get(i);
                if (existing.get(i) != null && !doomed.contains(key)) {
                    doomed.add(key);
                    result.record(ClassificationBucket.REMOVED, collections.get(i).toString());
                } else {
                    result.record(ClassificationBucket.SKIPPED, collections.get(i).toString());
                }
            }
            if (!doomed.isEmpty()) {
                store.deleteMany(doomed);
            }
        }
        logger.info(TAG, "Removed " + doomed.size() + " watches for " + Identifiers.sanitizeForLog(user.id()));
        return result;
    }

    /**
     * Moves the start date of existing watches.
     *
     * @param volumeDates volume id to ISO date (a full timestamp is accepted)
     * @param arcDates    arc id to ISO date
     */
    public BatchResult updateWatches(UserIdentity user, Map<String, String> volumeDates, Map<String, String> arcDates) {
        BatchResult result = BatchResult.forUpdates();
        List<CollectionRef> collections = new ArrayList<>();
        List<LocalDate> dates = new ArrayList<>();
        collectDates(CollectionType.VOLUME, volumeDates, collections, dates, result);
        collectDates(CollectionType.ARC, arcDates, collections, dates, result);

        List<EntityKey> watchKeys = watchKeys(user, collections);
        List<Watch> changed = new ArrayList<>();
        try (KeyedLocks.Held held = locks.lockAll(watchKeys)) {
            List<Watch> existing = store.getMany(watchKeys, Watch.class);
            for (int i = 0; i < collections.size(); i++) {
                Watch watch = existing.get(i);
                String label = collections.get(i).toString();
                if (watch == null) {
                    result.record(ClassificationBucket.FAILED, label);
                } else if (dates.get(i).equals(watch.getStartDate())) {
                    result.record(ClassificationBucket.SKIPPED, label);
                } else {
                    logger.debug(TAG, "Watch on " + label + " now starts at " + dates.get(i));
                    watch.setStartDate(dates.get(i));
                    changed.add(watch);
                    result.record(ClassificationBucket.UPDATED, label);
                }
            }
            if (!changed.isEmpty()) {
                store.putMany(changed);
            }
        }
        logger.info(TAG, "Updated " + changed.size() + " watches for " + Identifiers.sanitizeForLog(user.id()));
        return result;
    }

    public Page<WatchContext> listWatches(UserIdentity user, PageRequest page) {
        EntityQuery<Watch> query = EntityQuery.of(Watch.class, Watch.KIND).ancestor(user.key());
        return pages.fetch(query, page, contextLoader);
    }

    public Optional<WatchContext> getWatch(UserIdentity user, CollectionRef collection, boolean context) {
        return store.get(Watch.keyFor(user.id(), collection), Watch.class)
                .map(watch -> context ? contextLoader.hydrate(watch) : contextLoader.bare(watch));
    }

    private boolean collectionExists(CollectionRef collection) {
        Optional<? extends StoredEntity> found = store.get(collection.key(), collection.type().entityType());
        return found.isPresent();
    }

    private static List<EntityKey> watchKeys(UserIdentity user, List<CollectionRef> collections) {
        List<EntityKey> keys = new ArrayList<>(collections.size());
        for (CollectionRef collection : collections) {
            keys.add(Watch.keyFor(user.id(), collection));
        }
        return keys;
    }

    private static List<CollectionRef> parseCollections(List<?> volumeIds, List<?> arcIds, BatchResult result) {
        List<CollectionRef> collections = new ArrayList<>();
        parseInto(CollectionType.VOLUME, volumeIds, collections, result);
        parseInto(CollectionType.ARC, arcIds, collections, result);
        return collections;
    }

    private static void parseInto(CollectionType type, List<?> rawIds, List<CollectionRef> collections, BatchResult result) {
        if (rawIds == null) {
            return;
        }
        for (Object raw : rawIds) {
            OptionalLong id = Identifiers.parseId(raw);
            if (id.isPresent()) {
                collections.add(new CollectionRef(type, id.getAsLong()));
            } else {
                result.record(ClassificationBucket.FAILED, type.wireName() + ":" + raw);
            }
        }
    }

    private static void collectDates(CollectionType type, Map<String, String> rawDates, List<CollectionRef> collections,
                                     List<LocalDate> dates, BatchResult result) {
        if (rawDates == null) {
            return;
        }
        for (Map.Entry<String, String> entry : rawDates.entrySet()) {
            OptionalLong id = Identifiers.parseId(entry.getKey());
            Optional<LocalDate> date = Identifiers.parseDate(entry.getValue());
            if (id.isEmpty() || date.isEmpty()) {
                result.record(ClassificationBucket.FAILED, type.wireName() + ":" + entry.getKey());
                continue;
            }
            collections.add(new CollectionRef(type, id.getAsLong()));
            dates.add(date.get());
        }
    }
}
