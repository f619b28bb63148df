package com.paxkun.pulldb.service.catalog;

import com.paxkun.pulldb.concurrent.FanOut;
import com.paxkun.pulldb.model.CollectionRef;
import com.paxkun.pulldb.model.CollectionType;
import com.paxkun.pulldb.model.Issue;
import com.paxkun.pulldb.model.Publisher;
import com.paxkun.pulldb.model.StoryArc;
import com.paxkun.pulldb.model.Volume;
import com.paxkun.pulldb.service.page.ContextLoader;
import com.paxkun.pulldb.service.page.Page;
import com.paxkun.pulldb.service.page.PageRequest;
import com.paxkun.pulldb.service.page.PagedQueryService;
import com.paxkun.pulldb.store.EntityQuery;
import com.paxkun.pulldb.store.EntityStore;
import com.paxkun.pulldb.store.StoredEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Read-only view of the mirrored catalog. Catalog sync owns these records; PullDB never writes them.
 *
 * Author: Pax
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogService {

    private final EntityStore store;
    private final FanOut fanOut;
    private final PagedQueryService pages;

    public Optional<Issue> getIssue(long issueId) {
        return store.get(Issue.keyFor(issueId), Issue.class);
    }

    public Optional<VolumeContext> getVolume(long volumeId, boolean context) {
        return store.get(Volume.keyFor(volumeId), Volume.class)
                .map(volume -> new VolumeContext(volume, context ? publisher(volume.getPublisher()) : null));
    }

    public Optional<ArcContext> getArc(long arcId, boolean context) {
        return store.get(StoryArc.keyFor(arcId), StoryArc.class)
                .map(arc -> new ArcContext(arc, context ? publisher(arc.getPublisher()) : null));
    }

    /**
     * Issues of a volume or story arc, oldest first.
     *
     * @return empty if the collection does not exist
     */
    public Optional<CollectionIssues> collectionIssues(CollectionRef collection) {
        Optional<? extends StoredEntity> found = store.get(collection.key(), collection.type().entityType());
        if (found.isEmpty()) {
            log.info("Collection {} not found", collection);
            return Optional.empty();
        }
        String field = collection.type() == CollectionType.VOLUME ? "volume" : "arcs";
        List<Issue> issues = store.fetchAll(EntityQuery.of(Issue.class, Issue.KIND)
                .filterEq(field, collection.id())
                .orderBy("pubdate", false));
        log.debug("Collection {} has {} issues", collection, issues.size());
        return Optional.of(new CollectionIssues(found.get(), issues));
    }

    /**
     * Pages through volumes.
     *
     * @param type {@code all}, or {@code queued} for volumes catalog sync has not completed
     */
    public Page<VolumeContext> listVolumes(String type, PageRequest page) {
        EntityQuery<Volume> query = EntityQuery.of(Volume.class, Volume.KIND);
        String normalized = type == null ? "all" : type.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "all" -> { }
            case "queued" -> query = query.filterEq("complete", false);
            default -> throw new IllegalArgumentException("Unknown volume listing: " + type);
        }
        return pages.fetch(query, page, new ContextLoader<>() {
            @Override
            public VolumeContext bare(Volume volume) {
                return new VolumeContext(volume, null);
            }

            @Override
            public VolumeContext hydrate(Volume volume) {
                return new VolumeContext(volume, publisher(volume.getPublisher()));
            }
        });
    }

    public CatalogStats volumeStats(boolean includeTotal) {
        return stats(EntityQuery.of(Volume.class, Volume.KIND), includeTotal);
    }

    public CatalogStats arcStats(boolean includeTotal) {
        return stats(EntityQuery.of(StoryArc.class, StoryArc.KIND), includeTotal);
    }

    private <T extends StoredEntity> CatalogStats stats(EntityQuery<T> all, boolean includeTotal) {
        CompletableFuture<Long> queued = fanOut.submit(() -> store.count(all.filterEq("complete", false)));
        CompletableFuture<Long> toindex = fanOut.submit(() -> store.count(all.filterEq("indexed", false)));
        CompletableFuture<Long> total = includeTotal ? fanOut.submit(() -> store.count(all)) : null;
        List<CompletableFuture<Long>> futures = new ArrayList<>(List.of(queued, toindex));
        if (total != null) {
            futures.add(total);
        }
        fanOut.awaitAll(futures);
        return new CatalogStats(fanOut.join(queued), fanOut.join(toindex), total != null ? fanOut.join(total) : null);
    }

    private Publisher publisher(Long publisherId) {
        if (publisherId == null) {
            return null;
        }
        return store.get(Publisher.keyFor(publisherId), Publisher.class).orElse(null);
    }
}
