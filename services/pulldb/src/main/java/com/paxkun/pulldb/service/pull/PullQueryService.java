package com.paxkun.pulldb.service.pull;

import com.paxkun.pulldb.concurrent.FanOut;
import com.paxkun.pulldb.model.CollectionRef;
import com.paxkun.pulldb.model.Pull;
import com.paxkun.pulldb.model.UserIdentity;
import com.paxkun.pulldb.model.Watch;
import com.paxkun.pulldb.service.page.Page;
import com.paxkun.pulldb.service.page.PageRequest;
import com.paxkun.pulldb.service.page.PagedQueryService;
import com.paxkun.pulldb.store.EntityKey;
import com.paxkun.pulldb.store.EntityQuery;
import com.paxkun.pulldb.store.EntityStore;
import com.paxkun.pulldb.util.Identifiers;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;

/**
 * Read side of the pull ledger: lookups, listings and counts.
 *
 * Author: Pax
 */
@Service
@RequiredArgsConstructor
public class PullQueryService {

    private final EntityStore store;
    private final FanOut fanOut;
    private final PagedQueryService pages;
    private final PullContextLoader contextLoader;

    public Optional<PullContext> getPull(UserIdentity user, long issueId, boolean context) {
        return store.get(Pull.keyFor(user.id(), issueId), Pull.class)
                .map(pull -> context ? contextLoader.hydrate(pull) : contextLoader.bare(pull));
    }

    /**
     * Batch lookup of existing pulls. Malformed and unknown ids are left out.
     */
    public List<Pull> fetchPulls(UserIdentity user, List<?> rawIds) {
        List<EntityKey> keys = new ArrayList<>();
        for (Object raw : rawIds) {
            OptionalLong id = Identifiers.parseId(raw);
            id.ifPresent(value -> keys.add(Pull.keyFor(user.id(), value)));
        }
        if (keys.isEmpty()) {
            return List.of();
        }
        List<Pull> found = new ArrayList<>();
        for (Pull pull : store.getMany(keys, Pull.class)) {
            if (pull != null) {
                found.add(pull);
            }
        }
        return found;
    }

    public Page<PullContext> listPulls(UserIdentity user, PullListType type, PullListOptions options, PageRequest page) {
        return pages.fetch(query(user, type, options), page, contextLoader);
    }

    /**
     * Lists the pulls recorded under one watched collection.
     *
     * @return empty if the user does not watch {@code collection}
     */
    public Optional<Page<PullContext>> listWatchPulls(UserIdentity user, CollectionRef collection, PullListType type,
                                                      PullListOptions options, PageRequest page) {
        if (store.get(Watch.keyFor(user.id(), collection), Watch.class).isEmpty()) {
            return Optional.empty();
        }
        EntityQuery<Pull> query = query(user, type, options).filterEq("collection", collection.toString());
        return Optional.of(pages.fetch(query, page, contextLoader));
    }

    public PullStats stats(UserIdentity user) {
        EntityQuery<Pull> all = EntityQuery.of(Pull.class, Pull.KIND).ancestor(user.key());
        CompletableFuture<Long> ignored = fanOut.submit(() -> store.count(all.filterEq("ignored", true)));
        CompletableFuture<Long> fresh = fanOut.submit(() -> store.count(all
                .filterEq("pulled", false)
                .filterEq("ignored", false)));
        CompletableFuture<Long> unread = fanOut.submit(() -> store.count(all
                .filterEq("pulled", true)
                .filterEq("read", false)));
        CompletableFuture<Long> read = fanOut.submit(() -> store.count(all
                .filterEq("pulled", true)
                .filterEq("read", true)));
        CompletableFuture<Long> total = fanOut.submit(() -> store.count(all));
        fanOut.awaitAll(List.of(ignored, fresh, unread, read, total));
        return new PullStats(
                fanOut.join(ignored),
                fanOut.join(fresh),
                fanOut.join(unread),
                fanOut.join(read),
                fanOut.join(total));
    }

    EntityQuery<Pull> query(UserIdentity user, PullListType type, PullListOptions options) {
        EntityQuery<Pull> query = EntityQuery.of(Pull.class, Pull.KIND).ancestor(user.key());
        query = switch (type) {
            case ALL -> query;
            case NEW -> options.includeIgnored()
                    ? query.filterEq("pulled", false)
                    : query.filterEq("pulled", false).filterEq("ignored", false);
            case UNREAD -> query.filterEq("pulled", true).filterEq("ignored", false).filterEq("read", false);
            case IGNORED -> query.filterEq("ignored", true);
        };
        return query.orderBy(options.orderField(), options.reverse());
    }
}
