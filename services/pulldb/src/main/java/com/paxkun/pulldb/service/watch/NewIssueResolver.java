package com.paxkun.pulldb.service.watch;

import com.paxkun.pulldb.concurrent.FanOut;
import com.paxkun.pulldb.model.CollectionRef;
import com.paxkun.pulldb.model.CollectionType;
import com.paxkun.pulldb.model.Issue;
import com.paxkun.pulldb.model.Pull;
import com.paxkun.pulldb.model.UserIdentity;
import com.paxkun.pulldb.model.Watch;
import com.paxkun.pulldb.store.EntityKey;
import com.paxkun.pulldb.store.EntityQuery;
import com.paxkun.pulldb.store.EntityStore;
import com.paxkun.pulldb.store.QueryFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds, for every watch of a user, the issues published strictly after the watch's start date
 * that the user has no pull for. Watches are scanned concurrently, one task per watch.
 *
 * Author: Pax
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NewIssueResolver {

    private final EntityStore store;
    private final FanOut fanOut;

    public List<NewIssue> resolve(UserIdentity user) {
        List<Watch> watches = store.fetchAll(EntityQuery.of(Watch.class, Watch.KIND).ancestor(user.key()));
        List<List<NewIssue>> perWatch = fanOut.map(watches, watch -> scan(user, watch));
        List<NewIssue> results = new ArrayList<>();
        for (List<NewIssue> found : perWatch) {
            results.addAll(found);
        }
        log.debug("Resolved {} new issues across {} watches", results.size(), watches.size());
        return results;
    }

    /**
     * Scans a single watch. Runs on the fan-out pool, so every read in here is sequential.
     */
    List<NewIssue> scan(UserIdentity user, Watch watch) {
        CollectionRef collection = watch.collection();
        if (store.get(collection.key(), collection.type().entityType()).isEmpty()) {
            log.debug("Watched collection {} no longer exists", collection);
            return List.of();
        }

        List<Issue> candidates = store.fetchAll(candidateQuery(watch));
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<EntityKey> pullKeys = new ArrayList<>(candidates.size());
        for (Issue issue : candidates) {
            pullKeys.add(Pull.keyFor(user.id(), issue.getIdentifier()));
        }
        List<Pull> existing = store.getMany(pullKeys, Pull.class);

        List<NewIssue> fresh = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            if (existing.get(i) == null) {
                Issue issue = candidates.get(i);
                Long volume = issue.getVolume() != null || collection.type() != CollectionType.VOLUME
                        ? issue.getVolume()
                        : collection.id();
                fresh.add(new NewIssue(issue, volume, collection));
            }
        }
        return fresh;
    }

    static EntityQuery<Issue> candidateQuery(Watch watch) {
        String field = watch.getCollectionType() == CollectionType.VOLUME ? "volume" : "arcs";
        EntityQuery<Issue> query = EntityQuery.of(Issue.class, Issue.KIND)
                .filterEq(field, watch.getCollectionId());
        if (watch.getStartDate() != null) {
            query = query.filter(QueryFilter.gt("pubdate", watch.getStartDate()));
        }
        return query.orderBy("pubdate", false);
    }
}
