package com.paxkun.pulldb.service.page;

import com.paxkun.pulldb.concurrent.FanOut;
import com.paxkun.pulldb.store.EntityQuery;
import com.paxkun.pulldb.store.EntityStore;
import com.paxkun.pulldb.store.QueryPage;
import com.paxkun.pulldb.store.StoredEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Paginated context hydrator: fetches one page of an ordered query, optionally counts the whole
 * result set in parallel, and hydrates every row of the page in a single fan-out batch.
 *
 * Author: Pax
 */
@Slf4j
@Service
public class PagedQueryService {

    private final EntityStore store;
    private final FanOut fanOut;
    private final int defaultLimit;
    private final int maxLimit;

    public PagedQueryService(EntityStore store,
                             FanOut fanOut,
                             @Value("${pulldb.paging.default-limit:100}") int defaultLimit,
                             @Value("${pulldb.paging.max-limit:500}") int maxLimit) {
        this.store = store;
        this.fanOut = fanOut;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    public <T extends StoredEntity, R> Page<R> fetch(EntityQuery<T> query, PageRequest request, ContextLoader<T, R> loader) {
        int limit = safeLimit(request.limit());
        CompletableFuture<Long> totalFuture = request.countTotal()
                ? fanOut.submit(() -> store.count(query))
                : null;

        QueryPage<T> page;
        try {
            page = store.fetchPage(query, limit, request.cursor());
        } finally {
            if (totalFuture != null) {
                fanOut.awaitAll(List.of(totalFuture));
            }
        }
        Long total = totalFuture != null ? fanOut.join(totalFuture) : null;

        List<R> rows;
        if (request.context()) {
            rows = fanOut.map(page.results(), loader::hydrate);
        } else {
            rows = new ArrayList<>(page.results().size());
            for (T row : page.results()) {
                rows.add(loader.bare(row));
            }
        }
        log.debug("Fetched {} rows for {} (more={}, context={})",
                rows.size(), query, page.moreResults(), request.context());
        return new Page<>(rows, page.nextCursor(), page.moreResults(), total);
    }

    /**
     * Clamps a requested page size into {@code [1, max-limit]}, using the default for missing or non-positive values.
     */
    public int safeLimit(Integer requested) {
        int base = requested != null && requested > 0 ? requested : defaultLimit;
        return Math.max(1, Math.min(base, maxLimit));
    }
}
