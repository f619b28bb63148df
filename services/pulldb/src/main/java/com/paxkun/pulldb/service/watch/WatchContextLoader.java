package com.paxkun.pulldb.service.watch;

import com.paxkun.pulldb.model.Watch;
import com.paxkun.pulldb.service.page.ContextLoader;
import com.paxkun.pulldb.store.EntityStore;
import com.paxkun.pulldb.store.StoredEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class WatchContextLoader implements ContextLoader<Watch, WatchContext> {

    private final EntityStore store;

    @Override
    public WatchContext bare(Watch watch) {
        return WatchContext.bare(watch);
    }

    @Override
    public WatchContext hydrate(Watch watch) {
        return new WatchContext(watch, loadCollection(watch).orElse(null));
    }

    Optional<? extends StoredEntity> loadCollection(Watch watch) {
        return store.get(watch.collection().key(), watch.getCollectionType().entityType());
    }
}
