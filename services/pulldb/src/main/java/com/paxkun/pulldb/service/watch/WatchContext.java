package com.paxkun.pulldb.service.watch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.paxkun.pulldb.model.Watch;
import com.paxkun.pulldb.store.StoredEntity;

/**
 * A watch with its watched volume or story arc, when context was requested and the collection still exists.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WatchContext(Watch watch, StoredEntity collection) {

    public static WatchContext bare(Watch watch) {
        return new WatchContext(watch, null);
    }
}
