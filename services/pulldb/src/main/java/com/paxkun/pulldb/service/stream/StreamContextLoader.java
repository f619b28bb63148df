package com.paxkun.pulldb.service.stream;

import com.paxkun.pulldb.model.Issue;
import com.paxkun.pulldb.model.Publisher;
import com.paxkun.pulldb.model.Stream;
import com.paxkun.pulldb.model.Volume;
import com.paxkun.pulldb.service.page.ContextLoader;
import com.paxkun.pulldb.store.EntityKey;
import com.paxkun.pulldb.store.EntityStore;
import com.paxkun.pulldb.store.StoredEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.LongFunction;

@Component
@RequiredArgsConstructor
public class StreamContextLoader implements ContextLoader<Stream, StreamContext> {

    private final EntityStore store;

    @Override
    public StreamContext bare(Stream stream) {
        return StreamContext.bare(stream);
    }

    @Override
    public StreamContext hydrate(Stream stream) {
        return new StreamContext(stream,
                load(stream.getPublishers(), Publisher::keyFor, Publisher.class),
                load(stream.getVolumes(), Volume::keyFor, Volume.class),
                load(stream.getIssues(), Issue::keyFor, Issue.class));
    }

    private <T extends StoredEntity> List<T> load(List<Long> ids, LongFunction<EntityKey> keyFor, Class<T> type) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<EntityKey> keys = new ArrayList<>(ids.size());
        for (Long id : ids) {
            keys.add(keyFor.apply(id));
        }
        List<T> found = new ArrayList<>(store.getMany(keys, type));
        found.removeIf(Objects::isNull);
        return found;
    }
}
