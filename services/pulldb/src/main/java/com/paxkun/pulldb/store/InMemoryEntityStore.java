package com.paxkun.pulldb.store;

import com.google.gson.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-node {@link EntityStore} keeping every record as a detached Gson tree.
 * Records are copied on the way in and out, so callers never share mutable state through the store.
 *
 * Author: Pax
 */
@Slf4j
public class InMemoryEntityStore implements EntityStore {

    private final Map<EntityKey, JsonObject> documents = new ConcurrentHashMap<>();

    @Override
    public <T extends StoredEntity> Optional<T> get(EntityKey key, Class<T> type) {
        JsonObject document = documents.get(key);
        return Optional.ofNullable(document).map(doc -> EntityJson.fromTree(doc, type));
    }

    @Override
    public <T extends StoredEntity> List<T> getMany(List<EntityKey> keys, Class<T> type) {
        List<T> results = new ArrayList<>(keys.size());
        for (EntityKey key : keys) {
            JsonObject document = documents.get(key);
            results.add(document == null ? null : EntityJson.fromTree(document, type));
        }
        return results;
    }

    @Override
    public EntityKey put(StoredEntity entity) {
        EntityKey key = entity.key();
        documents.put(key, EntityJson.toTree(entity));
        return key;
    }

    @Override
    public void putMany(Collection<? extends StoredEntity> entities) {
        for (StoredEntity entity : entities) {
            put(entity);
        }
    }

    @Override
    public void deleteMany(Collection<EntityKey> keys) {
        keys.forEach(documents::remove);
    }

    @Override
    public <T extends StoredEntity> QueryPage<T> fetchPage(EntityQuery<T> query, int limit, String cursor) {
        QueryPage<T> page = QueryEvaluator.page(QueryEvaluator.select(documents.entrySet(), query), query.type(), limit, cursor);
        log.debug("Fetched {} rows for {}", page.results().size(), query);
        return page;
    }

    @Override
    public <T extends StoredEntity> List<T> fetchAll(EntityQuery<T> query) {
        return QueryEvaluator.convert(QueryEvaluator.select(documents.entrySet(), query), query.type());
    }

    @Override
    public long count(EntityQuery<?> query) {
        return QueryEvaluator.select(documents.entrySet(), query).size();
    }
}
