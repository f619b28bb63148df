package com.paxkun.pulldb.store;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Keyed record storage used by every PullDB service.
 * All methods throw {@link StoreUnavailableException} when the backing store cannot be reached.
 */
public interface EntityStore {

    <T extends StoredEntity> Optional<T> get(EntityKey key, Class<T> type);

    /**
     * Batched lookup. The result has one slot per requested key, in request order, with {@code null}
     * for keys that have no record.
     */
    <T extends StoredEntity> List<T> getMany(List<EntityKey> keys, Class<T> type);

    EntityKey put(StoredEntity entity);

    void putMany(Collection<? extends StoredEntity> entities);

    void deleteMany(Collection<EntityKey> keys);

    /**
     * @param cursor opaque continuation from a previous page, or empty/null for the first page
     * @throws IllegalArgumentException if the cursor was not produced by this store
     */
    <T extends StoredEntity> QueryPage<T> fetchPage(EntityQuery<T> query, int limit, String cursor);

    <T extends StoredEntity> List<T> fetchAll(EntityQuery<T> query);

    long count(EntityQuery<?> query);
}
