package com.paxkun.pulldb.store;

/**
 * A record that can live in an {@link EntityStore}. The key is always derived from the record's own fields.
 */
public interface StoredEntity {

    EntityKey key();
}
