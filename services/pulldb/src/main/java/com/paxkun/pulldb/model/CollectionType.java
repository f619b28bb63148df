package com.paxkun.pulldb.model;

import com.paxkun.pulldb.store.StoredEntity;

import java.util.Locale;

/**
 * Kinds of catalog collection a user can watch.
 */
public enum CollectionType {
    VOLUME("volume", Volume.KIND, Volume.class),
    ARC("arc", StoryArc.KIND, StoryArc.class);

    private final String wireName;
    private final String entityKind;
    private final Class<? extends StoredEntity> entityType;

    CollectionType(String wireName, String entityKind, Class<? extends StoredEntity> entityType) {
        this.wireName = wireName;
        this.entityKind = entityKind;
        this.entityType = entityType;
    }

    public String wireName() {
        return wireName;
    }

    public String entityKind() {
        return entityKind;
    }

    public Class<? extends StoredEntity> entityType() {
        return entityType;
    }

    public static CollectionType fromWireName(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (CollectionType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown collection type: " + value);
    }
}
