package com.paxkun.pulldb.model;

import com.paxkun.pulldb.store.EntityKey;
import com.paxkun.pulldb.util.Identifiers;

import java.util.Objects;

/**
 * Reference to a watched collection, written as {@code volume:<id>} or {@code arc:<id>}.
 */
public record CollectionRef(CollectionType type, long id) {

    public CollectionRef {
        Objects.requireNonNull(type, "type");
    }

    public static CollectionRef volume(long id) {
        return new CollectionRef(CollectionType.VOLUME, id);
    }

    public static CollectionRef arc(long id) {
        return new CollectionRef(CollectionType.ARC, id);
    }

    /**
     * @throws IllegalArgumentException if the text is not {@code <type>:<numeric id>}
     */
    public static CollectionRef parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Missing collection reference");
        }
        int delimiter = text.indexOf(':');
        if (delimiter <= 0) {
            throw new IllegalArgumentException("Malformed collection reference: " + text);
        }
        CollectionType type = CollectionType.fromWireName(text.substring(0, delimiter));
        long id = Identifiers.parseId(text.substring(delimiter + 1))
                .orElseThrow(() -> new IllegalArgumentException("Malformed collection id: " + text));
        return new CollectionRef(type, id);
    }

    public EntityKey key() {
        return EntityKey.of(type.entityKind(), id);
    }

    @Override
    public String toString() {
        return type.wireName() + ":" + id;
    }
}
