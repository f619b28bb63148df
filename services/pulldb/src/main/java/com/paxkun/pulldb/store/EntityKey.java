package com.paxkun.pulldb.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Hierarchical key of a stored record.
 * User-scoped records carry a {@code User:<id>} parent, which is what ancestor queries match on.
 *
 * Author: Pax
 */
public record EntityKey(String kind, String id, EntityKey parent) {

    private static final String SEPARATOR = "/";
    private static final String KIND_DELIMITER = ":";

    public EntityKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
        if (kind.contains(SEPARATOR) || kind.contains(KIND_DELIMITER)) {
            throw new IllegalArgumentException("Invalid key kind: " + kind);
        }
        if (id.contains(SEPARATOR)) {
            throw new IllegalArgumentException("Invalid key id: " + id);
        }
    }

    public static EntityKey of(String kind, String id) {
        return new EntityKey(kind, id, null);
    }

    public static EntityKey of(String kind, long id) {
        return of(kind, String.valueOf(id));
    }

    public EntityKey child(String childKind, String childId) {
        return new EntityKey(childKind, childId, this);
    }

    public EntityKey child(String childKind, long childId) {
        return child(childKind, String.valueOf(childId));
    }

    /**
     * True when {@code ancestor} is this key or one of its parents.
     */
    public boolean hasAncestor(EntityKey ancestor) {
        for (EntityKey current = this; current != null; current = current.parent) {
            if (current.equals(ancestor)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Paths of every ancestor including this key, root first.
     */
    public List<String> ancestorPaths() {
        List<String> paths = new ArrayList<>();
        if (parent != null) {
            paths.addAll(parent.ancestorPaths());
        }
        paths.add(path());
        return paths;
    }

    /** Canonical form, e.g. {@code User:alice/Pull:42}. */
    public String path() {
        String own = kind + KIND_DELIMITER + id;
        return parent == null ? own : parent.path() + SEPARATOR + own;
    }

    public static EntityKey parsePath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Empty key path");
        }
        EntityKey key = null;
        for (String segment : path.split(SEPARATOR)) {
            int delimiter = segment.indexOf(KIND_DELIMITER);
            if (delimiter <= 0 || delimiter == segment.length() - 1) {
                throw new IllegalArgumentException("Malformed key segment: " + segment);
            }
            key = new EntityKey(segment.substring(0, delimiter), segment.substring(delimiter + 1), key);
        }
        return key;
    }

    @Override
    public String toString() {
        return path();
    }
}
