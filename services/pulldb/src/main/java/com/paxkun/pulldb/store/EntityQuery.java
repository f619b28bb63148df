package com.paxkun.pulldb.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of an ordered, filtered query over one kind of record.
 *
 * <pre>
 * EntityQuery.of(Pull.class, Pull.KIND)
 *         .ancestor(userKey)
 *         .filter(QueryFilter.eq("pulled", false))
 *         .orderBy("pubdate", false);
 * </pre>
 *
 * Author: Pax
 */
public final class EntityQuery<T extends StoredEntity> {

    private final Class<T> type;
    private final String kind;
    private final EntityKey ancestor;
    private final List<QueryFilter> filters;
    private final String orderField;
    private final boolean descending;

    private EntityQuery(Class<T> type, String kind, EntityKey ancestor, List<QueryFilter> filters,
                        String orderField, boolean descending) {
        this.type = Objects.requireNonNull(type, "type");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.ancestor = ancestor;
        this.filters = List.copyOf(filters);
        this.orderField = orderField;
        this.descending = descending;
    }

    public static <T extends StoredEntity> EntityQuery<T> of(Class<T> type, String kind) {
        return new EntityQuery<>(type, kind, null, List.of(), null, false);
    }

    public EntityQuery<T> ancestor(EntityKey newAncestor) {
        return new EntityQuery<>(type, kind, newAncestor, filters, orderField, descending);
    }

    public EntityQuery<T> filter(QueryFilter filter) {
        List<QueryFilter> combined = new ArrayList<>(filters);
        combined.add(filter);
        return new EntityQuery<>(type, kind, ancestor, combined, orderField, descending);
    }

    public EntityQuery<T> filterEq(String field, Object value) {
        return filter(QueryFilter.eq(field, value));
    }

    public EntityQuery<T> orderBy(String field, boolean descendingOrder) {
        return new EntityQuery<>(type, kind, ancestor, filters, field, descendingOrder);
    }

    public Class<T> type() {
        return type;
    }

    public String kind() {
        return kind;
    }

    public EntityKey ancestor() {
        return ancestor;
    }

    public List<QueryFilter> filters() {
        return filters;
    }

    public String orderField() {
        return orderField;
    }

    public boolean descending() {
        return descending;
    }

    @Override
    public String toString() {
        return "EntityQuery{" + kind
                + (ancestor != null ? ", ancestor=" + ancestor : "")
                + ", filters=" + filters
                + (orderField != null ? ", order=" + (descending ? "-" : "") + orderField : "")
                + "}";
    }
}
