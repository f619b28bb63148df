package com.paxkun.pulldb.store;

import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Evaluates an {@link EntityQuery} over candidate documents: filters, ordering and offset paging.
 * Both stores answer queries through here, so they agree on what matches and in which order.
 */
final class QueryEvaluator {

    private QueryEvaluator() {
    }

    static List<JsonObject> select(Iterable<Map.Entry<EntityKey, JsonObject>> candidates, EntityQuery<?> query) {
        List<Map.Entry<EntityKey, JsonObject>> matches = new ArrayList<>();
        for (Map.Entry<EntityKey, JsonObject> entry : candidates) {
            EntityKey key = entry.getKey();
            if (!key.kind().equals(query.kind())) {
                continue;
            }
            if (query.ancestor() != null && !key.hasAncestor(query.ancestor())) {
                continue;
            }
            if (query.filters().stream().allMatch(filter -> EntityJson.matches(entry.getValue(), filter))) {
                matches.add(entry);
            }
        }

        Comparator<Map.Entry<EntityKey, JsonObject>> byKey = Comparator.comparing(entry -> entry.getKey().path());
        Comparator<Map.Entry<EntityKey, JsonObject>> order = byKey;
        if (query.orderField() != null) {
            Comparator<JsonObject> fieldOrder = EntityJson.fieldOrder(query.orderField());
            if (query.descending()) {
                fieldOrder = fieldOrder.reversed();
            }
            Comparator<JsonObject> finalFieldOrder = fieldOrder;
            order = Comparator.<Map.Entry<EntityKey, JsonObject>, JsonObject>comparing(Map.Entry::getValue, finalFieldOrder)
                    .thenComparing(byKey);
        }
        matches.sort(order);

        List<JsonObject> results = new ArrayList<>(matches.size());
        for (Map.Entry<EntityKey, JsonObject> entry : matches) {
            results.add(entry.getValue());
        }
        return results;
    }

    /**
     * Cuts one page out of an ordered match list. A cursor past the end yields an exhausted page.
     */
    static <T extends StoredEntity> QueryPage<T> page(List<JsonObject> matches, Class<T> type, int limit, String cursor) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Page limit must be positive: " + limit);
        }
        int start = Math.min(OffsetCursor.decode(cursor), matches.size());
        int end = start + Math.min(limit, matches.size() - start);
        List<T> page = convert(matches.subList(start, end), type);
        boolean more = end < matches.size();
        return new QueryPage<>(page, more ? OffsetCursor.encode(end) : "", more);
    }

    static <T> List<T> convert(List<JsonObject> documents, Class<T> type) {
        List<T> results = new ArrayList<>(documents.size());
        for (JsonObject document : documents) {
            results.add(EntityJson.fromTree(document, type));
        }
        return results;
    }
}
