package com.paxkun.pulldb.store;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.reflect.TypeToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.lang.reflect.Type;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link EntityStore} backed by Noona Vault. Every call is one or more authenticated packets to
 * {@code /v1/vault/handle}, against one Mongo collection per record kind, using only the
 * {@code find}, {@code findMany} and {@code update} operations.
 * <p>
 * Records carry their key path in {@code _id} and their ancestor paths in {@code _ancestors}.
 * Queries fetch the ancestor's records with {@code findMany} and are filtered, ordered, paged and
 * counted here. Deletes are tombstones: an {@code update} setting {@code _deleted}, which reads
 * treat as absent and a later put clears.
 *
 * Author: Pax
 */
@Slf4j
public class VaultEntityStore implements EntityStore {

    private static final Type DOCUMENT_TYPE = new TypeToken<Map<String, Object>>() {}.getType();
    private static final String ID_FIELD = "_id";
    private static final String ANCESTORS_FIELD = "_ancestors";
    private static final String DELETED_FIELD = "_deleted";

    private final WebClient webClient;
    private final String vaultUrl;
    private final String vaultApiToken;
    // nulls are written so an update clears fields the entity no longer has
    private final Gson gson = EntityJson.gson().newBuilder().serializeNulls().create();

    public VaultEntityStore(WebClient webClient, String vaultUrl, String vaultApiToken) {
        this.webClient = webClient;
        this.vaultUrl = vaultUrl;
        this.vaultApiToken = vaultApiToken;
    }

    // ─────────────────────────────────────────────────────────────
    // TRANSPORT
    // ─────────────────────────────────────────────────────────────

    /**
     * Sends one packet to Vault and returns the decoded response body.
     *
     * @throws StoreUnavailableException if no API token is configured, the request fails or Vault answers with nothing
     */
    @SuppressWarnings("unchecked")
    private Map<String, Object> sendPacket(String operation, Map<String, Object> payload) {
        if (vaultApiToken == null || vaultApiToken.isBlank()) {
            throw new StoreUnavailableException("VAULT_API_TOKEN is not configured. Set the VAULT_API_TOKEN environment variable or the 'vault.apiToken' property.");
        }
        Map<String, Object> packet = Map.of(
                "storageType", "mongo",
                "operation", operation,
                "payload", payload
        );
        Map<String, Object> response;
        try {
            response = webClient.post()
                    .uri(vaultUrl + "/v1/vault/handle")
                    .header("Authorization", "Bearer " + vaultApiToken)
                    .bodyValue(packet)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .block();
        } catch (Exception e) {
            throw new StoreUnavailableException("Vault " + operation + " failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new StoreUnavailableException("Vault " + operation + " returned no body");
        }
        Object error = response.get("error");
        if (error != null) {
            throw new StoreUnavailableException("Vault " + operation + " rejected: " + error);
        }
        return response;
    }

    // ─────────────────────────────────────────────────────────────
    // KEYED OPS
    // ─────────────────────────────────────────────────────────────

    @Override
    public <T extends StoredEntity> Optional<T> get(EntityKey key, Class<T> type) {
        Map<String, Object> payload = Map.of(
                "collection", key.kind(),
                "query", Map.of(ID_FIELD, key.path())
        );
        Object data = sendPacket("find", payload).get("data");
        if (data instanceof Map<?, ?> document) {
            JsonObject tree = toTree(document);
            if (!isDeleted(tree)) {
                return Optional.of(EntityJson.fromTree(tree, type));
            }
        }
        return Optional.empty();
    }

    @Override
    public <T extends StoredEntity> List<T> getMany(List<EntityKey> keys, Class<T> type) {
        Map<String, List<String>> pathsByKind = new LinkedHashMap<>();
        for (EntityKey key : keys) {
            pathsByKind.computeIfAbsent(key.kind(), kind -> new ArrayList<>()).add(key.path());
        }

        Map<String, T> found = new HashMap<>();
        for (Map.Entry<String, List<String>> entry : pathsByKind.entrySet()) {
            Map<String, Object> payload = Map.of(
                    "collection", entry.getKey(),
                    "query", Map.of(ID_FIELD, Map.of("$in", entry.getValue()))
            );
            for (Map.Entry<EntityKey, JsonObject> document : liveDocuments(sendPacket("findMany", payload))) {
                found.put(document.getKey().path(), EntityJson.fromTree(document.getValue(), type));
            }
        }

        List<T> results = new ArrayList<>(keys.size());
        for (EntityKey key : keys) {
            results.add(found.get(key.path()));
        }
        return results;
    }

    @Override
    public EntityKey put(StoredEntity entity) {
        EntityKey key = entity.key();
        Map<String, Object> document = toDocument(entity);
        update(key, document, true);
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
        for (EntityKey key : keys) {
            update(key, Map.of(DELETED_FIELD, true), false);
        }
    }

    private void update(EntityKey key, Map<String, Object> fields, boolean upsert) {
        sendPacket("update", Map.of(
                "collection", key.kind(),
                "query", Map.of(ID_FIELD, key.path()),
                "update", Map.of("$set", fields),
                "upsert", upsert
        ));
    }

    // ─────────────────────────────────────────────────────────────
    // QUERIES
    // ─────────────────────────────────────────────────────────────

    @Override
    public <T extends StoredEntity> QueryPage<T> fetchPage(EntityQuery<T> query, int limit, String cursor) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Page limit must be positive: " + limit);
        }
        return QueryEvaluator.page(select(query), query.type(), limit, cursor);
    }

    @Override
    public <T extends StoredEntity> List<T> fetchAll(EntityQuery<T> query) {
        return QueryEvaluator.convert(select(query), query.type());
    }

    @Override
    public long count(EntityQuery<?> query) {
        return select(query).size();
    }

    private List<JsonObject> select(EntityQuery<?> query) {
        Map<String, Object> payload = Map.of(
                "collection", query.kind(),
                "query", scopeQuery(query)
        );
        List<Map.Entry<EntityKey, JsonObject>> candidates = liveDocuments(sendPacket("findMany", payload));
        List<JsonObject> matches = QueryEvaluator.select(candidates, query);
        log.debug("Vault returned {} candidates, {} matching {}", candidates.size(), matches.size(), query);
        return matches;
    }

    /**
     * The part of a query Vault evaluates: the ancestor scope. Filters and order are applied here.
     */
    Map<String, Object> scopeQuery(EntityQuery<?> query) {
        if (query.ancestor() == null) {
            return Map.of();
        }
        return Map.of(ANCESTORS_FIELD, query.ancestor().path());
    }

    // ─────────────────────────────────────────────────────────────
    // UTILS
    // ─────────────────────────────────────────────────────────────

    private Map<String, Object> toDocument(StoredEntity entity) {
        Map<String, Object> document = gson.fromJson(gson.toJsonTree(entity), DOCUMENT_TYPE);
        document.put(ANCESTORS_FIELD, entity.key().ancestorPaths());
        document.put(DELETED_FIELD, false);
        return document;
    }

    private JsonObject toTree(Map<?, ?> document) {
        return gson.toJsonTree(document).getAsJsonObject();
    }

    private static boolean isDeleted(JsonObject tree) {
        JsonElement deleted = tree.get(DELETED_FIELD);
        return deleted != null && deleted.isJsonPrimitive() && deleted.getAsBoolean();
    }

    /**
     * Response documents that are not tombstones, keyed by the path in their {@code _id}.
     */
    private List<Map.Entry<EntityKey, JsonObject>> liveDocuments(Map<String, Object> response) {
        Object data = response.get("data");
        if (!(data instanceof List<?> list)) {
            return List.of();
        }
        List<Map.Entry<EntityKey, JsonObject>> documents = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                continue;
            }
            JsonObject tree = toTree(map);
            JsonElement id = tree.get(ID_FIELD);
            if (id == null || !id.isJsonPrimitive()) {
                log.warn("Skipping Vault document without a key path: {}", tree);
                continue;
            }
            if (isDeleted(tree)) {
                continue;
            }
            try {
                documents.add(new AbstractMap.SimpleImmutableEntry<>(EntityKey.parsePath(id.getAsString()), tree));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping Vault document with malformed key path {}: {}", id, e.getMessage());
            }
        }
        return documents;
    }
}
