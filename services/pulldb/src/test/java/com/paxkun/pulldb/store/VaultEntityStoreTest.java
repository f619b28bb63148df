package com.paxkun.pulldb.store;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.paxkun.pulldb.model.Issue;
import com.paxkun.pulldb.model.Pull;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.io.OutputStream;
import java.lang.reflect.Type;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class VaultEntityStoreTest {

    private static final Gson GSON = new Gson();
    private static final Type PACKET_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    private HttpServer server;
    private int port;
    private final List<String> packets = new CopyOnWriteArrayList<>();
    private final AtomicReference<String> capturedAuth = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        port = server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void getSendsFindPacketWithKeyPathAndBearerToken() {
        respondWith(Map.of("status", "ok", "data", Map.of(
                "_id", "Issue:42",
                "identifier", 42,
                "volume", 7,
                "pubdate", "2020-01-02")));

        Issue issue = store("test-token").get(Issue.keyFor(42), Issue.class).orElseThrow();

        assertThat(issue.getIdentifier()).isEqualTo(42);
        assertThat(issue.getVolume()).isEqualTo(7L);
        assertThat(issue.getPubdate()).isEqualTo(LocalDate.parse("2020-01-02"));
        assertEquals("Bearer test-token", capturedAuth.get());

        Map<String, Object> packet = packet(0);
        assertEquals("mongo", packet.get("storageType"));
        assertEquals("find", packet.get("operation"));
        Map<String, Object> payload = payload(packet);
        assertEquals("Issue", payload.get("collection"));
        assertEquals(Map.of("_id", "Issue:42"), payload.get("query"));
    }

    @Test
    void tombstonedRecordsReadAsAbsent() {
        respondWith(Map.of("status", "ok", "data", Map.of(
                "_id", "Issue:42",
                "identifier", 42,
                "_deleted", true)));

        assertThat(store("test-token").get(Issue.keyFor(42), Issue.class)).isEmpty();
    }

    @Test
    void putUpsertsTheWholeRecordThroughUpdate() {
        respondWith(Map.of("status", "ok"));
        Pull pull = Pull.builder().user("alice").identifier(5).pulled(true).build();

        store("test-token").put(pull);

        Map<String, Object> packet = packet(0);
        assertEquals("update", packet.get("operation"));
        Map<String, Object> payload = payload(packet);
        assertEquals("Pull", payload.get("collection"));
        assertEquals(Map.of("_id", "User:alice/Pull:5"), payload.get("query"));
        assertEquals(true, payload.get("upsert"));

        @SuppressWarnings("unchecked")
        Map<String, Object> set = (Map<String, Object>) ((Map<String, Object>) payload.get("update")).get("$set");
        assertEquals(true, set.get("pulled"));
        assertEquals(false, set.get("_deleted"));
        assertEquals(List.of("User:alice", "User:alice/Pull:5"), set.get("_ancestors"));
        assertThat(set).containsKey("watch");
        assertThat(set.get("watch")).isNull();
    }

    @Test
    void deleteManyWritesOneTombstonePerKey() {
        respondWith(Map.of("status", "ok"));

        store("test-token").deleteMany(List.of(Pull.keyFor("alice", 1), Pull.keyFor("alice", 2)));

        assertThat(packets).hasSize(2);
        Map<String, Object> payload = payload(packet(1));
        assertEquals("update", packet(1).get("operation"));
        assertEquals(Map.of("_id", "User:alice/Pull:2"), payload.get("query"));
        assertEquals(Map.of("$set", Map.of("_deleted", true)), payload.get("update"));
        assertEquals(false, payload.get("upsert"));
    }

    @Test
    void queriesFetchTheAncestorScopeAndFilterOrderAndPageLocally() {
        respondWith(Map.of("status", "ok", "data", List.of(
                pullDocument(1, false, "2020-01-01"),
                pullDocument(2, true, "2020-01-02"),
                pullDocument(3, false, "2020-01-03"),
                Map.of("_id", "User:alice/Pull:4", "user", "alice", "identifier", 4,
                        "pulled", false, "pubdate", "2020-01-04", "_deleted", true))));

        EntityQuery<Pull> query = EntityQuery.of(Pull.class, Pull.KIND)
                .ancestor(EntityKey.of("User", "alice"))
                .filterEq("pulled", false)
                .orderBy("pubdate", true);
        QueryPage<Pull> page = store("test-token").fetchPage(query, 1, "");

        assertThat(page.results()).extracting(Pull::getIdentifier).containsExactly(3L);
        assertThat(page.moreResults()).isTrue();
        assertThat(page.nextCursor()).isNotEmpty();

        Map<String, Object> packet = packet(0);
        assertEquals("findMany", packet.get("operation"));
        Map<String, Object> payload = payload(packet);
        assertEquals(Map.of("_ancestors", "User:alice"), payload.get("query"));
        assertThat(payload).doesNotContainKeys("sort", "skip", "limit");
    }

    @Test
    void countSkipsTombstonesAndNonMatchingRecords() {
        respondWith(Map.of("status", "ok", "data", List.of(
                pullDocument(1, false, "2020-01-01"),
                pullDocument(2, true, "2020-01-02"),
                Map.of("_id", "User:alice/Pull:3", "user", "alice", "identifier", 3,
                        "pulled", false, "_deleted", true))));

        long count = store("test-token").count(EntityQuery.of(Pull.class, Pull.KIND)
                .ancestor(EntityKey.of("User", "alice"))
                .filterEq("pulled", false));

        assertThat(count).isEqualTo(1);
    }

    @Test
    void cursorPastTheEndIsAnExhaustedPage() {
        respondWith(Map.of("status", "ok", "data", List.of(pullDocument(1, false, "2020-01-01"))));

        QueryPage<Pull> page = store("test-token").fetchPage(
                EntityQuery.of(Pull.class, Pull.KIND), 10, OffsetCursor.encode(Integer.MAX_VALUE));

        assertThat(page.results()).isEmpty();
        assertThat(page.moreResults()).isFalse();
        assertThat(page.nextCursor()).isEmpty();
    }

    @Test
    void vaultErrorsSurfaceAsStoreUnavailable() {
        respondWith(Map.of("error", "mongo is down"));

        VaultEntityStore store = store("test-token");

        assertThatThrownBy(() -> store.count(EntityQuery.of(Issue.class, Issue.KIND)))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("mongo is down");
    }

    @Test
    void unreachableVaultSurfacesAsStoreUnavailable() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        VaultEntityStore store = new VaultEntityStore(WebClient.builder().build(), "http://127.0.0.1:" + closedPort, "test-token");

        assertThatThrownBy(() -> store.get(Issue.keyFor(1), Issue.class))
                .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void missingTokenIsStoreUnavailableBeforeAnyRequest() {
        VaultEntityStore store = store(" ");

        assertThatThrownBy(() -> store.get(Issue.keyFor(1), Issue.class))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("VAULT_API_TOKEN");
        assertThat(packets).isEmpty();
    }

    @Test
    void onlyTheAncestorIsSentAsTheVaultQuery() {
        VaultEntityStore store = store("test-token");

        assertEquals(Map.of(), store.scopeQuery(EntityQuery.of(Issue.class, Issue.KIND)
                .filter(QueryFilter.gt("pubdate", LocalDate.parse("2020-01-01")))));
        assertEquals(Map.of("_ancestors", "User:bob"), store.scopeQuery(EntityQuery.of(Pull.class, Pull.KIND)
                .ancestor(EntityKey.of("User", "bob"))
                .filterEq("read", true)));
    }

    private static Map<String, Object> pullDocument(long id, boolean pulled, String pubdate) {
        return Map.of(
                "_id", "User:alice/Pull:" + id,
                "_ancestors", List.of("User:alice", "User:alice/Pull:" + id),
                "user", "alice",
                "identifier", id,
                "pulled", pulled,
                "pubdate", pubdate);
    }

    private VaultEntityStore store(String token) {
        return new VaultEntityStore(WebClient.builder().build(), "http://127.0.0.1:" + port, token);
    }

    private Map<String, Object> packet(int index) {
        return GSON.fromJson(packets.get(index), PACKET_TYPE);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> payload(Map<String, Object> packet) {
        return (Map<String, Object>) packet.get("payload");
    }

    private void respondWith(Map<String, Object> response) {
        server.createContext("/v1/vault/handle", exchange -> {
            capturedAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
            packets.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));

            byte[] responseBytes = GSON.toJson(response).getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, responseBytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(responseBytes);
            }
        });
        server.start();
    }
}
