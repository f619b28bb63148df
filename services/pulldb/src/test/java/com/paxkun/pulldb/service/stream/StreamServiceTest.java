package com.paxkun.pulldb.service.stream;

import com.paxkun.pulldb.concurrent.AutoCloseableExecutor;
import com.paxkun.pulldb.concurrent.FanOut;
import com.paxkun.pulldb.concurrent.KeyedLocks;
import com.paxkun.pulldb.model.Issue;
import com.paxkun.pulldb.model.Publisher;
import com.paxkun.pulldb.model.Pull;
import com.paxkun.pulldb.model.Stream;
import com.paxkun.pulldb.model.UserIdentity;
import com.paxkun.pulldb.model.Volume;
import com.paxkun.pulldb.service.LoggerService;
import com.paxkun.pulldb.service.page.Page;
import com.paxkun.pulldb.service.page.PageRequest;
import com.paxkun.pulldb.service.page.PagedQueryService;
import com.paxkun.pulldb.service.pull.BatchResult;
import com.paxkun.pulldb.service.pull.ClassificationBucket;
import com.paxkun.pulldb.store.InMemoryEntityStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class StreamServiceTest {

    private static final UserIdentity ALICE = UserIdentity.of("alice");

    @Mock
    private LoggerService loggerService;

    private AutoCloseableExecutor executor;
    private InMemoryEntityStore store;
    private StreamService service;

    @BeforeEach
    void setUp() {
        executor = new AutoCloseableExecutor(Executors.newFixedThreadPool(4), 5);
        FanOut fanOut = new FanOut(executor);
        store = new InMemoryEntityStore();
        service = new StreamService(store, new KeyedLocks(16),
                new PagedQueryService(store, fanOut, 100, 500),
                new StreamContextLoader(store), loggerService);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void addStreamsClassifiesEachName() {
        store.put(new Stream("alice", "backlog"));

        BatchResult result = service.addStreams(ALICE, List.of("weekly", "backlog", " weekly ", "a/b", 5));

        assertThat(result.get(ClassificationBucket.ADDED)).containsExactly("weekly");
        assertThat(result.get(ClassificationBucket.SKIPPED)).containsExactly("backlog", "weekly");
        assertThat(result.get(ClassificationBucket.FAILED)).containsExactly("a/b", "5");
        assertThat(store.get(Stream.keyFor("alice", "weekly"), Stream.class)).isPresent();
    }

    @Test
    void streamsAreScopedToTheirUser() {
        store.put(new Stream("bob", "weekly"));

        assertThat(service.getStream(ALICE, "weekly", false)).isEmpty();
        assertThat(service.addStreams(ALICE, List.of("weekly")).get(ClassificationBucket.ADDED)).containsExactly("weekly");
    }

    @Test
    void updateAddsAndDeletesMembers() {
        Stream weekly = new Stream("alice", "weekly");
        weekly.getVolumes().add(7L);
        store.put(weekly);

        StreamUpdate update = new StreamUpdate("weekly",
                new MembershipChange(List.of(3), null),
                new MembershipChange(List.of("7"), List.of(7, 8)),
                new MembershipChange(null, List.of("x")));
        BatchResult result = service.updateStreams(ALICE, List.of(update, new StreamUpdate("missing", null, null, null)));

        assertThat(result.get(ClassificationBucket.UPDATED)).containsExactly(
                "stream/weekly/publisher/3/add", "stream/weekly/volume/7/del");
        assertThat(result.get(ClassificationBucket.SKIPPED)).containsExactly(
                "stream/weekly/volume/7/add", "stream/weekly/volume/8/del");
        assertThat(result.get(ClassificationBucket.FAILED)).containsExactly(
                "stream/weekly/issue/x/del", "missing");

        Stream stored = store.get(Stream.keyFor("alice", "weekly"), Stream.class).orElseThrow();
        assertThat(stored.getPublishers()).containsExactly(3L);
        assertThat(stored.getVolumes()).isEmpty();
    }

    @Test
    void getWithContextLoadsTheMembersTheCatalogHas() {
        store.putMany(List.of(
                new Publisher(3, "Image"),
                Volume.builder().identifier(10).name("Saga").publisher(3L).build(),
                Issue.builder().identifier(100).volume(10L).name("Saga #1").build()));
        Stream weekly = new Stream("alice", "weekly");
        weekly.getPublishers().add(3L);
        weekly.getVolumes().addAll(List.of(10L, 404L));
        weekly.getIssues().add(100L);
        store.put(weekly);

        StreamContext context = service.getStream(ALICE, "weekly", true).orElseThrow();

        assertThat(context.publishers()).extracting(Publisher::getName).containsExactly("Image");
        assertThat(context.volumes()).extracting(Volume::getIdentifier).containsExactly(10L);
        assertThat(context.issues()).extracting(Issue::getIdentifier).containsExactly(100L);
        assertThat(service.getStream(ALICE, "weekly", false).orElseThrow().volumes()).isNull();
    }

    @Test
    void listStreamsIsOrderedByName() {
        store.putMany(List.of(new Stream("alice", "weekly"), new Stream("alice", "backlog"), new Stream("bob", "other")));

        Page<StreamContext> page = service.listStreams(ALICE, PageRequest.first(10));

        assertThat(page.results()).extracting(context -> context.stream().getName()).containsExactly("backlog", "weekly");
    }

    @Test
    void refreshGroupsMatchingPullsAndCountsUnreadOnes() {
        store.put(Volume.builder().identifier(20).name("Invincible").publisher(3L).build());
        Stream weekly = new Stream("alice", "weekly");
        weekly.getVolumes().add(10L);
        weekly.getPublishers().add(3L);
        weekly.getIssues().add(500L);
        store.put(weekly);
        store.putMany(List.of(
                pull(1, 10L, true, false, false),
                pull(2, 10L, true, true, false),
                pull(3, 20L, true, false, false),
                pull(4, 10L, false, false, true),
                pull(500, 99L, true, false, false),
                pull(6, 99L, true, false, false)));
        Pull stale = pull(7, 99L, true, false, false);
        stale.setStream(weekly.key().path());
        store.put(stale);

        Stream refreshed = service.refreshStream(ALICE, "weekly").orElseThrow();

        assertThat(refreshed.getLength()).isEqualTo(3);
        assertThat(store.get(Stream.keyFor("alice", "weekly"), Stream.class).orElseThrow().getLength()).isEqualTo(3);
        assertThat(store.get(Pull.keyFor("alice", 3), Pull.class).orElseThrow().getStream())
                .isEqualTo("User:alice/Stream:weekly");
        assertThat(store.get(Pull.keyFor("alice", 6), Pull.class).orElseThrow().getStream()).isNull();
        assertThat(store.get(Pull.keyFor("alice", 7), Pull.class).orElseThrow().getStream()).isNull();
    }

    @Test
    void refreshOfAnUnknownStreamIsEmpty() {
        assertThat(service.refreshStream(ALICE, "nowhere")).isEmpty();
        assertThat(service.refreshStream(ALICE, "  ")).isEmpty();
    }

    private static Pull pull(long issueId, Long volume, boolean pulled, boolean read, boolean ignored) {
        return Pull.builder()
                .user("alice")
                .identifier(issueId)
                .volume(volume)
                .pulled(pulled)
                .read(read)
                .ignored(ignored)
                .build();
    }
}
