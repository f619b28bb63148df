package com.paxkun.pulldb.service.watch;

import com.paxkun.pulldb.concurrent.AutoCloseableExecutor;
import com.paxkun.pulldb.concurrent.FanOut;
import com.paxkun.pulldb.concurrent.KeyedLocks;
import com.paxkun.pulldb.model.CollectionRef;
import com.paxkun.pulldb.model.Pull;
import com.paxkun.pulldb.model.StoryArc;
import com.paxkun.pulldb.model.UserIdentity;
import com.paxkun.pulldb.model.Volume;
import com.paxkun.pulldb.model.Watch;
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

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class WatchServiceTest {

    private static final UserIdentity ALICE = UserIdentity.of("alice");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-15T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private LoggerService loggerService;

    private AutoCloseableExecutor executor;
    private InMemoryEntityStore store;
    private WatchService service;

    @BeforeEach
    void setUp() {
        executor = new AutoCloseableExecutor(Executors.newFixedThreadPool(4), 5);
        FanOut fanOut = new FanOut(executor);
        store = new InMemoryEntityStore();
        service = new WatchService(store, fanOut, new KeyedLocks(16),
                new PagedQueryService(store, fanOut, 100, 500),
                new WatchContextLoader(store), loggerService, CLOCK);
        store.putMany(List.of(
                Volume.builder().identifier(10).name("Saga").build(),
                Volume.builder().identifier(11).name("Paper Girls").build(),
                StoryArc.builder().identifier(7).name("Crossover").build()));
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void addWatchesClassifiesEachCollection() {
        store.put(new Watch("alice", CollectionRef.volume(11), LocalDate.parse("2020-01-01")));

        BatchResult result = service.addWatches(ALICE, List.of("10", 11, 12, "nope"), List.of(7), null);

        assertThat(result.get(ClassificationBucket.ADDED)).containsExactly("volume:10", "arc:7");
        assertThat(result.get(ClassificationBucket.SKIPPED)).containsExactly("volume:11");
        assertThat(result.get(ClassificationBucket.FAILED)).containsExactly("volume:nope", "volume:12");
    }

    @Test
    void startDateDefaultsToToday() {
        service.addWatches(ALICE, List.of(10), List.of(), null);

        Watch watch = store.get(Watch.keyFor("alice", CollectionRef.volume(10)), Watch.class).orElseThrow();
        assertThat(watch.getStartDate()).isEqualTo(LocalDate.parse("2024-06-15"));
    }

    @Test
    void explicitStartDateIsKept() {
        service.addWatches(ALICE, List.of(10), null, LocalDate.parse("2019-05-01"));

        assertThat(store.get(Watch.keyFor("alice", CollectionRef.volume(10)), Watch.class).orElseThrow().getStartDate())
                .isEqualTo(LocalDate.parse("2019-05-01"));
    }

    @Test
    void removeLeavesPullsInPlace() {
        store.put(new Watch("alice", CollectionRef.volume(10), LocalDate.parse("2020-01-01")));
        store.put(Pull.builder().user("alice").identifier(1).collection("volume:10").build());

        BatchResult result = service.removeWatches(ALICE, List.of(10, 11), List.of());

        assertThat(result.get(ClassificationBucket.REMOVED)).containsExactly("volume:10");
        assertThat(result.get(ClassificationBucket.SKIPPED)).containsExactly("volume:11");
        assertThat(store.get(Watch.keyFor("alice", CollectionRef.volume(10)), Watch.class)).isEmpty();
        assertThat(store.get(Pull.keyFor("alice", 1), Pull.class)).isPresent();
    }

    @Test
    void updateMovesStartDates() {
        store.put(new Watch("alice", CollectionRef.volume(10), LocalDate.parse("2020-01-01")));
        store.put(new Watch("alice", CollectionRef.arc(7), LocalDate.parse("2020-01-01")));

        BatchResult result = service.updateWatches(ALICE,
                Map.of("10", "2021-05-01T00:00:00Z"),
                Map.of("7", "2020-01-01"));

        assertThat(result.get(ClassificationBucket.UPDATED)).containsExactly("volume:10");
        assertThat(result.get(ClassificationBucket.SKIPPED)).containsExactly("arc:7");
        assertThat(store.get(Watch.keyFor("alice", CollectionRef.volume(10)), Watch.class).orElseThrow().getStartDate())
                .isEqualTo(LocalDate.parse("2021-05-01"));
    }

    @Test
    void updateFailsUnwatchedAndUnparseable() {
        store.put(new Watch("alice", CollectionRef.volume(10), LocalDate.parse("2020-01-01")));

        BatchResult result = service.updateWatches(ALICE, Map.of("10", "someday"), Map.of("7", "2021-01-01"));

        assertThat(result.get(ClassificationBucket.FAILED)).containsExactlyInAnyOrder("volume:10", "arc:7");
        assertThat(result.get(ClassificationBucket.UPDATED)).isEmpty();
    }

    @Test
    void listWatchesHydratesCollectionsOnRequest() {
        store.put(new Watch("alice", CollectionRef.volume(10), LocalDate.parse("2020-01-01")));
        store.put(new Watch("bob", CollectionRef.volume(11), LocalDate.parse("2020-01-01")));

        Page<WatchContext> bare = service.listWatches(ALICE, PageRequest.first(10));
        Page<WatchContext> hydrated = service.listWatches(ALICE, PageRequest.first(10).withContext(true));

        assertThat(bare.results()).hasSize(1);
        assertThat(bare.results().get(0).collection()).isNull();
        assertThat(hydrated.results().get(0).collection()).isInstanceOf(Volume.class);
        assertThat(((Volume) hydrated.results().get(0).collection()).getName()).isEqualTo("Saga");
    }

    @Test
    void getWatchReturnsEmptyWhenNotWatched() {
        assertThat(service.getWatch(ALICE, CollectionRef.arc(7), false)).isEmpty();
    }
}
