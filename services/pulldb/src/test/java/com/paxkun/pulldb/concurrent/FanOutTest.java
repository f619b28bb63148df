package com.paxkun.pulldb.concurrent;

import com.paxkun.pulldb.store.StoreUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FanOutTest {

    private AutoCloseableExecutor executor;
    private FanOut fanOut;

    @BeforeEach
    void setUp() {
        executor = new AutoCloseableExecutor(Executors.newFixedThreadPool(4), 5);
        fanOut = new FanOut(executor);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void mapKeepsInputOrder() {
        List<Integer> results = fanOut.map(List.of(30, 10, 20), millis -> {
            sleep(millis);
            return millis;
        });

        assertThat(results).containsExactly(30, 10, 20);
    }

    @Test
    void tasksRunConcurrently() {
        CountDownLatch allStarted = new CountDownLatch(3);

        List<Boolean> results = fanOut.map(List.of(1, 2, 3), ignored -> {
            allStarted.countDown();
            try {
                return allStarted.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });

        assertThat(results).containsOnly(true);
    }

    @Test
    void firstFailureIsRethrownUnwrappedAfterEveryTaskFinished() {
        AtomicInteger finished = new AtomicInteger();

        assertThatThrownBy(() -> fanOut.map(List.of(1, 2, 3), value -> {
            if (value == 1) {
                throw new StoreUnavailableException("read " + value + " failed");
            }
            sleep(50);
            finished.incrementAndGet();
            return value;
        }))
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessage("read 1 failed");
        assertThat(finished).hasValue(2);
    }

    @Test
    void emptyInputNeedsNoThreads() {
        assertThat(fanOut.map(List.<Integer>of(), value -> value)).isEmpty();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
