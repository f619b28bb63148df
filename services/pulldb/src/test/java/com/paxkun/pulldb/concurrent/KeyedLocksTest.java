package com.paxkun.pulldb.concurrent;

import com.paxkun.pulldb.store.EntityKey;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyedLocksTest {

    private static final EntityKey PULL_ONE = EntityKey.of("User", "alice").child("Pull", 1);
    private static final EntityKey PULL_TWO = EntityKey.of("User", "alice").child("Pull", 2);

    @Test
    void sameKeyMapsToSameStripe() {
        KeyedLocks locks = new KeyedLocks(32);

        assertThat(locks.stripeFor(PULL_ONE)).isEqualTo(locks.stripeFor(EntityKey.of("User", "alice").child("Pull", 1)));
    }

    @Test
    void duplicateKeysTakeTheStripeOnce() {
        KeyedLocks locks = new KeyedLocks(32);

        try (KeyedLocks.Held held = locks.lockAll(List.of(PULL_ONE, PULL_ONE))) {
            assertThat(held.size()).isEqualTo(1);
        }
    }

    @Test
    void heldKeyBlocksOtherThreadsUntilReleased() throws Exception {
        KeyedLocks locks = new KeyedLocks(32);
        ExecutorService other = Executors.newSingleThreadExecutor();
        CountDownLatch acquired = new CountDownLatch(1);
        AtomicBoolean released = new AtomicBoolean(false);
        try {
            Future<Boolean> waiter;
            try (KeyedLocks.Held held = locks.lockAll(List.of(PULL_ONE))) {
                waiter = other.submit(() -> {
                    try (KeyedLocks.Held inner = locks.lockAll(List.of(PULL_ONE))) {
                        acquired.countDown();
                        return released.get();
                    }
                });
                assertThat(acquired.await(200, TimeUnit.MILLISECONDS)).isFalse();
                released.set(true);
            }
            assertThat(waiter.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            other.shutdownNow();
        }
    }

    @Test
    void overlappingBatchesInOppositeOrderDoNotDeadlock() throws Exception {
        KeyedLocks locks = new KeyedLocks(64);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Runnable forward = () -> {
                for (int i = 0; i < 500; i++) {
                    locks.lockAll(List.of(PULL_ONE, PULL_TWO)).close();
                }
            };
            Runnable backward = () -> {
                for (int i = 0; i < 500; i++) {
                    locks.lockAll(List.of(PULL_TWO, PULL_ONE)).close();
                }
            };
            Future<?> a = pool.submit(forward);
            Future<?> b = pool.submit(backward);
            a.get(10, TimeUnit.SECONDS);
            b.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void stripeCountMustBePositive() {
        assertThatThrownBy(() -> new KeyedLocks(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
