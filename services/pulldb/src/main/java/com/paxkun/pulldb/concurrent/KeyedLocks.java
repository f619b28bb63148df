package com.paxkun.pulldb.concurrent;

import com.paxkun.pulldb.store.EntityKey;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Striped per-key locks serializing read-modify-write sequences on user records.
 * Stripes are always taken in ascending index order, so two batches touching overlapping
 * keys cannot deadlock.
 *
 * Author: Pax
 */
public class KeyedLocks {

    private final ReentrantLock[] stripes;

    public KeyedLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("Stripe count must be positive: " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * Locks every stripe covering {@code keys}. Close the returned handle to release them.
     */
    public Held lockAll(Collection<EntityKey> keys) {
        TreeSet<Integer> indexes = new TreeSet<>();
        for (EntityKey key : keys) {
            indexes.add(stripeFor(key));
        }
        List<ReentrantLock> acquired = new ArrayList<>(indexes.size());
        try {
            for (int index : indexes) {
                ReentrantLock lock = stripes[index];
                lock.lock();
                acquired.add(lock);
            }
        } catch (RuntimeException | Error e) {
            release(acquired);
            throw e;
        }
        return new Held(acquired);
    }

    int stripeFor(EntityKey key) {
        return Math.floorMod(key.hashCode(), stripes.length);
    }

    private static void release(List<ReentrantLock> acquired) {
        for (int i = acquired.size() - 1; i >= 0; i--) {
            acquired.get(i).unlock();
        }
    }

    /**
     * Stripes held by the current thread.
     */
    public static final class Held implements AutoCloseable {

        private final List<ReentrantLock> locks;

        private Held(List<ReentrantLock> locks) {
            this.locks = locks;
        }

        public int size() {
            return locks.size();
        }

        @Override
        public void close() {
            release(locks);
        }
    }
}
