package com.xammer.tagops.util;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per key, created on first use and dropped once no thread holds or waits for it.
 * Callers on different keys never block each other.
 */
public class KeyedLocks<K> {

    private final ConcurrentMap<K, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(K key, Supplier<T> action) {
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry e = existing == null ? new Entry() : existing;
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
        }
    }

    public void withLock(K key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Number of keys currently locked or awaited.
     */
    public int activeKeys() {
        return locks.size();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
