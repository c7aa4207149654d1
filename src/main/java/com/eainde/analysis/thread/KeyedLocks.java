package com.eainde.analysis.thread;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per key, created on demand and dropped once nobody holds or waits for it. Work on different
 * keys never contends.
 */
public class KeyedLocks<K> {

    private final ConcurrentHashMap<K, RefCountedLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(K key, Supplier<T> action) {
        RefCountedLock lock = locks.compute(key, (k, existing) -> {
            RefCountedLock l = existing == null ? new RefCountedLock() : existing;
            l.references++;
            return l;
        });
        lock.lock.lock();
        try {
            return action.get();
        } finally {
            lock.lock.unlock();
            locks.computeIfPresent(key, (k, l) -> --l.references == 0 ? null : l);
        }
    }

    int size() {
        return locks.size();
    }

    private static final class RefCountedLock {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's compute
        private int references;
    }
}
