package com.casebridge.sync.common.concurrent;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process mutual exclusion per string key. Unrelated keys never contend and idle keys are released.
 */
@Component
public class KeyedLocks {

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("missing_lock_key");
        }
        var entry = acquireEntry(key);
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            releaseEntry(key);
        }
    }

    int size() {
        return locks.size();
    }

    private Entry acquireEntry(String key) {
        return locks.compute(key, (k, existing) -> {
            var e = existing == null ? new Entry() : existing;
            e.users++;
            return e;
        });
    }

    private void releaseEntry(String key) {
        locks.computeIfPresent(key, (k, e) -> {
            e.users--;
            return e.users <= 0 ? null : e;
        });
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        // Guarded by the map's per-bin compute.
        private int users;
    }
}
