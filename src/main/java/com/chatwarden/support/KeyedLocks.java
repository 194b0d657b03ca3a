package com.chatwarden.support;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-key mutual exclusion. Callers holding different keys never contend; an
 * entry is dropped once no thread holds or waits for its key.
 */
public class KeyedLocks {

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry e = existing != null ? existing : new Entry();
            e.holders++;
            return e;
        });

        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, e) -> --e.holders == 0 ? null : e);
        }
    }

    /** Number of keys currently held or awaited. */
    public int activeKeys() {
        return locks.size();
    }

    // holders is only touched inside compute/computeIfPresent, which serialize per key
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
