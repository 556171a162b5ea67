package com.bbthechange.bridge.util;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutual exclusion per key. Callers using the same key run one at a time, different keys never
 * contend. Locks are weakly held, so a key's lock is dropped once no thread references it.
 */
public class KeyedLock {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock());

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = locks.get(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
