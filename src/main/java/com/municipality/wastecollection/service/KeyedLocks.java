package com.municipality.wastecollection.service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per key (bin, driver, truck or route id).
 * Work on different keys runs in parallel; work on the same key is serialized.
 * Locks are never evicted, the key space is bounded by the number of entities.
 */
public class KeyedLocks {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T call(String key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(String key, Runnable action) {
        call(key, () -> {
            action.run();
            return null;
        });
    }
}
