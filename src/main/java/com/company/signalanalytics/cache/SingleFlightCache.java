package com.company.signalanalytics.cache;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Read-through holder for one expensive, rarely changing value.
 * The first caller loads it under the lock; callers arriving meanwhile block
 * on the lock and get the loaded value instead of loading it again. A failed
 * load leaves the cache empty for the next caller.
 */
@Slf4j
public class SingleFlightCache<T> {

    private final String name;
    private final Supplier<T> loader;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile T value;

    public SingleFlightCache(String name, Supplier<T> loader) {
        this.name = name;
        this.loader = loader;
    }

    public T get() {
        T current = value;
        if (current != null) {
            return current;
        }
        lock.lock();
        try {
            if (value == null) {
                long start = System.currentTimeMillis();
                T loaded = loader.get();
                if (loaded == null) {
                    throw new IllegalStateException("Loader for cache " + name + " returned null");
                }
                value = loaded;
                log.info("Loaded {} cache in {} ms", name, System.currentTimeMillis() - start);
            }
            return value;
        } finally {
            lock.unlock();
        }
    }

    public void invalidate() {
        lock.lock();
        try {
            value = null;
            log.info("Invalidated {} cache", name);
        } finally {
            lock.unlock();
        }
    }

    public boolean isLoaded() {
        return value != null;
    }
}
