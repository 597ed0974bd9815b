package io.github.cyfko.proplogic.core.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * A bounded LRU (Least Recently Used) cache.
 * <p>
 * Backed by an access-ordered {@link LinkedHashMap} that drops its eldest entry once the
 * capacity is exceeded. Every access reorders the map, so reads and writes share one lock.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * BoundedLRUCache<String, ParseResult> cache = new BoundedLRUCache<>(1000);
 * ParseResult result = cache.computeIfAbsent("p -> q", this::parseUncached);
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BoundedLRUCache<K, V> {

    private final int maxSize;
    private final Map<K, V> entries;
    private final Lock lock = new ReentrantLock();

    /**
     * Creates a bounded LRU cache with the specified maximum size.
     *
     * @param maxSize the maximum number of entries to store
     * @throws IllegalArgumentException if maxSize is not positive
     */
    public BoundedLRUCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }

        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedLRUCache.this.maxSize;
            }
        };
    }

    /**
     * Retrieves a value and marks it as most recently used.
     *
     * @param key the key to look up
     * @return the cached value, or null if not present
     */
    public V get(K key) {
        lock.lock();
        try {
            return entries.get(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a value, evicting the least recently used entry when full.
     *
     * @param key   the key to store
     * @param value the value to store
     */
    public void put(K key, V value) {
        lock.lock();
        try {
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached value for the key, computing and caching it first when absent.
     * <p>
     * The mapping function runs under the cache lock, so concurrent callers asking for the same
     * key compute it only once. A {@code null} result is returned but not cached.
     * </p>
     *
     * @param key             the key to compute for
     * @param mappingFunction the function to compute the value
     * @return the cached or newly computed value
     */
    public V computeIfAbsent(K key, Function<K, V> mappingFunction) {
        lock.lock();
        try {
            V value = entries.get(key);
            if (value == null) {
                value = mappingFunction.apply(key);
                if (value != null) {
                    entries.put(key, value);
                }
            }
            return value;
        } finally {
            lock.unlock();
        }
    }

    public boolean containsKey(K key) {
        lock.lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    @Override
    public String toString() {
        int size = size();
        return String.format("BoundedLRUCache[size=%d, maxSize=%d, utilization=%.1f%%]",
                size, maxSize, (size * 100.0) / maxSize);
    }
}
