package dev.nuclr.thumbgrid.cache;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded LRU cache kept on the UI thread.
 *
 * <p>Not synchronised: every call must come from the thread that owns
 * rendering. Results produced on worker threads reach it only through the
 * pipeline's completion queue.
 */
public final class ThumbnailMemoryCache<K, V> {

    private final int capacity;
    private final LinkedHashMap<K, V> cache;

    public ThumbnailMemoryCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, was " + capacity);
        }
        this.capacity = capacity;
        int max = capacity;
        // access-order map: get() moves the entry to the tail
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > max;
            }
        };
    }

    /** Returns the cached value and marks it most recently used, or null. */
    public V get(K key) {
        return cache.get(key);
    }

    /** Inserts or replaces, promotes, and evicts the eldest entry beyond capacity. */
    public void put(K key, V value) {
        cache.put(key, value);
    }

    /** Membership test that does not touch access order. */
    public boolean contains(K key) {
        return cache.containsKey(key);
    }

    public int size() {
        return cache.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        cache.clear();
    }
}
