package com.trellis.routing;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded LRU cache of route resolutions keyed by {@code METHOD:pathname}.
 *
 * <p>Every {@code get} and {@code set} is atomic under a single lock. A hit promotes the entry to
 * most recently used; inserting a new key at capacity evicts exactly the least recently used
 * entry. Entries are not invalidated when routes are added later, so routes should be registered
 * before traffic starts.
 */
public class RouteCache {
    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final LinkedHashMap<String, CacheEntry> entries;
    private final ReentrantLock lock = new ReentrantLock();
    private long hits;
    private long misses;

    public RouteCache() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Creates a cache with the given capacity.
     *
     * @param capacity maximum number of entries
     */
    public RouteCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Route cache capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        // access order: iteration starts at the least recently used entry
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    /**
     * Builds the cache key for a request. The query string is not part of the key.
     *
     * @param method the HTTP method
     * @param path   the request pathname
     * @return the key
     */
    public static String key(String method, String path) {
        return method + ":" + path;
    }

    /**
     * Looks up an entry, counting a hit or a miss.
     *
     * @param key the cache key
     * @return the entry or null on a miss
     */
    public CacheEntry get(String key) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                misses++;
                return null;
            }
            hits++;
            entry.touch();
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a resolution. Replacing an existing key never evicts another entry.
     *
     * @param key    the cache key
     * @param route  the resolved route
     * @param params the extracted parameters
     * @return the stored entry
     */
    public CacheEntry set(String key, Route route, Map<String, String> params) {
        CacheEntry entry = new CacheEntry(route, params);
        lock.lock();
        try {
            if (entries.remove(key) == null && entries.size() >= capacity) {
                Iterator<String> eldest = entries.keySet().iterator();
                eldest.next();
                eldest.remove();
            }
            entries.put(key, entry);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks whether a key is cached without touching recency or counters.
     *
     * @param key the cache key
     * @return true if present
     */
    public boolean contains(String key) {
        lock.lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    /** Removes all entries and resets the hit and miss counters. */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            hits = 0;
            misses = 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gets a snapshot of the cache statistics.
     *
     * @return the statistics
     */
    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(entries.size(), capacity, hits, misses);
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    /** A cached route resolution. */
    public static final class CacheEntry {
        private final Route route;
        private final Map<String, String> params;
        private volatile long hits = 1;
        private volatile long lastUsed = System.currentTimeMillis();

        CacheEntry(Route route, Map<String, String> params) {
            this.route = route;
            this.params = params;
        }

        // called under the cache lock
        private void touch() {
            hits++;
            lastUsed = System.currentTimeMillis();
        }

        public Route getRoute() {
            return route;
        }

        public Map<String, String> getParams() {
            return params;
        }

        public long getHits() {
            return hits;
        }

        public long getLastUsed() {
            return lastUsed;
        }
    }

    /** Point-in-time cache statistics. */
    public static final class CacheStats {
        private final int size;
        private final int capacity;
        private final long hits;
        private final long misses;

        CacheStats(int size, int capacity, long hits, long misses) {
            this.size = size;
            this.capacity = capacity;
            this.hits = hits;
            this.misses = misses;
        }

        public int getSize() {
            return size;
        }

        public int getCapacity() {
            return capacity;
        }

        public long getHits() {
            return hits;
        }

        public long getMisses() {
            return misses;
        }

        /**
         * Gets the hit rate. An unused cache reports 0.
         *
         * @return hits divided by lookups
         */
        public double getHitRate() {
            return (double) hits / Math.max(1L, hits + misses);
        }

        @Override
        public String toString() {
            return String.format("CacheStats{size=%d, capacity=%d, hits=%d, misses=%d, hitRate=%.2f}",
                    size, capacity, hits, misses, getHitRate());
        }
    }
}
