package io.github.costql.core.cache;

import io.github.costql.core.config.CachePolicy;

import java.time.Clock;
import java.time.Instant;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Bounded cache whose entries expire after a fixed time-to-live.
 * <p>
 * Holds at most {@link CachePolicy#cacheSize()} entries and evicts the least
 * recently used one when full. An entry older than {@link CachePolicy#ttl()} is
 * treated as absent and reloaded. Write paths that change the underlying data
 * must call {@link #invalidate(Object)} or {@link #invalidateAll()}.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Entries are guarded by a {@link ReadWriteLock}. Loaders run outside it, under a
 * lock held for their key only: two threads missing on the same key load it once,
 * while a slow load never blocks lookups or loads of other keys.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * BoundedTtlCache<String, List<String>> cache = new BoundedTtlCache<>(CachePolicy.defaults());
 * List<String> topics = cache.computeIfAbsent("topics", key -> loadTopics());
 *
 * // after a write to the underlying table
 * cache.invalidate("topics");
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @since 1.0.0
 */
public class BoundedTtlCache<K, V> {

    private static final Logger log = Logger.getLogger(BoundedTtlCache.class.getName());

    private final CachePolicy policy;
    private final Clock clock;
    private final Map<K, Entry<V>> cache;
    private final Deque<K> accessOrder;
    private final ReadWriteLock lock;
    private final ConcurrentMap<K, Object> loadLocks = new ConcurrentHashMap<>();

    private record Entry<V>(V value, Instant expiresAt) {
    }

    public BoundedTtlCache(CachePolicy policy) {
        this(policy, Clock.systemUTC());
    }

    /**
     * @param policy capacity and time-to-live
     * @param clock  time source used for expiry
     */
    public BoundedTtlCache(CachePolicy policy, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.cache = new HashMap<>();
        this.accessOrder = new ConcurrentLinkedDeque<>();
        this.lock = new ReentrantReadWriteLock();
    }

    /**
     * @param key the key to look up
     * @return the live cached value, or {@code null} if absent or expired
     */
    public V get(K key) {
        lock.readLock().lock();
        try {
            Entry<V> entry = cache.get(key);
            if (entry == null || isExpired(entry)) {
                return null;
            }
            accessOrder.remove(key);
            accessOrder.addFirst(key);
            return entry.value();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stores a value, evicting the least recently used entries beyond capacity.
     * Does nothing when caching is disabled.
     */
    public void put(K key, V value) {
        Objects.requireNonNull(value, "value must not be null");
        if (!policy.cacheEnabled()) {
            return;
        }
        lock.writeLock().lock();
        try {
            accessOrder.remove(key);
            cache.put(key, new Entry<>(value, clock.instant().plus(policy.ttl())));
            accessOrder.addFirst(key);

            while (accessOrder.size() > policy.cacheSize()) {
                K oldest = accessOrder.removeLast();
                cache.remove(oldest);
                log.finer(() -> "Evicted cache entry " + oldest);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the live value for {@code key}, loading and caching it when absent or expired.
     * With caching disabled the loader runs on every call.
     *
     * @param key    the key
     * @param loader computes the value; exceptions propagate and nothing is cached
     * @return the value
     */
    public V computeIfAbsent(K key, Function<K, V> loader) {
        if (!policy.cacheEnabled()) {
            return loader.apply(key);
        }
        V value = get(key);
        if (value != null) {
            return value;
        }

        Object keyLock = loadLocks.computeIfAbsent(key, k -> new Object());
        try {
            synchronized (keyLock) {
                value = get(key);
                if (value != null) {
                    return value;
                }
                value = loader.apply(key);
                if (value != null) {
                    put(key, value);
                }
                return value;
            }
        } finally {
            loadLocks.remove(key, keyLock);
        }
    }

    /**
     * Removes one entry.
     */
    public void invalidate(K key) {
        lock.writeLock().lock();
        try {
            accessOrder.remove(key);
            cache.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes all entries.
     */
    public void invalidateAll() {
        lock.writeLock().lock();
        try {
            cache.clear();
            accessOrder.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return the number of stored entries, expired ones included
     */
    public int size() {
        lock.readLock().lock();
        try {
            return cache.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public CachePolicy getPolicy() {
        return policy;
    }

    private boolean isExpired(Entry<V> entry) {
        return !clock.instant().isBefore(entry.expiresAt());
    }

    /**
     * Returns cache statistics as a formatted string.
     *
     * @return statistics string
     */
    public String getStats() {
        lock.readLock().lock();
        try {
            return String.format("BoundedTtlCache[size=%d, maxSize=%d, ttl=%s, utilization=%.1f%%]",
                    cache.size(),
                    policy.cacheSize(),
                    policy.ttl(),
                    (cache.size() * 100.0) / policy.cacheSize()
            );
        } finally {
            lock.readLock().unlock();
        }
    }
}
