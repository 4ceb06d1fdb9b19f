package io.github.costql.core.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing of a reference-value cache.
 * <p>
 * Reference values (topics, projects, cost categories...) change rarely but do
 * change, so every cache carries both a capacity and a time-to-live.
 * </p>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default: 256 entries, 10 minutes
 * CachePolicy policy = CachePolicy.defaults();
 *
 * // Short-lived: 64 entries, 1 minute
 * CachePolicy policy = CachePolicy.shortLived();
 *
 * // None: every lookup hits the warehouse
 * CachePolicy policy = CachePolicy.none();
 *
 * // Custom
 * CachePolicy policy = CachePolicy.custom(100, Duration.ofHours(1));
 * }</pre>
 *
 * @param cacheEnabled whether lookups are cached at all
 * @param cacheSize    maximum number of entries
 * @param ttl          time after which an entry is reloaded
 * @since 1.0.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        int cacheSize,
        Duration ttl
) {

    /**
     * Canonical constructor with validation.
     */
    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
    }

    public static CachePolicy defaults() {
        return new CachePolicy(true, 256, Duration.ofMinutes(10));
    }

    public static CachePolicy shortLived() {
        return new CachePolicy(true, 64, Duration.ofMinutes(1));
    }

    /**
     * No cache configuration: caching is completely disabled.
     *
     * @return a CachePolicy with caching disabled
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1, Duration.ofSeconds(1));
    }

    public static CachePolicy custom(int cacheSize, Duration ttl) {
        return new CachePolicy(true, cacheSize, ttl);
    }
}
