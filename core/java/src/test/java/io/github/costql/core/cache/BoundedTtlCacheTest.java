package io.github.costql.core.cache;

import io.github.costql.core.config.CachePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BoundedTtlCache Tests")
class BoundedTtlCacheTest {

    /**
     * Clock advanced by hand.
     */
    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-03-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
    }

    @Test
    @DisplayName("Should load once and serve from cache until the entry expires")
    void shouldExpireAfterTtl() {
        // Given
        BoundedTtlCache<String, String> cache = new BoundedTtlCache<>(CachePolicy.custom(10, Duration.ofMinutes(5)), clock);
        AtomicInteger loads = new AtomicInteger();

        // When
        cache.computeIfAbsent("topics", key -> "v" + loads.incrementAndGet());
        cache.computeIfAbsent("topics", key -> "v" + loads.incrementAndGet());

        // Then
        assertEquals(1, loads.get());
        assertEquals("v1", cache.get("topics"));

        // When the time-to-live elapses
        clock.advance(Duration.ofMinutes(5));

        // Then
        assertNull(cache.get("topics"));
        assertEquals("v2", cache.computeIfAbsent("topics", key -> "v" + loads.incrementAndGet()));
    }

    @Test
    @DisplayName("Should evict the least recently used entry when full")
    void shouldEvictLeastRecentlyUsed() {
        BoundedTtlCache<String, Integer> cache = new BoundedTtlCache<>(CachePolicy.custom(2, Duration.ofHours(1)), clock);

        cache.put("a", 1);
        cache.put("b", 2);
        cache.get("a");
        cache.put("c", 3);

        assertEquals(2, cache.size());
        assertEquals(1, cache.get("a"));
        assertNull(cache.get("b"));
        assertEquals(3, cache.get("c"));
    }

    @Test
    @DisplayName("Should serve other keys while one key is loading")
    void shouldNotBlockOtherKeysDuringLoad() throws Exception {
        // Given
        BoundedTtlCache<String, String> cache = new BoundedTtlCache<>(CachePolicy.defaults(), clock);
        cache.put("topics", "cached");
        CountDownLatch loading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            CompletableFuture<String> slow = CompletableFuture.supplyAsync(() -> cache.computeIfAbsent("skus", key -> {
                loading.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "loaded";
            }), executor);
            assertTrue(loading.await(5, TimeUnit.SECONDS));

            // When another key is read and loaded while the first load is still running
            String topics = cache.computeIfAbsent("topics", key -> "reloaded");
            String projects = cache.computeIfAbsent("projects", key -> "p");

            // Then
            assertEquals("cached", topics);
            assertEquals("p", projects);
            assertFalse(slow.isDone());

            release.countDown();
            assertEquals("loaded", slow.get(5, TimeUnit.SECONDS));
            assertEquals("loaded", cache.get("skus"));
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should load a key once when two threads miss on it together")
    void shouldLoadSameKeyOnce() throws Exception {
        // Given
        BoundedTtlCache<String, String> cache = new BoundedTtlCache<>(CachePolicy.defaults(), clock);
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch loading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            CompletableFuture<String> first = CompletableFuture.supplyAsync(() -> cache.computeIfAbsent("k", key -> {
                loading.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "v" + loads.incrementAndGet();
            }), executor);
            assertTrue(loading.await(5, TimeUnit.SECONDS));

            // When
            CompletableFuture<String> second = CompletableFuture.supplyAsync(
                    () -> cache.computeIfAbsent("k", key -> "v" + loads.incrementAndGet()), executor);
            release.countDown();

            // Then
            assertEquals("v1", first.get(5, TimeUnit.SECONDS));
            assertEquals("v1", second.get(5, TimeUnit.SECONDS));
            assertEquals(1, loads.get());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should call the loader every time when disabled")
    void shouldBypassWhenDisabled() {
        BoundedTtlCache<String, String> cache = new BoundedTtlCache<>(CachePolicy.none(), clock);
        AtomicInteger loads = new AtomicInteger();

        cache.computeIfAbsent("k", key -> "v" + loads.incrementAndGet());
        cache.computeIfAbsent("k", key -> "v" + loads.incrementAndGet());
        cache.put("k", "x");

        assertEquals(2, loads.get());
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("Should not cache a failed load")
    void shouldNotCacheFailures() {
        BoundedTtlCache<String, String> cache = new BoundedTtlCache<>(CachePolicy.defaults(), clock);

        assertThrows(IllegalStateException.class, () -> cache.computeIfAbsent("k", key -> {
            throw new IllegalStateException("warehouse down");
        }));

        assertEquals(0, cache.size());
        assertEquals("ok", cache.computeIfAbsent("k", key -> "ok"));
    }

    @Test
    @DisplayName("Should drop entries on invalidation")
    void shouldInvalidate() {
        BoundedTtlCache<String, String> cache = new BoundedTtlCache<>(CachePolicy.shortLived(), clock);
        cache.put("a", "1");
        cache.put("b", "2");

        cache.invalidate("a");
        assertNull(cache.get("a"));
        assertEquals(1, cache.size());

        cache.invalidateAll();
        assertEquals(0, cache.size());
        assertTrue(cache.getStats().contains("maxSize=64"));
    }

    @Test
    @DisplayName("Should reject invalid policies")
    void shouldRejectInvalidPolicies() {
        assertThrows(IllegalArgumentException.class, () -> CachePolicy.custom(0, Duration.ofMinutes(1)));
        assertThrows(IllegalArgumentException.class, () -> CachePolicy.custom(1, Duration.ZERO));
    }
}
