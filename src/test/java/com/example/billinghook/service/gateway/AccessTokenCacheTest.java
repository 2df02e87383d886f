package com.example.billinghook.service.gateway;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AccessTokenCacheTest {

    /** 可手动拨动的时钟 */
    private static class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

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

    private final MutableClock clock = new MutableClock();
    private final AccessTokenCache cache = new AccessTokenCache(clock);

    @Test
    void reusesTokenUntilExpiryMargin() {
        AtomicInteger fetches = new AtomicInteger();

        String first = cache.get(() -> new AccessTokenCache.AccessToken("t" + fetches.incrementAndGet(),
                Duration.ofSeconds(3600)));
        clock.advance(Duration.ofSeconds(3500));
        String second = cache.get(() -> new AccessTokenCache.AccessToken("t" + fetches.incrementAndGet(),
                Duration.ofSeconds(3600)));
        // 距到期不足 60 秒，视为失效
        clock.advance(Duration.ofSeconds(50));
        String third = cache.get(() -> new AccessTokenCache.AccessToken("t" + fetches.incrementAndGet(),
                Duration.ofSeconds(3600)));

        assertEquals("t1", first);
        assertEquals("t1", second);
        assertEquals("t2", third);
        assertEquals(2, fetches.get());
    }

    @Test
    void failedFetchDoesNotPoisonCache() {
        assertThrows(IllegalStateException.class, () -> cache.get(() -> {
            throw new IllegalStateException("token endpoint down");
        }));

        assertEquals("ok", cache.get(() -> new AccessTokenCache.AccessToken("ok", Duration.ofMinutes(10))));
    }

    @Test
    void concurrentCallersShareOneFetch() throws Exception {
        AtomicInteger fetches = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return cache.get(() -> {
                        fetches.incrementAndGet();
                        try {
                            Thread.sleep(100);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return new AccessTokenCache.AccessToken("shared", Duration.ofMinutes(10));
                    });
                }));
            }
            start.countDown();
            for (Future<String> result : results) {
                assertEquals("shared", result.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, fetches.get());
    }

    @Test
    void invalidateForcesRefresh() {
        cache.get(() -> new AccessTokenCache.AccessToken("a", Duration.ofMinutes(10)));
        cache.invalidate();

        assertEquals("b", cache.get(() -> new AccessTokenCache.AccessToken("b", Duration.ofMinutes(10))));
    }
}
