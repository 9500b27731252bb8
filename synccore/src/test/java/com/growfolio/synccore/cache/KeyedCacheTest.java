package com.growfolio.synccore.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class KeyedCacheTest {

    private MutableClock clock;
    private KeyedCache<String, String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        cache = new KeyedCache<>(FreshnessPolicy.of("test", Duration.ofSeconds(60)), clock, 100);
    }

    // ==================== FRESHNESS ====================

    @Nested
    @DisplayName("Freshness")
    class Freshness {

        @Test
        @DisplayName("Entry is fresh up to and including the window, stale after")
        void freshUntilWindowElapses() {
            cache.set("k", "v");

            clock.advance(Duration.ofSeconds(60));
            assertThat(cache.get("k")).contains("v");

            clock.advance(Duration.ofMillis(1));
            assertThat(cache.get("k")).isEmpty();
            assertThat(cache.isFresh("k")).isFalse();
        }

        @Test
        @DisplayName("Stale entry is still readable raw")
        void staleEntryReadableRaw() {
            cache.set("k", "v");
            clock.advance(Duration.ofMinutes(5));

            assertThat(cache.getRaw("k")).hasValueSatisfying(entry -> {
                assertThat(entry.value()).isEqualTo("v");
                assertThat(entry.isStale(clock.instant())).isTrue();
            });
        }

        @Test
        @DisplayName("Per-entry window overrides the store default")
        void perEntryWindow() {
            cache.set("k", "v", Duration.ofSeconds(5));
            clock.advance(Duration.ofSeconds(6));

            assertThat(cache.get("k")).isEmpty();
        }

        @Test
        @DisplayName("Zero window: stale as soon as time moves")
        void zeroWindow() {
            cache.set("k", "v", Duration.ZERO);
            assertThat(cache.isFresh("k")).isTrue();

            clock.advance(Duration.ofMillis(1));
            assertThat(cache.isFresh("k")).isFalse();
        }
    }

    // ==================== WRITES ====================

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        @DisplayName("update restamps an existing stale entry as fresh")
        void updateRestamps() {
            cache.set("k", "v1");
            clock.advance(Duration.ofMinutes(2));

            boolean updated = cache.update("k", v -> v + "-merged");

            assertThat(updated).isTrue();
            assertThat(cache.get("k")).contains("v1-merged");
        }

        @Test
        @DisplayName("update is a no-op when nothing is cached")
        void updateMissing() {
            assertThat(cache.update("k", v -> "x")).isFalse();
            assertThat(cache.getRaw("k")).isEmpty();
        }

        @Test
        @DisplayName("removeAll drops matching keys only")
        void removeAllMatching() {
            cache.set("a:1", "x");
            cache.set("a:2", "y");
            cache.set("b:1", "z");

            int removed = cache.removeAll(k -> k.startsWith("a:"));

            assertThat(removed).isEqualTo(2);
            assertThat(cache.keys()).containsExactly("b:1");
        }

        @Test
        @DisplayName("Readers do not observe a half-applied atomic block")
        void atomicBlockIsolatesReaders() throws Exception {
            cache.set("a", "old");
            cache.set("b", "old");
            CountDownLatch insideBlock = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            AtomicReference<String> observed = new AtomicReference<>();

            Thread writer = new Thread(() -> cache.atomically(() -> {
                cache.set("a", "new");
                insideBlock.countDown();
                await(release);
                cache.set("b", "new");
            }));
            writer.start();
            assertThat(insideBlock.await(5, TimeUnit.SECONDS)).isTrue();

            Thread reader = new Thread(() -> observed.set(cache.get("a").orElse("") + "/" + cache.get("b").orElse("")));
            reader.start();
            release.countDown();
            writer.join(5_000);
            reader.join(5_000);

            assertThat(observed.get()).isEqualTo("new/new");
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
