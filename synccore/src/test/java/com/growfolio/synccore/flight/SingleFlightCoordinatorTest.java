package com.growfolio.synccore.flight;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SingleFlightCoordinatorTest {

    private final SingleFlightCoordinator<String, String> flights = new SingleFlightCoordinator<>("test");
    private final ExecutorService pool = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    // ==================== DEDUPLICATION ====================

    @Nested
    @DisplayName("Deduplication")
    class Deduplication {

        @Test
        @DisplayName("Concurrent callers for one key share a single producer call")
        void concurrentCallersShareOneCall() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            CountDownLatch producerStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);

            Future<String> leader = pool.submit(() -> flights.run("k", () -> {
                calls.incrementAndGet();
                producerStarted.countDown();
                awaitQuietly(release);
                return "value";
            }));
            assertThat(producerStarted.await(5, TimeUnit.SECONDS)).isTrue();

            CountDownLatch joined = new CountDownLatch(5);
            List<Future<String>> followers = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                followers.add(pool.submit(() -> flights.run("k", () -> {
                    calls.incrementAndGet();
                    return "other";
                }, joined::countDown)));
            }
            assertThat(joined.await(5, TimeUnit.SECONDS)).isTrue();
            release.countDown();

            assertThat(leader.get(5, TimeUnit.SECONDS)).isEqualTo("value");
            for (Future<String> follower : followers) {
                assertThat(follower.get(5, TimeUnit.SECONDS)).isEqualTo("value");
            }
            assertThat(calls).hasValue(1);
            assertThat(flights.inFlightCount()).isZero();
        }

        @Test
        @DisplayName("Different keys run independently")
        void differentKeysIndependent() {
            assertThat(flights.run("a", () -> "A")).isEqualTo("A");
            assertThat(flights.run("b", () -> "B")).isEqualTo("B");
        }

        @Test
        @DisplayName("Sequential calls each invoke the producer")
        void sequentialCallsNotShared() {
            AtomicInteger calls = new AtomicInteger();

            flights.run("k", () -> "v" + calls.incrementAndGet());
            String second = flights.run("k", () -> "v" + calls.incrementAndGet());

            assertThat(second).isEqualTo("v2");
        }
    }

    // ==================== FAILURES ====================

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Failure reaches every waiter and is not replayed")
        void failureReachesAllWaitersThenRetries() throws Exception {
            CountDownLatch producerStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);

            Future<String> leader = pool.submit(() -> flights.run("k", () -> {
                producerStarted.countDown();
                awaitQuietly(release);
                throw new IllegalStateException("boom");
            }));
            assertThat(producerStarted.await(5, TimeUnit.SECONDS)).isTrue();
            CountDownLatch joined = new CountDownLatch(1);
            Future<String> follower = pool.submit(() -> flights.run("k", () -> "unused", joined::countDown));
            assertThat(joined.await(5, TimeUnit.SECONDS)).isTrue();
            release.countDown();

            assertThatThrownBy(() -> leader.get(5, TimeUnit.SECONDS)).hasCauseInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> follower.get(5, TimeUnit.SECONDS)).hasCauseInstanceOf(IllegalStateException.class);

            assertThat(flights.run("k", () -> "recovered")).isEqualTo("recovered");
        }

        @Test
        @DisplayName("Producer exception is rethrown as-is on the calling thread")
        void exceptionRethrownUnwrapped() {
            assertThatThrownBy(() -> flights.run("k", () -> {
                throw new IllegalArgumentException("bad");
            })).isInstanceOf(IllegalArgumentException.class).hasMessage("bad");
            assertThat(flights.isInFlight("k")).isFalse();
        }
    }

    // ==================== ASYNC ====================

    @Nested
    @DisplayName("Async")
    class Async {

        @Test
        @DisplayName("Cancelling one waiter leaves the shared fetch running for others")
        void cancelOneWaiter() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            AtomicInteger calls = new AtomicInteger();

            CompletableFuture<String> first = flights.runAsync("k", () -> {
                calls.incrementAndGet();
                awaitQuietly(release);
                return "value";
            }, pool);
            CompletableFuture<String> second = flights.runAsync("k", () -> "unused", pool);

            first.cancel(true);
            release.countDown();

            assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo("value");
            assertThat(first).isCancelled();
            assertThat(calls).hasValue(1);
        }

        @Test
        @DisplayName("Rejected executor fails the future and clears the flight")
        void rejectedExecutor() {
            CompletableFuture<String> result = flights.runAsync("k", () -> "v", task -> {
                throw new RejectedExecutionException("full");
            });

            assertThat(result).isCompletedExceptionally();
            assertThat(flights.isInFlight("k")).isFalse();
        }
    }

    // ==================== DETACH ====================

    @Nested
    @DisplayName("Detach")
    class Detach {

        @Test
        @DisplayName("Callers after detach start a new producer while the old waiters keep theirs")
        void detachedFlightIsNotJoined() throws Exception {
            CountDownLatch producerStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Future<String> leader = pool.submit(() -> flights.run("k", () -> {
                producerStarted.countDown();
                awaitQuietly(release);
                return "old";
            }));
            assertThat(producerStarted.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(flights.detach("k")).isTrue();
            String next = flights.run("k", () -> "new");
            release.countDown();

            assertThat(next).isEqualTo("new");
            assertThat(leader.get(5, TimeUnit.SECONDS)).isEqualTo("old");
            assertThat(flights.isInFlight("k")).isFalse();
        }

        @Test
        @DisplayName("Finishing a detached flight leaves its successor registered")
        void detachedFlightDoesNotRemoveSuccessor() throws Exception {
            CountDownLatch oldRelease = new CountDownLatch(1);
            CountDownLatch oldStarted = new CountDownLatch(1);
            CountDownLatch newRelease = new CountDownLatch(1);
            CountDownLatch newStarted = new CountDownLatch(1);
            Future<String> old = pool.submit(() -> flights.run("k", () -> {
                oldStarted.countDown();
                awaitQuietly(oldRelease);
                return "old";
            }));
            assertThat(oldStarted.await(5, TimeUnit.SECONDS)).isTrue();
            flights.detach("k");
            Future<String> successor = pool.submit(() -> flights.run("k", () -> {
                newStarted.countDown();
                awaitQuietly(newRelease);
                return "new";
            }));
            assertThat(newStarted.await(5, TimeUnit.SECONDS)).isTrue();

            oldRelease.countDown();
            old.get(5, TimeUnit.SECONDS);

            assertThat(flights.isInFlight("k")).isTrue();
            newRelease.countDown();
            assertThat(successor.get(5, TimeUnit.SECONDS)).isEqualTo("new");
        }

        @Test
        @DisplayName("detachMatching only forgets matching keys")
        void detachMatching() throws Exception {
            CountDownLatch started = new CountDownLatch(2);
            CountDownLatch release = new CountDownLatch(1);
            for (String key : List.of("p1/h1", "p2/h1")) {
                pool.submit(() -> flights.run(key, () -> {
                    started.countDown();
                    awaitQuietly(release);
                    return key;
                }));
            }
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            int detached = flights.detachMatching(key -> key.startsWith("p1/"));
            release.countDown();

            assertThat(detached).isEqualTo(1);
            assertThat(flights.inFlightKeys()).doesNotContain("p1/h1");
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
