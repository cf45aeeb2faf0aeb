package fr.lapetina.dispatch.infrastructure.pool;

import fr.lapetina.dispatch.domain.exception.DispatchException;
import fr.lapetina.dispatch.domain.model.ErrorType;
import fr.lapetina.dispatch.testutil.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionPoolTest {

    private ManualClock clock;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
    }

    private static ErrorType errorTypeOf(Throwable e) {
        return ((DispatchException) e).getErrorType();
    }

    @Nested
    @DisplayName("fail fast")
    class FailFast {

        private ConnectionPool pool;

        @BeforeEach
        void setUp() {
            pool = new ConnectionPool(PoolConfig.failFast(2), clock);
        }

        @Test
        @DisplayName("should hand out a slot and take it back")
        void shouldRoundTrip() {
            ConnectionSlot slot = pool.acquire("backend-a");

            assertThat(slot.getBackendId()).isEqualTo("backend-a");
            assertThat(slot.isInUse()).isTrue();
            assertThat(pool.stats().checkedOutSlots()).isEqualTo(1);

            assertThat(pool.release(slot)).isTrue();

            assertThat(slot.isInUse()).isFalse();
            assertThat(pool.stats().freeSlots()).isEqualTo(1);
            assertThat(pool.stats().checkedOutSlots()).isZero();
        }

        @Test
        @DisplayName("should reuse the most recently released slot")
        void shouldReuseLifo() {
            ConnectionSlot first = pool.acquire("backend-a");
            ConnectionSlot second = pool.acquire("backend-a");
            pool.release(first);
            pool.release(second);

            assertThat(pool.acquire("backend-a")).isSameAs(second);
            assertThat(pool.stats().createdSlots()).isEqualTo(2);
        }

        @Test
        @DisplayName("should refuse with POOL_EXHAUSTED at the limit")
        void shouldRefuseWhenFull() {
            pool.acquire("backend-a");
            pool.acquire("backend-a");

            assertThatThrownBy(() -> pool.acquire("backend-a"))
                    .isInstanceOf(DispatchException.class)
                    .extracting(ConnectionPoolTest::errorTypeOf)
                    .isEqualTo(ErrorType.POOL_EXHAUSTED);
            assertThat(pool.acquire("backend-b")).isNotNull();
        }

        @Test
        @DisplayName("should give every slot a distinct id")
        void shouldUseDistinctIds() {
            ConnectionSlot a = pool.acquire("backend-a");
            ConnectionSlot b = pool.acquire("backend-a");

            assertThat(a.getId()).isNotEqualTo(b.getId()).startsWith("backend-a-");
        }

        @Test
        @DisplayName("should fail with NOT_FOUND when releasing twice")
        void shouldRejectDoubleRelease() {
            ConnectionSlot slot = pool.acquire("backend-a");
            pool.release(slot);

            assertThatThrownBy(() -> pool.release(slot))
                    .isInstanceOf(DispatchException.class)
                    .extracting(ConnectionPoolTest::errorTypeOf)
                    .isEqualTo(ErrorType.NOT_FOUND);
        }

        @Test
        @DisplayName("should never hand out a slot marked unhealthy")
        void shouldDiscardUnhealthy() {
            ConnectionSlot slot = pool.acquire("backend-a");

            assertThat(pool.markUnhealthy(slot)).isTrue();
            assertThat(pool.markUnhealthy(slot)).isFalse();
            assertThat(slot.isHealthy()).isFalse();
            assertThat(pool.release(slot)).isFalse();

            ConnectionSlot next = pool.acquire("backend-a");
            assertThat(next).isNotSameAs(slot);
            assertThat(pool.stats().destroyedSlots()).isEqualTo(1);
        }

        @Test
        @DisplayName("should apply per-backend limits")
        void shouldApplyBackendLimit() {
            ConnectionPool limited = new ConnectionPool(PoolConfig.failFast(5).withBackendLimit("small", 1), clock);
            limited.acquire("small");

            assertThatThrownBy(() -> limited.acquire("small")).isInstanceOf(DispatchException.class);
            assertThat(limited.stats().perBackend().get("small").maxConnections()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("idle cleanup")
    class IdleCleanup {

        private ConnectionPool pool;

        @BeforeEach
        void setUp() {
            pool = new ConnectionPool(PoolConfig.failFast(3).withIdleTtl(Duration.ofMinutes(1)), clock);
        }

        @Test
        @DisplayName("should evict free slots idle past the TTL")
        void shouldEvictIdle() {
            ConnectionSlot old = pool.acquire("backend-a");
            ConnectionSlot recent = pool.acquire("backend-a");
            pool.release(old);
            clock.advance(Duration.ofSeconds(40));
            pool.release(recent);
            clock.advance(Duration.ofSeconds(20));

            assertThat(pool.cleanupExpired()).isEqualTo(1);

            assertThat(old.isDestroyed()).isTrue();
            assertThat(recent.isDestroyed()).isFalse();
            assertThat(pool.stats().freeSlots()).isEqualTo(1);
        }

        @Test
        @DisplayName("should never evict checked-out slots")
        void shouldKeepCheckedOut() {
            ConnectionSlot slot = pool.acquire("backend-a");
            clock.advance(Duration.ofHours(1));

            assertThat(pool.cleanupExpired()).isZero();
            assertThat(pool.release(slot)).isTrue();
        }

        @Test
        @DisplayName("should drop backends left empty")
        void shouldDropEmptyBackends() {
            pool.release(pool.acquire("backend-a"));
            clock.advance(Duration.ofMinutes(2));

            pool.cleanupExpired();

            assertThat(pool.stats().backends()).isZero();
            assertThat(pool.acquire("backend-a")).isNotNull();
            assertThat(pool.stats().backends()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("blocking")
    class Blocking {

        private ConnectionPool pool;

        @BeforeEach
        void setUp() {
            pool = new ConnectionPool(PoolConfig.failFast(1).withBlocking(Duration.ofMillis(100)), clock);
        }

        @Test
        @DisplayName("should fail with TIMEOUT when nothing is released in time")
        void shouldTimeOut() {
            pool.acquire("backend-a");

            assertThatThrownBy(() -> pool.acquire("backend-a"))
                    .isInstanceOf(DispatchException.class)
                    .extracting(ConnectionPoolTest::errorTypeOf)
                    .isEqualTo(ErrorType.TIMEOUT);
            assertThat(pool.stats().perBackend().get("backend-a").waiters()).isZero();
        }

        @Test
        @DisplayName("should wake a waiter when a slot is released")
        void shouldWakeOnRelease() throws Exception {
            ConnectionSlot held = pool.acquire("backend-a");

            CompletableFuture<ConnectionSlot> waiter = CompletableFuture.supplyAsync(
                    () -> pool.acquire("backend-a", Duration.ofSeconds(10)));
            while (pool.stats().perBackend().get("backend-a").waiters() == 0) {
                Thread.sleep(5);
            }
            pool.release(held);

            assertThat(waiter.get(5, TimeUnit.SECONDS)).isSameAs(held);
        }

        @Test
        @DisplayName("should fail with CANCELLED when interrupted and keep the flag")
        void shouldCancelOnInterrupt() throws Exception {
            pool.acquire("backend-a");
            AtomicReference<Throwable> failure = new AtomicReference<>();
            AtomicReference<Boolean> interrupted = new AtomicReference<>();

            Thread thread = new Thread(() -> {
                try {
                    pool.acquire("backend-a", Duration.ofSeconds(30));
                } catch (DispatchException e) {
                    failure.set(e);
                    interrupted.set(Thread.currentThread().isInterrupted());
                }
            });
            thread.start();
            while (pool.stats().perBackend().get("backend-a").waiters() == 0) {
                Thread.sleep(5);
            }
            thread.interrupt();
            thread.join(5_000);

            assertThat(failure.get()).isInstanceOf(DispatchException.class);
            assertThat(errorTypeOf(failure.get())).isEqualTo(ErrorType.CANCELLED);
            assertThat(interrupted.get()).isTrue();
            assertThat(pool.stats().checkedOutSlots()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("should never exceed the limit under concurrent use")
    void shouldBeThreadSafe() throws InterruptedException {
        ConnectionPool pool = new ConnectionPool(PoolConfig.failFast(3), clock);
        int threads = 8;
        int iterations = 500;
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxSeen = new AtomicInteger();
        AtomicInteger refusals = new AtomicInteger();
        CountDownLatch latch = new CountDownLatch(threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < iterations; i++) {
                        ConnectionSlot slot;
                        try {
                            slot = pool.acquire("shared");
                        } catch (DispatchException e) {
                            refusals.incrementAndGet();
                            continue;
                        }
                        maxSeen.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
                        Thread.yield();
                        concurrent.decrementAndGet();
                        pool.release(slot);
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        PoolStats stats = pool.stats();
        assertThat(maxSeen.get()).isLessThanOrEqualTo(3);
        assertThat(stats.checkedOutSlots()).isZero();
        assertThat(stats.freeSlots()).isLessThanOrEqualTo(3);
        assertThat(stats.createdSlots()).isLessThanOrEqualTo(3);
    }

    @Test
    @DisplayName("should keep slot ids unique across a dropped and recreated backend")
    void shouldKeepIdsUniqueAcrossRecreation() {
        ConnectionPool pool = new ConnectionPool(PoolConfig.failFast(1).withIdleTtl(Duration.ZERO), clock);
        List<String> ids = new ArrayList<>();

        for (int i = 0; i < 3; i++) {
            ConnectionSlot slot = pool.acquire("backend-a");
            ids.add(slot.getId());
            pool.release(slot);
            pool.cleanupExpired();
        }

        assertThat(ids).doesNotHaveDuplicates();
    }
}
