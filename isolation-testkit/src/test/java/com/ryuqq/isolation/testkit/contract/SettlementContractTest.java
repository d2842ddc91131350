package com.ryuqq.isolation.testkit.contract;

import com.ryuqq.isolation.core.bulkhead.Bulkhead;
import com.ryuqq.isolation.core.config.BulkheadConfig;
import com.ryuqq.isolation.core.exception.QueueTimeoutException;
import com.ryuqq.isolation.core.exception.SemaphoreTimeoutException;
import com.ryuqq.isolation.core.model.BulkheadStats;
import com.ryuqq.isolation.core.model.SemaphoreStats;
import com.ryuqq.isolation.core.semaphore.Semaphore;
import com.ryuqq.isolation.core.spi.CounterEvent;
import com.ryuqq.isolation.testkit.AbstractIsolationContractTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: 단일 정착 (Single Settlement).
 *
 * <p>대기 중인 작업이나 Permit 대기자에 대해 "슬롯/Permit 할당"과 "타임아웃 만료"가
 * 거의 동시에 일어나도 정확히 한 쪽만 적용되는지 검증합니다.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Bulkhead: 앞선 작업 완료와 queueTimeout 만료 경쟁 → 실행되거나 타임아웃되거나 둘 중 하나</li>
 *   <li>Semaphore: release()와 획득 타임아웃 경쟁 → 획득하거나 타임아웃되거나 둘 중 하나, Permit 누수 없음</li>
 * </ul>
 *
 * @author Isolation Team
 * @since 1.0.0
 */
class SettlementContractTest extends AbstractIsolationContractTest {

    private ExecutorService racer;

    @BeforeEach
    void setUpRacer() {
        racer = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDownRacer() {
        racer.shutdownNow();
    }

    @RepeatedTest(30)
    void testQueuedTask_GrantRacesTimeout_SettlesExactlyOnce() throws Exception {
        // Given
        Bulkhead bulkhead = new Bulkhead(
            new BulkheadConfig("race.bulkhead", 1, 1, Duration.ofMillis(5)), scheduler, metrics);
        CompletableFuture<String> gate = pending();
        bulkhead.execute(() -> gate);
        AtomicInteger invocations = new AtomicInteger();
        CompletableFuture<String> queued = bulkhead.execute(() -> {
            invocations.incrementAndGet();
            return CompletableFuture.completedFuture("granted");
        });

        // When: 타임아웃 만료 시점 근처에서 앞선 작업 완료
        Future<?> completion = racer.submit(() -> {
            sleepNanos(TimeUnit.MILLISECONDS.toNanos(5));
            gate.complete("first");
        });
        completion.get(5, TimeUnit.SECONDS);

        // Then
        BulkheadStats stats;
        try {
            assertEquals("granted", queued.get(5, TimeUnit.SECONDS));
            stats = bulkhead.getStats();
            assertEquals(1, invocations.get(), "granted task must run exactly once");
            assertEquals(0, stats.totalTimeout());
            assertEquals(2, stats.totalExecuted());
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof QueueTimeoutException, "unexpected failure: " + e.getCause());
            stats = bulkhead.getStats();
            assertEquals(0, invocations.get(), "timed-out task must never run");
            assertEquals(1, stats.totalTimeout());
            assertEquals(1, stats.totalExecuted());
        }
        assertEquals(0, stats.activeCount());
        assertEquals(0, stats.queuedCount());
        assertEquals(stats.totalTimeout(), metrics.count("race.bulkhead", CounterEvent.TIMEOUT));
        assertBulkheadInvariants(stats);
    }

    @RepeatedTest(30)
    void testWaiter_ReleaseRacesTimeout_NoPermitLeak() throws Exception {
        // Given
        Semaphore semaphore = new Semaphore("race.semaphore", 1, scheduler, metrics);
        semaphore.acquire().get(1, TimeUnit.SECONDS);
        CompletableFuture<Void> waiter = semaphore.acquire(Duration.ofMillis(5));

        // When
        Future<?> release = racer.submit(() -> {
            sleepNanos(TimeUnit.MILLISECONDS.toNanos(5));
            semaphore.release();
        });
        release.get(5, TimeUnit.SECONDS);

        boolean acquired;
        try {
            waiter.get(5, TimeUnit.SECONDS);
            acquired = true;
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof SemaphoreTimeoutException, "unexpected failure: " + e.getCause());
            acquired = false;
        }
        if (acquired) {
            semaphore.release();
        }

        // Then
        SemaphoreStats stats = semaphore.getStats();
        assertEquals(1, stats.availablePermits(), "permit must be back after settlement: " + stats);
        assertEquals(0, stats.waitingCount());
        assertEquals(2, stats.totalAcquired() + stats.totalTimeout(), "waiter must settle exactly once: " + stats);
        assertEquals(acquired ? 0 : 1, stats.totalTimeout());
        assertSemaphoreInvariants(stats);
    }

    private static void sleepNanos(long nanos) {
        long deadline = System.nanoTime() + nanos;
        while (System.nanoTime() < deadline) {
            Thread.onSpinWait();
        }
    }
}
