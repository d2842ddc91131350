package com.ryuqq.isolation.testkit.contract;

import com.ryuqq.isolation.core.bulkhead.Bulkhead;
import com.ryuqq.isolation.core.config.BulkheadConfig;
import com.ryuqq.isolation.core.exception.QueueFullException;
import com.ryuqq.isolation.core.model.BulkheadStats;
import com.ryuqq.isolation.core.model.SemaphoreStats;
import com.ryuqq.isolation.core.semaphore.Semaphore;
import com.ryuqq.isolation.testkit.AbstractIsolationContractTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: 용량 불변식.
 *
 * <p>고정 seed의 무작위 연산 순서를 적용하면서 매 단계마다 불변식을 검증합니다.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Bulkhead: 제출, 작업 완료, 대기 작업 취소를 섞어도 용량 한도와 작업 수 보존이 유지됨</li>
 *   <li>Semaphore: 획득, 반환, 대기 취소를 섞어도 available + 보유 = totalPermits</li>
 * </ul>
 *
 * @author Isolation Team
 * @since 1.0.0
 */
class InvariantContractTest extends AbstractIsolationContractTest {

    private static final int STEPS = 500;

    @Test
    void testBulkhead_RandomOperations_InvariantsHoldAfterEveryStep() {
        // Given
        Bulkhead bulkhead = new Bulkhead(
            new BulkheadConfig("invariant.bulkhead", 3, 4, Duration.ofMinutes(1)), scheduler, metrics);
        Random random = new Random(42);
        List<CompletableFuture<String>> gates = new ArrayList<>();
        List<CompletableFuture<String>> results = new ArrayList<>();
        long submitted = 0;
        long cancelled = 0;

        // When & Then
        for (int step = 0; step < STEPS; step++) {
            int action = random.nextInt(10);
            if (action < 5) {
                CompletableFuture<String> gate = pending();
                gates.add(gate);
                results.add(bulkhead.execute(() -> gate));
                submitted++;
            } else if (action < 9 && !gates.isEmpty()) {
                gates.remove(random.nextInt(gates.size())).complete("step-" + step);
            } else if (!results.isEmpty()) {
                int before = bulkhead.getStats().queuedCount();
                results.get(random.nextInt(results.size())).cancel(false);
                if (bulkhead.getStats().queuedCount() == before - 1) {
                    cancelled++;
                }
            }

            BulkheadStats stats = bulkhead.getStats();
            assertBulkheadInvariants(stats);
            assertEquals(submitted,
                stats.totalRejected() + stats.totalExecuted() + stats.activeCount() + stats.queuedCount() + cancelled,
                "every submitted task must be accounted for exactly once at step " + step + ": " + stats);
        }

        // 남은 작업을 모두 완료하면 슬롯과 큐가 비어야 함
        gates.forEach(gate -> gate.complete("final"));
        BulkheadStats finalStats = bulkhead.getStats();
        assertEquals(0, finalStats.activeCount());
        assertEquals(0, finalStats.queuedCount());
        for (CompletableFuture<String> result : results) {
            assertTrue(result.isDone());
            if (result.isCompletedExceptionally() && !result.isCancelled()) {
                CompletionException error = assertThrows(CompletionException.class, result::join);
                assertTrue(error.getCause() instanceof QueueFullException, "unexpected failure: " + error.getCause());
            }
        }
    }

    @Test
    void testSemaphore_RandomOperations_PermitsConserved() {
        // Given
        Semaphore semaphore = new Semaphore("invariant.semaphore", 3, scheduler, metrics);
        Random random = new Random(7);
        List<CompletableFuture<Void>> requests = new ArrayList<>();
        int released = 0;

        // When & Then
        for (int step = 0; step < STEPS; step++) {
            int action = random.nextInt(10);
            int held = countGranted(requests) - released;
            if (action < 5) {
                requests.add(semaphore.acquire());
            } else if (action < 9 && held > 0) {
                semaphore.release();
                released++;
            } else if (!requests.isEmpty()) {
                requests.get(random.nextInt(requests.size())).cancel(false);
            }

            SemaphoreStats stats = semaphore.getStats();
            held = countGranted(requests) - released;
            assertSemaphoreInvariants(stats);
            assertEquals(stats.totalPermits(), stats.availablePermits() + held,
                "permits must be conserved at step " + step + ": " + stats);
        }

        // 보유한 Permit을 모두 반환하면 전부 돌아와야 함
        int held = countGranted(requests) - released;
        while (held > 0) {
            semaphore.release();
            released++;
            held = countGranted(requests) - released;
        }
        assertEquals(3, semaphore.getStats().availablePermits());
    }

    /**
     * 실제로 Permit을 넘겨받은 획득 요청 수.
     */
    private static int countGranted(List<CompletableFuture<Void>> requests) {
        int granted = 0;
        for (CompletableFuture<Void> request : requests) {
            if (request.isDone() && !request.isCompletedExceptionally()) {
                granted++;
            }
        }
        return granted;
    }
}
