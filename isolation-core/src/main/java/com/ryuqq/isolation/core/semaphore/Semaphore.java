package com.ryuqq.isolation.core.semaphore;

import com.ryuqq.isolation.core.exception.SchedulerUnavailableException;
import com.ryuqq.isolation.core.exception.SemaphoreTimeoutException;
import com.ryuqq.isolation.core.model.SemaphoreStats;
import com.ryuqq.isolation.core.spi.CounterEvent;
import com.ryuqq.isolation.core.spi.GaugeType;
import com.ryuqq.isolation.core.spi.GuardedMetricsSink;
import com.ryuqq.isolation.core.spi.MetricsSink;
import com.ryuqq.isolation.core.spi.noop.NoOpMetricsSink;
import com.ryuqq.isolation.core.support.CompletionStages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 이름 붙은 비동기 카운팅 Semaphore.
 *
 * <p>"CPU 집약", "메모리 집약", "AI 전체 요청 수"처럼 여러 Bulkhead에 걸친 전역 리소스 등급을 제한합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>acquire(): Permit이 있으면 즉시 완료, 없으면 FIFO 대기열에 등록</li>
 *   <li>acquire(timeout): 대기 시간이 지나면 {@link SemaphoreTimeoutException} (totalTimeout 증가)</li>
 *   <li>release(): 대기자가 있으면 Permit을 가장 먼저 기다린 대기자에게 직접 넘김, 없으면 availablePermits 증가</li>
 *   <li>withPermit(fn): 획득 → 실행 → 모든 종료 경로에서 반환</li>
 * </ul>
 *
 * <p>대기자 깨우기와 타임아웃이 경쟁해도 대기자마다 정착 플래그를 두어 한 쪽만 이깁니다.
 * acquire()가 돌려준 future를 호출자가 취소하면 대기열에서 빠지며,
 * 이미 Permit을 넘겨받은 뒤라면 그 Permit은 다음 대기자에게 넘어가거나 다시 사용 가능 상태가 되며,
 * 이 경우는 totalAcquired와 totalReleased 어느 쪽에도 집계되지 않습니다.</p>
 *
 * <p>넘겨받은 대기자의 후속 작업이 같은 스레드에서 다시 release()를 호출해도
 * 대기자 깨우기는 재귀 대신 스레드별 대기열에서 순서대로 처리되므로 스택 깊이가 대기자 수와 무관합니다.</p>
 *
 * <p><strong>불변식:</strong> 0 ≤ availablePermits ≤ totalPermits.
 * 획득한 적 없는 Permit을 반환하려 하면 {@link IllegalStateException}이 발생하며 상태는 바뀌지 않습니다.</p>
 *
 * @author Isolation Team
 * @since 1.0.0
 */
public final class Semaphore {

    private static final Logger log = LoggerFactory.getLogger(Semaphore.class);

    private final String name;
    private final int totalPermits;
    private final ScheduledExecutorService scheduler;
    private final MetricsSink metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private final ThreadLocal<Deque<Waiter>> handingOff = new ThreadLocal<>();

    private int availablePermits;
    private long totalAcquired;
    private long totalReleased;
    private long totalTimeout;

    /**
     * 생성자 (메트릭 미사용).
     *
     * @param name Semaphore 이름
     * @param totalPermits 전체 Permit 수 (양수)
     * @param scheduler 획득 타임아웃 타이머용 스케줄러
     */
    public Semaphore(String name, int totalPermits, ScheduledExecutorService scheduler) {
        this(name, totalPermits, scheduler, NoOpMetricsSink.INSTANCE);
    }

    /**
     * 생성자.
     *
     * @param name Semaphore 이름
     * @param totalPermits 전체 Permit 수 (양수)
     * @param scheduler 획득 타임아웃 타이머용 스케줄러
     * @param metrics 메트릭 sink (null이면 NoOp)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public Semaphore(String name, int totalPermits, ScheduledExecutorService scheduler, MetricsSink metrics) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (totalPermits <= 0) {
            throw new IllegalArgumentException("totalPermits must be positive (current: " + totalPermits + ")");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.name = name;
        this.totalPermits = totalPermits;
        this.availablePermits = totalPermits;
        this.scheduler = scheduler;
        this.metrics = GuardedMetricsSink.wrap(metrics);

        log.info("Semaphore {} initialized with {} permits", name, totalPermits);
    }

    /**
     * 타임아웃 없이 Permit 획득.
     *
     * @return Permit을 얻으면 완료되는 future
     */
    public CompletableFuture<Void> acquire() {
        return acquire(null);
    }

    /**
     * Permit 획득.
     *
     * @param timeout 최대 대기 시간 (null이면 무기한 대기)
     * @return Permit을 얻으면 완료되는 future, 타임아웃 시 {@link SemaphoreTimeoutException}으로 실패,
     *         대기가 필요한데 스케줄러가 종료된 경우 {@link SchedulerUnavailableException}으로 실패
     * @throws IllegalArgumentException timeout이 음수인 경우
     */
    public CompletableFuture<Void> acquire(Duration timeout) {
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be negative (current: " + timeout + ")");
        }

        Waiter waiter = null;
        int available;

        lock.lock();
        try {
            if (availablePermits > 0) {
                availablePermits--;
                totalAcquired++;
            } else {
                waiter = new Waiter();
                if (timeout != null) {
                    try {
                        scheduleTimeout(waiter, timeout);
                    } catch (RejectedExecutionException e) {
                        log.error("Failed to schedule acquire timeout for semaphore {}", name, e);
                        return CompletableFuture.failedFuture(new SchedulerUnavailableException(name, e));
                    }
                }
                waiters.addLast(waiter);
            }
            available = availablePermits;
        } finally {
            lock.unlock();
        }

        if (waiter == null) {
            metrics.counter(name, CounterEvent.ACQUIRED);
            metrics.gauge(name, GaugeType.AVAILABLE_PERMITS, available);
            return CompletableFuture.completedFuture(null);
        }

        log.debug("Waiting for permit on semaphore {}", name);
        Waiter registered = waiter;
        registered.future.whenComplete((ignored, error) -> {
            if (registered.future.isCancelled()) {
                onCancelled(registered);
            }
        });
        return registered.future;
    }

    /**
     * 타임아웃 타이머 등록 (lock 보유 상태에서 호출).
     */
    private void scheduleTimeout(Waiter waiter, Duration timeout) {
        waiter.timeoutHandle = scheduler.schedule(
            () -> onTimeout(waiter, timeout),
            timeout.toNanos(),
            TimeUnit.NANOSECONDS
        );
    }

    /**
     * Permit 반환.
     *
     * <p>대기자가 있으면 availablePermits를 늘리지 않고 가장 먼저 기다린 대기자에게 직접 넘깁니다.</p>
     *
     * @throws IllegalStateException 모든 Permit이 이미 반환된 상태에서 호출된 경우
     */
    public void release() {
        Waiter next;
        int available;

        lock.lock();
        try {
            next = pollWaiter();
            if (next == null) {
                if (availablePermits >= totalPermits) {
                    throw new IllegalStateException("Semaphore " + name
                        + " released more permits than acquired (totalPermits=" + totalPermits + ")");
                }
                availablePermits++;
            }
            totalReleased++;
            available = availablePermits;
        } finally {
            lock.unlock();
        }

        metrics.counter(name, CounterEvent.RELEASED);
        if (next == null) {
            metrics.gauge(name, GaugeType.AVAILABLE_PERMITS, available);
            return;
        }
        handOff(next);
    }

    /**
     * 정착 플래그를 먼저 차지한 대기자를 FIFO 순서로 꺼냄 (lock 보유 상태에서 호출).
     *
     * @return Permit을 넘겨받을 대기자, 없으면 null
     */
    private Waiter pollWaiter() {
        while (!waiters.isEmpty()) {
            Waiter candidate = waiters.pollFirst();
            if (candidate.trySettle()) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * 대기자에게 Permit 전달.
     *
     * <p>현재 스레드가 이미 전달 중이면 스레드별 대기열에 넣고 반환하며, 가장 바깥의 호출이 순서대로 완료시킵니다.</p>
     */
    private void handOff(Waiter waiter) {
        Deque<Waiter> pending = handingOff.get();
        if (pending != null) {
            pending.addLast(waiter);
            return;
        }

        pending = new ArrayDeque<>();
        handingOff.set(pending);
        try {
            Waiter current = waiter;
            while (current != null) {
                grant(current);
                current = pending.pollFirst();
            }
        } finally {
            handingOff.remove();
        }
    }

    private void grant(Waiter waiter) {
        waiter.cancelTimeout();

        lock.lock();
        try {
            totalAcquired++;
        } finally {
            lock.unlock();
        }

        if (waiter.future.complete(null)) {
            metrics.counter(name, CounterEvent.ACQUIRED);
            return;
        }

        // 넘겨받기 직전에 호출자가 취소함
        Waiter next;
        int available;
        lock.lock();
        try {
            totalAcquired--;
            next = pollWaiter();
            if (next == null) {
                availablePermits++;
            }
            available = availablePermits;
        } finally {
            lock.unlock();
        }

        log.debug("Handed-off permit returned after caller cancellation on semaphore {}", name);
        if (next == null) {
            metrics.gauge(name, GaugeType.AVAILABLE_PERMITS, available);
        } else {
            handOff(next);
        }
    }

    /**
     * Permit을 보유한 채 작업 실행 (타임아웃 없음).
     *
     * @param fn 비동기 작업
     * @param <T> 결과 타입
     * @return 작업 결과 future
     */
    public <T> CompletableFuture<T> withPermit(Supplier<? extends CompletionStage<T>> fn) {
        return withPermit(fn, null);
    }

    /**
     * Permit을 보유한 채 작업 실행.
     *
     * <p>획득 → fn 실행 → 성공, 실패, fn 자체의 예외 등 모든 종료 경로에서 반환합니다.
     * 반환된 future가 완료되는 시점에는 이미 Permit이 반환되어 있습니다.
     * fn의 결과와 예외는 그대로 전달됩니다.</p>
     *
     * @param fn 비동기 작업
     * @param timeout 획득 최대 대기 시간 (null이면 무기한)
     * @param <T> 결과 타입
     * @return 작업 결과 future
     * @throws IllegalArgumentException fn이 null이거나 timeout이 음수인 경우
     */
    public <T> CompletableFuture<T> withPermit(Supplier<? extends CompletionStage<T>> fn, Duration timeout) {
        if (fn == null) {
            throw new IllegalArgumentException("fn cannot be null");
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        acquire(timeout).whenComplete((ignored, acquireError) -> {
            if (acquireError != null) {
                result.completeExceptionally(CompletionStages.unwrap(acquireError));
                return;
            }
            CompletionStages.invoke(fn).whenComplete((value, error) -> {
                release();
                if (error != null) {
                    result.completeExceptionally(CompletionStages.unwrap(error));
                } else {
                    result.complete(value);
                }
            });
        });
        return result;
    }

    /**
     * 획득 타임아웃 만료 처리.
     */
    private void onTimeout(Waiter waiter, Duration timeout) {
        lock.lock();
        try {
            if (!waiters.remove(waiter) || !waiter.trySettle()) {
                return;
            }
            totalTimeout++;
        } finally {
            lock.unlock();
        }

        log.warn("Semaphore {} acquisition timed out after {}ms", name, timeout.toMillis());
        metrics.counter(name, CounterEvent.TIMEOUT);
        waiter.future.completeExceptionally(new SemaphoreTimeoutException(name, timeout));
    }

    /**
     * 호출자가 대기 중인 획득 요청을 취소한 경우 대기열에서 제거.
     */
    private void onCancelled(Waiter waiter) {
        boolean removed;

        lock.lock();
        try {
            removed = waiters.remove(waiter) && waiter.trySettle();
        } finally {
            lock.unlock();
        }

        if (removed) {
            waiter.cancelTimeout();
            log.debug("Permit wait cancelled by caller on semaphore {}", name);
        }
    }

    /**
     * 통계 스냅샷 조회.
     *
     * @return 일관된 시점의 통계
     */
    public SemaphoreStats getStats() {
        lock.lock();
        try {
            return new SemaphoreStats(
                name,
                totalPermits,
                availablePermits,
                waiters.size(),
                totalAcquired,
                totalReleased,
                totalTimeout
            );
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public int getTotalPermits() {
        return totalPermits;
    }

    /**
     * Permit 대기자.
     */
    private static final class Waiter {

        private final CompletableFuture<Void> future = new CompletableFuture<>();
        private final AtomicBoolean settled = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> timeoutHandle;

        boolean trySettle() {
            return settled.compareAndSet(false, true);
        }

        void cancelTimeout() {
            ScheduledFuture<?> handle = timeoutHandle;
            if (handle != null) {
                handle.cancel(false);
            }
        }
    }
}
