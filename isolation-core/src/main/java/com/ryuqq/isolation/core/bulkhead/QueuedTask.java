package com.ryuqq.isolation.core.bulkhead;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * 실행 슬롯을 기다리는 작업.
 *
 * <p>슬롯 할당(grant), 큐 타임아웃, drain 거절, 호출자 취소 중 정확히 하나만
 * {@link #trySettle()}에 성공하며, 나머지 경로는 아무 동작도 하지 않습니다.</p>
 *
 * @param <T> 작업 결과 타입
 * @author Isolation Team
 * @since 1.0.0
 */
final class QueuedTask<T> {

    private final Supplier<? extends CompletionStage<T>> task;
    private final CompletableFuture<T> future;
    private final long enqueuedAtNanos;
    private final AtomicBoolean settled = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> timeoutHandle;

    QueuedTask(Supplier<? extends CompletionStage<T>> task, long enqueuedAtNanos) {
        this.task = task;
        this.future = new CompletableFuture<>();
        this.enqueuedAtNanos = enqueuedAtNanos;
    }

    Supplier<? extends CompletionStage<T>> task() {
        return task;
    }

    CompletableFuture<T> future() {
        return future;
    }

    /**
     * 정착 권한 획득 시도.
     *
     * @return 처음 호출한 경로만 true
     */
    boolean trySettle() {
        return settled.compareAndSet(false, true);
    }

    void setTimeoutHandle(ScheduledFuture<?> timeoutHandle) {
        this.timeoutHandle = timeoutHandle;
    }

    void cancelTimeout() {
        ScheduledFuture<?> handle = timeoutHandle;
        if (handle != null) {
            handle.cancel(false);
        }
    }

    /**
     * 큐 진입 시점부터 주어진 시점까지의 대기 시간.
     *
     * @param nowNanos 기준 시점 ({@link System#nanoTime()})
     * @return 대기 시간 (밀리초)
     */
    long waitTimeMs(long nowNanos) {
        return TimeUnit.NANOSECONDS.toMillis(nowNanos - enqueuedAtNanos);
    }
}
