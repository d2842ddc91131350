package com.ryuqq.isolation.core.bulkhead;

import com.ryuqq.isolation.core.config.BulkheadConfig;
import com.ryuqq.isolation.core.exception.BulkheadDrainingException;
import com.ryuqq.isolation.core.exception.QueueFullException;
import com.ryuqq.isolation.core.exception.QueueTimeoutException;
import com.ryuqq.isolation.core.exception.SchedulerUnavailableException;
import com.ryuqq.isolation.core.model.BulkheadStats;
import com.ryuqq.isolation.core.spi.CounterEvent;
import com.ryuqq.isolation.core.spi.GaugeType;
import com.ryuqq.isolation.core.spi.GuardedMetricsSink;
import com.ryuqq.isolation.core.spi.HistogramType;
import com.ryuqq.isolation.core.spi.MetricsSink;
import com.ryuqq.isolation.core.spi.noop.NoOpMetricsSink;
import com.ryuqq.isolation.core.support.CompletionStages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 이름 붙은 동시 실행 + 대기 큐 제한기.
 *
 * <p>하나의 외부 의존성(AI 프로바이더 호출, 컨테이너 작업 등)에 대해 동시에 실행되는 작업 수와
 * 실행을 기다리는 작업 수를 제한하여, 해당 의존성의 과부하가 다른 의존성으로 번지지 않도록 격리합니다.</p>
 *
 * <p><strong>진입 판정 (순서대로 평가):</strong></p>
 * <ol>
 *   <li>activeCount &lt; maxConcurrent → 즉시 실행</li>
 *   <li>queuedCount &lt; maxQueueSize → 큐에 추가, queueTimeout 타이머 시작</li>
 *   <li>그 외 → {@link QueueFullException}으로 즉시 실패 (totalRejected 증가)</li>
 * </ol>
 *
 * <p><strong>대기 작업의 정착:</strong></p>
 * <ul>
 *   <li>앞선 작업이 끝나면 FIFO 순서로 슬롯 할당 후 실행</li>
 *   <li>할당 전에 타이머가 먼저 만료되면 {@link QueueTimeoutException} (totalTimeout 증가)</li>
 *   <li>drain 시 {@link BulkheadDrainingException}</li>
 * </ul>
 * <p>할당과 타임아웃이 경쟁하더라도 {@link QueuedTask#trySettle()}로 정확히 한 쪽만 이깁니다.</p>
 *
 * <p><strong>동시성 모델:</strong></p>
 * <ul>
 *   <li>모든 가변 상태는 하나의 {@link ReentrantLock} 안에서만 변경</li>
 *   <li>작업 호출, 호출자 future 완료, 메트릭 전송은 lock 밖에서 수행</li>
 *   <li>{@link #execute(Supplier)}는 호출 스레드를 블로킹하지 않음 (즉시 실행되는 작업은 호출 스레드에서 시작)</li>
 *   <li>슬롯을 할당받은 대기 작업은 앞선 작업을 정착시킨 스레드에서 시작되며,
 *       같은 스레드에서 연쇄적으로 할당되는 작업은 재귀 호출 대신 스레드별 대기열에서 순서대로 시작</li>
 * </ul>
 *
 * <pre>{@code
 * Bulkhead bulkhead = new Bulkhead(
 *     new BulkheadConfig("ai.claude", 20, 100, Duration.ofSeconds(60)), scheduler);
 *
 * CompletableFuture<String> answer = bulkhead.execute(() -> client.completeAsync(prompt));
 * }</pre>
 *
 * @author Isolation Team
 * @since 1.0.0
 */
public final class Bulkhead {

    private static final Logger log = LoggerFactory.getLogger(Bulkhead.class);

    private final BulkheadConfig config;
    private final ScheduledExecutorService scheduler;
    private final MetricsSink metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<QueuedTask<?>> queue = new ArrayDeque<>();
    private final ThreadLocal<Deque<QueuedTask<?>>> dispatching = new ThreadLocal<>();

    private int activeCount;
    private long totalExecuted;
    private long totalRejected;
    private long totalTimeout;
    private double averageExecutionTimeMs;
    private long waitSamples;
    private double averageWaitTimeMs;
    private CompletableFuture<Void> drainFuture;

    /**
     * 생성자 (메트릭 미사용).
     *
     * @param config Bulkhead 설정
     * @param scheduler 큐 타임아웃 타이머용 스케줄러
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public Bulkhead(BulkheadConfig config, ScheduledExecutorService scheduler) {
        this(config, scheduler, NoOpMetricsSink.INSTANCE);
    }

    /**
     * 생성자.
     *
     * @param config Bulkhead 설정
     * @param scheduler 큐 타임아웃 타이머용 스케줄러
     * @param metrics 메트릭 sink (null이면 NoOp)
     * @throws IllegalArgumentException config 또는 scheduler가 null인 경우
     */
    public Bulkhead(BulkheadConfig config, ScheduledExecutorService scheduler, MetricsSink metrics) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.config = config;
        this.scheduler = scheduler;
        this.metrics = GuardedMetricsSink.wrap(metrics);

        log.info("Bulkhead {} initialized (maxConcurrent={}, maxQueueSize={}, queueTimeout={}ms)",
            config.name(), config.maxConcurrent(), config.maxQueueSize(), config.queueTimeout().toMillis());
    }

    /**
     * 작업 실행 요청.
     *
     * <p>반환된 future는 작업 결과로 완료되거나, 작업의 원래 예외 또는
     * {@link QueueFullException}, {@link QueueTimeoutException}, {@link BulkheadDrainingException},
     * {@link SchedulerUnavailableException}으로 실패합니다. 이 메서드 자체는 예외를 던지지 않습니다 (인자 검증 제외).</p>
     *
     * <p>큐에 대기 중인 작업의 future를 호출자가 취소하면 해당 작업은 큐에서 제거되고 실행되지 않습니다.</p>
     *
     * @param task 비동기 작업
     * @param <T> 결과 타입
     * @return 작업 정착 시 완료되는 future
     * @throws IllegalArgumentException task가 null인 경우
     */
    public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }

        Admission admission;
        QueuedTask<T> queued = null;
        RejectedExecutionException schedulerFailure = null;
        int active;
        int queuedCount;

        lock.lock();
        try {
            if (drainFuture != null) {
                admission = Admission.DRAINING;
            } else if (activeCount < config.maxConcurrent()) {
                activeCount++;
                admission = Admission.RUN;
            } else if (queue.size() < config.maxQueueSize()) {
                try {
                    queued = enqueue(task);
                    admission = Admission.QUEUED;
                } catch (RejectedExecutionException e) {
                    schedulerFailure = e;
                    admission = Admission.SCHEDULER_UNAVAILABLE;
                }
            } else {
                totalRejected++;
                admission = Admission.REJECTED;
            }
            active = activeCount;
            queuedCount = queue.size();
        } finally {
            lock.unlock();
        }

        switch (admission) {
            case RUN:
                metrics.gauge(config.name(), GaugeType.ACTIVE_COUNT, active);
                CompletableFuture<T> result = new CompletableFuture<>();
                run(task, result);
                return result;
            case QUEUED:
                log.debug("Task queued in bulkhead {} (queued={}, active={})", config.name(), queuedCount, active);
                metrics.gauge(config.name(), GaugeType.QUEUED_COUNT, queuedCount);
                QueuedTask<T> waiting = queued;
                waiting.future().whenComplete((value, error) -> {
                    if (waiting.future().isCancelled()) {
                        onCancelled(waiting);
                    }
                });
                return waiting.future();
            case REJECTED:
                log.warn("Bulkhead {} saturated, rejecting task (active={}, queued={})",
                    config.name(), active, queuedCount);
                metrics.counter(config.name(), CounterEvent.REJECTED);
                return CompletableFuture.failedFuture(
                    new QueueFullException(config.name(), config.maxConcurrent(), config.maxQueueSize()));
            case DRAINING:
                log.debug("Bulkhead {} is draining, rejecting new task", config.name());
                return CompletableFuture.failedFuture(new BulkheadDrainingException(config.name()));
            default:
                log.error("Failed to schedule queue timeout for bulkhead {}", config.name(), schedulerFailure);
                return CompletableFuture.failedFuture(new SchedulerUnavailableException(config.name(), schedulerFailure));
        }
    }

    /**
     * 큐 추가 및 타임아웃 타이머 등록 (lock 보유 상태에서 호출).
     *
     * @return 큐에 추가된 작업
     * @throws RejectedExecutionException 스케줄러가 종료되어 타이머를 등록할 수 없는 경우 (큐는 변경되지 않음)
     */
    private <T> QueuedTask<T> enqueue(Supplier<? extends CompletionStage<T>> task) {
        QueuedTask<T> queued = new QueuedTask<>(task, System.nanoTime());
        queued.setTimeoutHandle(scheduler.schedule(
            () -> onQueueTimeout(queued),
            config.queueTimeout().toNanos(),
            TimeUnit.NANOSECONDS
        ));
        queue.addLast(queued);
        return queued;
    }

    /**
     * 슬롯을 점유한 상태에서 작업 실행.
     *
     * <p>작업이 정착되면 통계를 갱신하고 슬롯을 반환한 뒤 호출자 future를 완료합니다.
     * 이어서 다음 대기 작업이 있으면 {@link #dispatch(QueuedTask)}로 넘깁니다.</p>
     */
    private <T> void run(Supplier<? extends CompletionStage<T>> task, CompletableFuture<T> result) {
        long startNanos = System.nanoTime();
        CompletionStage<T> stage = CompletionStages.invoke(task);
        stage.whenComplete((value, error) -> {
            QueuedTask<?> next = onComplete(startNanos, error);
            if (error != null) {
                result.completeExceptionally(CompletionStages.unwrap(error));
            } else {
                result.complete(value);
            }
            if (next != null) {
                dispatch(next);
            }
        });
    }

    /**
     * 슬롯을 할당받은 대기 작업 시작.
     *
     * <p>동기적으로 완료되는 작업이 연달아 할당되면 run → 정착 → 다음 할당이 같은 스택 위에서 반복됩니다.
     * 현재 스레드가 이미 이 Bulkhead의 작업을 시작하는 중이면 스레드별 대기열에 넣고 바로 반환하며,
     * 가장 바깥의 호출이 대기열을 순서대로 비웁니다. 스택 깊이는 대기 작업 수와 무관하게 일정합니다.</p>
     */
    private void dispatch(QueuedTask<?> granted) {
        Deque<QueuedTask<?>> pending = dispatching.get();
        if (pending != null) {
            pending.addLast(granted);
            return;
        }

        pending = new ArrayDeque<>();
        dispatching.set(pending);
        try {
            QueuedTask<?> current = granted;
            while (current != null) {
                start(current);
                current = pending.pollFirst();
            }
        } finally {
            dispatching.remove();
        }
    }

    /**
     * 큐에서 할당받은 작업 시작.
     */
    private <T> void start(QueuedTask<T> granted) {
        granted.cancelTimeout();
        run(granted.task(), granted.future());
    }

    /**
     * 작업 정착 처리.
     *
     * @return 이어서 실행할 대기 작업, 없으면 null
     */
    private QueuedTask<?> onComplete(long startNanos, Throwable error) {
        long nowNanos = System.nanoTime();
        long executionTimeMs = TimeUnit.NANOSECONDS.toMillis(nowNanos - startNanos);
        QueuedTask<?> next = null;
        long waitTimeMs = 0;
        CompletableFuture<Void> drained = null;
        int active;
        int queuedCount;

        lock.lock();
        try {
            activeCount--;
            totalExecuted++;
            averageExecutionTimeMs += (executionTimeMs - averageExecutionTimeMs) / totalExecuted;

            next = grantNext();
            if (next != null) {
                waitTimeMs = next.waitTimeMs(nowNanos);
                waitSamples++;
                averageWaitTimeMs += (waitTimeMs - averageWaitTimeMs) / waitSamples;
            }

            if (drainFuture != null && activeCount == 0 && queue.isEmpty()) {
                drained = drainFuture;
                drainFuture = null;
            }
            active = activeCount;
            queuedCount = queue.size();
        } finally {
            lock.unlock();
        }

        metrics.counter(config.name(), CounterEvent.EXECUTED);
        if (error != null) {
            metrics.counter(config.name(), CounterEvent.FAILED);
        }
        metrics.histogram(config.name(), HistogramType.EXECUTION_TIME, executionTimeMs);
        metrics.gauge(config.name(), GaugeType.ACTIVE_COUNT, active);
        if (next != null) {
            log.debug("Granted slot in bulkhead {} after waiting {}ms", config.name(), waitTimeMs);
            metrics.histogram(config.name(), HistogramType.WAIT_TIME, waitTimeMs);
            metrics.gauge(config.name(), GaugeType.QUEUED_COUNT, queuedCount);
        }
        if (drained != null) {
            log.info("Bulkhead {} drained", config.name());
            drained.complete(null);
        }
        return next;
    }

    /**
     * FIFO 순서로 다음 대기 작업에 슬롯 할당 (lock 보유 상태에서 호출).
     */
    private QueuedTask<?> grantNext() {
        while (activeCount < config.maxConcurrent() && !queue.isEmpty()) {
            QueuedTask<?> candidate = queue.pollFirst();
            if (candidate.trySettle()) {
                activeCount++;
                return candidate;
            }
        }
        return null;
    }

    /**
     * 큐 타임아웃 타이머 만료 처리.
     */
    private void onQueueTimeout(QueuedTask<?> queued) {
        int queuedCount;

        lock.lock();
        try {
            if (!queue.remove(queued) || !queued.trySettle()) {
                return;
            }
            totalTimeout++;
            queuedCount = queue.size();
        } finally {
            lock.unlock();
        }

        log.warn("Task timed out in bulkhead {} queue after {}ms",
            config.name(), config.queueTimeout().toMillis());
        metrics.counter(config.name(), CounterEvent.TIMEOUT);
        metrics.gauge(config.name(), GaugeType.QUEUED_COUNT, queuedCount);
        queued.future().completeExceptionally(new QueueTimeoutException(config.name(), config.queueTimeout()));
    }

    /**
     * 호출자가 대기 작업의 future를 취소한 경우 큐에서 제거.
     */
    private void onCancelled(QueuedTask<?> queued) {
        boolean removed;
        int queuedCount;

        lock.lock();
        try {
            removed = queue.remove(queued) && queued.trySettle();
            queuedCount = queue.size();
        } finally {
            lock.unlock();
        }

        if (removed) {
            queued.cancelTimeout();
            log.debug("Queued task cancelled by caller in bulkhead {}", config.name());
            metrics.gauge(config.name(), GaugeType.QUEUED_COUNT, queuedCount);
        }
    }

    /**
     * Graceful drain.
     *
     * <p>대기 중인 작업은 즉시 {@link BulkheadDrainingException}으로 정착되고 실행되지 않습니다.
     * 이미 실행 중인 작업은 취소하지 않고 자연 종료를 기다립니다.
     * drain 진행 중에 제출된 작업도 {@link BulkheadDrainingException}으로 거절됩니다.</p>
     *
     * <p>반환된 future는 activeCount == 0, queuedCount == 0이 되면 완료되며,
     * 그 이후 Bulkhead는 다시 작업을 받습니다. drain 진행 중 다시 호출하면 같은 future를 반환합니다.</p>
     *
     * @return drain 완료 시 완료되는 future
     */
    public CompletableFuture<Void> drain() {
        List<QueuedTask<?>> rejected = new ArrayList<>();
        CompletableFuture<Void> future;
        boolean started = false;
        boolean completeNow = false;
        int active;

        lock.lock();
        try {
            if (drainFuture == null) {
                drainFuture = new CompletableFuture<>();
                started = true;
            }
            future = drainFuture;
            while (!queue.isEmpty()) {
                QueuedTask<?> queued = queue.pollFirst();
                if (queued.trySettle()) {
                    rejected.add(queued);
                }
            }
            if (activeCount == 0) {
                drainFuture = null;
                completeNow = true;
            }
            active = activeCount;
        } finally {
            lock.unlock();
        }

        if (started) {
            log.info("Draining bulkhead {} (rejecting {} queued, awaiting {} active)",
                config.name(), rejected.size(), active);
        }
        for (QueuedTask<?> queued : rejected) {
            queued.cancelTimeout();
            queued.future().completeExceptionally(new BulkheadDrainingException(config.name()));
        }
        if (!rejected.isEmpty()) {
            metrics.gauge(config.name(), GaugeType.QUEUED_COUNT, 0);
        }
        if (completeNow) {
            log.info("Bulkhead {} drained", config.name());
            future.complete(null);
        }
        return future;
    }

    /**
     * 누적 통계 초기화.
     *
     * <p>totalExecuted, totalRejected, totalTimeout과 평균값만 0으로 되돌리며,
     * 실행 중이거나 대기 중인 작업에는 영향을 주지 않습니다.</p>
     */
    public void reset() {
        lock.lock();
        try {
            totalExecuted = 0;
            totalRejected = 0;
            totalTimeout = 0;
            averageExecutionTimeMs = 0;
            waitSamples = 0;
            averageWaitTimeMs = 0;
        } finally {
            lock.unlock();
        }
        log.info("Bulkhead {} reset", config.name());
    }

    /**
     * 통계 스냅샷 조회.
     *
     * @return 일관된 시점의 통계
     */
    public BulkheadStats getStats() {
        lock.lock();
        try {
            return new BulkheadStats(
                config.name(),
                activeCount,
                queue.size(),
                config.maxConcurrent(),
                config.maxQueueSize(),
                totalExecuted,
                totalRejected,
                totalTimeout,
                averageExecutionTimeMs,
                averageWaitTimeMs
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * drain 진행 여부.
     *
     * @return drain이 시작되어 아직 완료되지 않았으면 true
     */
    public boolean isDraining() {
        lock.lock();
        try {
            return drainFuture != null;
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return config.name();
    }

    public BulkheadConfig getConfig() {
        return config;
    }

    private enum Admission {
        RUN,
        QUEUED,
        REJECTED,
        DRAINING,
        SCHEDULER_UNAVAILABLE
    }
}
