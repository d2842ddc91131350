package com.ryuqq.isolation.manager;

import com.ryuqq.isolation.core.bulkhead.Bulkhead;
import com.ryuqq.isolation.core.config.BulkheadConfig;
import com.ryuqq.isolation.core.config.BulkheadConfigOverride;
import com.ryuqq.isolation.core.config.BulkheadConfigResolver;
import com.ryuqq.isolation.core.config.IsolationConfig;
import com.ryuqq.isolation.core.model.BulkheadStats;
import com.ryuqq.isolation.core.model.SemaphoreStats;
import com.ryuqq.isolation.core.semaphore.Semaphore;
import com.ryuqq.isolation.core.spi.GuardedMetricsSink;
import com.ryuqq.isolation.core.spi.MetricsSink;
import com.ryuqq.isolation.core.spi.noop.NoOpMetricsSink;
import com.ryuqq.isolation.core.support.CompletionStages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Bulkhead와 전역 Semaphore를 이름으로 관리하는 프로세스 단위 레지스트리.
 *
 * <p>애플리케이션 시작 시 한 번 생성하여 필요한 컴포넌트에 주입합니다 (정적 싱글톤 없음).</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * execute(name, task, options)
 *   ↓
 * 1. options.semaphores를 나열 순서대로 획득
 *    - 하나라도 실패/타임아웃 → 이미 획득한 Semaphore를 역순으로 반환 후 실패
 * 2. getBulkhead(name).execute(task)
 * 3. Bulkhead가 작업을 정착시키면 Semaphore를 역순으로 반환 (결과와 무관)
 * 4. 호출자 future 완료
 * </pre>
 *
 * <p><strong>레지스트리:</strong></p>
 * <ul>
 *   <li>Bulkhead: 처음 참조될 때 생성, 이름당 하나, reset/drain 후에도 유지</li>
 *   <li>Semaphore: 생성 시점에 {@link IsolationConfig#semaphores()}로 고정 등록, 자동 생성하지 않음</li>
 *   <li>설정 override: {@link #updateConfig}로 변경, 이후 생성되는 Bulkhead에만 반영</li>
 * </ul>
 *
 * <p>Bulkhead 생성과 override 변경은 하나의 lock으로 직렬화됩니다.</p>
 *
 * @author Isolation Team
 * @since 1.0.0
 */
public final class BulkheadManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BulkheadManager.class);

    private static final String AI_NAMESPACE = "ai.";

    private final IsolationConfig config;
    private final MetricsSink metrics;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private final ReentrantLock registryLock = new ReentrantLock();
    private final Map<String, Bulkhead> bulkheads = new ConcurrentHashMap<>();
    private final Map<String, Semaphore> semaphores;
    private final Map<String, BulkheadConfigOverride> overrides;

    /**
     * 기본 설정으로 생성 (메트릭 미사용, 전용 타이머 스레드 생성).
     */
    public BulkheadManager() {
        this(IsolationConfig.standard());
    }

    /**
     * 생성자 (메트릭 미사용, 전용 타이머 스레드 생성).
     *
     * @param config 격리 설정
     */
    public BulkheadManager(IsolationConfig config) {
        this(config, NoOpMetricsSink.INSTANCE);
    }

    /**
     * 생성자 (전용 타이머 스레드 생성).
     *
     * <p>생성된 타이머 스레드는 {@link #close()}에서 종료됩니다.</p>
     *
     * @param config 격리 설정
     * @param metrics 메트릭 sink
     */
    public BulkheadManager(IsolationConfig config, MetricsSink metrics) {
        this(config, metrics, newTimerScheduler(), true);
    }

    /**
     * 생성자 (외부 스케줄러 주입).
     *
     * <p>주입된 스케줄러의 생명주기는 호출 측이 관리합니다.</p>
     *
     * @param config 격리 설정
     * @param metrics 메트릭 sink
     * @param scheduler 큐/획득 타임아웃 타이머용 스케줄러
     * @throws IllegalArgumentException config 또는 scheduler가 null인 경우
     */
    public BulkheadManager(IsolationConfig config, MetricsSink metrics, ScheduledExecutorService scheduler) {
        this(config, metrics, scheduler, false);
    }

    private BulkheadManager(IsolationConfig config, MetricsSink metrics,
                            ScheduledExecutorService scheduler, boolean ownsScheduler) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.config = config;
        this.metrics = GuardedMetricsSink.wrap(metrics);
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.overrides = new HashMap<>(config.services());

        Map<String, Semaphore> registered = new LinkedHashMap<>();
        config.semaphores().forEach((name, permits) ->
            registered.put(name, new Semaphore(name, permits, scheduler, this.metrics)));
        this.semaphores = Collections.unmodifiableMap(registered);

        log.info("BulkheadManager initialized (enabled={}, semaphores={})", config.enabled(), semaphores.keySet());
    }

    /**
     * 서비스 이름의 Bulkhead 조회 (없으면 생성).
     *
     * <p>설정은 생성 시점에 한 번만 결정됩니다: 기본값 ← namespace prefix override ← 이름 override.</p>
     *
     * @param name 서비스 이름 (예: ai.claude, container.create)
     * @return Bulkhead
     * @throws IllegalArgumentException name이 비어 있는 경우
     */
    public Bulkhead getBulkhead(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        Bulkhead existing = bulkheads.get(name);
        if (existing != null) {
            return existing;
        }

        registryLock.lock();
        try {
            return bulkheads.computeIfAbsent(name, this::createBulkhead);
        } finally {
            registryLock.unlock();
        }
    }

    private Bulkhead createBulkhead(String name) {
        BulkheadConfig resolved = BulkheadConfigResolver.resolve(name, config.defaults(), overrides);
        log.info("Bulkhead created for service: {} ({})", name, resolved);
        return new Bulkhead(resolved, scheduler, metrics);
    }

    /**
     * 사전 등록된 전역 Semaphore 조회.
     *
     * <p>Bulkhead와 달리 등록되지 않은 이름은 생성하지 않습니다.</p>
     *
     * @param name Semaphore 이름
     * @return Semaphore, 등록되지 않았으면 empty
     */
    public Optional<Semaphore> getSemaphore(String name) {
        return Optional.ofNullable(semaphores.get(name));
    }

    /**
     * Bulkhead 보호 하에 작업 실행 (Semaphore 없음).
     *
     * @see #execute(String, Supplier, ExecuteOptions)
     */
    public <T> CompletableFuture<T> execute(String name, Supplier<? extends CompletionStage<T>> task) {
        return execute(name, task, ExecuteOptions.none());
    }

    /**
     * Bulkhead와 전역 Semaphore 보호 하에 작업 실행.
     *
     * <p>등록되지 않은 Semaphore 이름은 WARN 로그를 남기고 건너뜁니다.
     * {@link IsolationConfig#enabled()}가 false이면 아무 제한 없이 작업을 바로 호출합니다.</p>
     *
     * <p>반환된 future가 완료되는 시점에는 획득했던 Semaphore가 모두 반환되어 있습니다.</p>
     *
     * @param name 서비스 이름
     * @param task 비동기 작업
     * @param options 실행 옵션 (null이면 {@link ExecuteOptions#none()})
     * @param <T> 결과 타입
     * @return 작업 결과 future
     * @throws IllegalArgumentException name 또는 task가 유효하지 않은 경우
     */
    public <T> CompletableFuture<T> execute(String name,
                                            Supplier<? extends CompletionStage<T>> task,
                                            ExecuteOptions options) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        ExecuteOptions effective = options != null ? options : ExecuteOptions.none();

        if (!config.enabled()) {
            return CompletionStages.invoke(task).toCompletableFuture();
        }

        Bulkhead bulkhead = getBulkhead(name);
        List<Semaphore> required = resolveSemaphores(name, effective.semaphores());
        Duration timeout = effective.semaphoreTimeout() != null
            ? effective.semaphoreTimeout()
            : config.semaphoreAcquireTimeout();

        CompletableFuture<T> result = new CompletableFuture<>();
        List<Semaphore> acquired = new ArrayList<>(required.size());

        acquireInOrder(required, 0, timeout, acquired).whenComplete((ignored, acquireError) -> {
            if (acquireError != null) {
                releaseInReverse(acquired);
                result.completeExceptionally(CompletionStages.unwrap(acquireError));
                return;
            }
            bulkhead.execute(task).whenComplete((value, error) -> {
                releaseInReverse(acquired);
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
     * CPU 집약 작업 실행 ({@value IsolationConfig#CPU_INTENSIVE} Semaphore 사용).
     */
    public <T> CompletableFuture<T> executeCpuIntensive(String name, Supplier<? extends CompletionStage<T>> task) {
        return execute(name, task, ExecuteOptions.withSemaphores(IsolationConfig.CPU_INTENSIVE));
    }

    /**
     * 메모리 집약 작업 실행 ({@value IsolationConfig#MEMORY_INTENSIVE} Semaphore 사용).
     */
    public <T> CompletableFuture<T> executeMemoryIntensive(String name, Supplier<? extends CompletionStage<T>> task) {
        return execute(name, task, ExecuteOptions.withSemaphores(IsolationConfig.MEMORY_INTENSIVE));
    }

    /**
     * AI 프로바이더 호출 실행.
     *
     * <p>Bulkhead 이름은 {@code ai.<provider>}, 전역 Semaphore는
     * {@value IsolationConfig#AI_TOTAL_REQUESTS}를 사용합니다.</p>
     *
     * @param provider 프로바이더 이름 (예: claude, openai)
     * @param task 비동기 작업
     * @param <T> 결과 타입
     * @return 작업 결과 future
     */
    public <T> CompletableFuture<T> executeAITask(String provider, Supplier<? extends CompletionStage<T>> task) {
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("provider cannot be null or blank");
        }
        return execute(AI_NAMESPACE + provider, task, ExecuteOptions.withSemaphores(IsolationConfig.AI_TOTAL_REQUESTS));
    }

    private List<Semaphore> resolveSemaphores(String name, List<String> semaphoreNames) {
        List<Semaphore> resolved = new ArrayList<>(semaphoreNames.size());
        for (String semaphoreName : semaphoreNames) {
            Semaphore semaphore = semaphores.get(semaphoreName);
            if (semaphore == null) {
                log.warn("Unknown semaphore {} requested for {}, skipping", semaphoreName, name);
            } else {
                resolved.add(semaphore);
            }
        }
        return resolved;
    }

    /**
     * Semaphore를 목록 순서대로 하나씩 획득.
     *
     * <p>획득에 성공한 Semaphore만 {@code acquired}에 추가됩니다.</p>
     */
    private CompletableFuture<Void> acquireInOrder(List<Semaphore> required, int index,
                                                   Duration timeout, List<Semaphore> acquired) {
        if (index >= required.size()) {
            return CompletableFuture.completedFuture(null);
        }
        Semaphore semaphore = required.get(index);
        return semaphore.acquire(timeout).thenCompose(ignored -> {
            acquired.add(semaphore);
            return acquireInOrder(required, index + 1, timeout, acquired);
        });
    }

    private void releaseInReverse(List<Semaphore> acquired) {
        for (int i = acquired.size() - 1; i >= 0; i--) {
            acquired.get(i).release();
        }
    }

    /**
     * 등록된 모든 Bulkhead와 Semaphore의 통계 조회.
     *
     * @return 통계 스냅샷
     */
    public IsolationStats getAllStats() {
        Map<String, BulkheadStats> bulkheadStats = new HashMap<>();
        bulkheads.forEach((name, bulkhead) -> bulkheadStats.put(name, bulkhead.getStats()));

        Map<String, SemaphoreStats> semaphoreStats = new HashMap<>();
        semaphores.forEach((name, semaphore) -> semaphoreStats.put(name, semaphore.getStats()));

        return new IsolationStats(bulkheadStats, semaphoreStats);
    }

    /**
     * 상태 요약 조회.
     *
     * <p>activeCount + queuedCount가 maxConcurrent + maxQueueSize에 도달한 Bulkhead를 포화로 판단합니다.</p>
     *
     * @return 상태 요약
     */
    public HealthSummary getHealthSummary() {
        List<String> saturated = new ArrayList<>();
        int queuedTasks = 0;
        int activeTasks = 0;

        for (Bulkhead bulkhead : bulkheads.values()) {
            BulkheadStats stats = bulkhead.getStats();
            queuedTasks += stats.queuedCount();
            activeTasks += stats.activeCount();
            if (stats.isSaturated()) {
                saturated.add(stats.name());
            }
        }
        Collections.sort(saturated);

        if (!saturated.isEmpty()) {
            log.warn("Saturated bulkheads detected: {}", saturated);
        }
        return new HealthSummary(bulkheads.size(), semaphores.size(), saturated, queuedTasks, activeTasks);
    }

    /**
     * Bulkhead 설정 override 병합.
     *
     * <p>{@code nameOrPrefix}는 서비스 이름 또는 {@code .}으로 끝나는 namespace prefix입니다.
     * 이미 생성된 Bulkhead는 재구성되지 않으며, 이후 생성되는 Bulkhead에만 반영됩니다.</p>
     *
     * @param nameOrPrefix 서비스 이름 또는 namespace prefix
     * @param partial 병합할 부분 설정
     * @throws IllegalArgumentException 파라미터가 유효하지 않은 경우
     */
    public void updateConfig(String nameOrPrefix, BulkheadConfigOverride partial) {
        if (nameOrPrefix == null || nameOrPrefix.isBlank()) {
            throw new IllegalArgumentException("nameOrPrefix cannot be null or blank");
        }
        if (partial == null) {
            throw new IllegalArgumentException("partial cannot be null");
        }

        BulkheadConfigOverride merged;
        registryLock.lock();
        try {
            merged = overrides.getOrDefault(nameOrPrefix, BulkheadConfigOverride.empty()).merge(partial);
            overrides.put(nameOrPrefix, merged);
        } finally {
            registryLock.unlock();
        }

        log.info("Bulkhead configuration updated for {}: {}", nameOrPrefix, merged);
        if (bulkheads.containsKey(nameOrPrefix)) {
            log.info("Existing bulkhead {} keeps its current configuration", nameOrPrefix);
        }
    }

    /**
     * 특정 Bulkhead 통계 초기화.
     *
     * @param name 서비스 이름 (등록되지 않았으면 무시)
     */
    public void reset(String name) {
        Bulkhead bulkhead = bulkheads.get(name);
        if (bulkhead != null) {
            bulkhead.reset();
        }
    }

    /**
     * 모든 Bulkhead 통계 초기화.
     */
    public void resetAll() {
        bulkheads.values().forEach(Bulkhead::reset);
        log.info("All bulkheads reset");
    }

    /**
     * 모든 Bulkhead drain (graceful shutdown).
     *
     * @return 모든 Bulkhead가 drain되면 완료되는 future
     */
    public CompletableFuture<Void> drainAll() {
        List<CompletableFuture<Void>> drains = new ArrayList<>();
        bulkheads.forEach((name, bulkhead) -> {
            log.info("Draining bulkhead: {}", name);
            drains.add(bulkhead.drain());
        });
        return CompletableFuture.allOf(drains.toArray(new CompletableFuture[0]))
            .thenRun(() -> log.info("All bulkheads drained"));
    }

    /**
     * 전용 타이머 스레드 종료.
     *
     * <p>외부에서 주입한 스케줄러는 종료하지 않습니다.
     * 대기 중인 작업을 먼저 정리하려면 {@link #drainAll()}을 호출한 뒤 닫아야 합니다.</p>
     */
    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private static ScheduledExecutorService newTimerScheduler() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "isolation-timer");
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
