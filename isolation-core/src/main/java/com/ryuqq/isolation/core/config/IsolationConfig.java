package com.ryuqq.isolation.core.config;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 격리 계층 전체 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enabled: false이면 Bulkhead/Semaphore를 거치지 않고 작업을 바로 실행</li>
 *   <li>defaults: 모든 Bulkhead에 적용되는 기본 설정 (모든 필드 지정 필수)</li>
 *   <li>services: 서비스 이름 또는 namespace prefix({@code ai.})별 override</li>
 *   <li>semaphores: 사전 등록되는 전역 Semaphore 이름과 Permit 수</li>
 *   <li>semaphoreAcquireTimeout: Manager가 Semaphore를 획득할 때의 기본 대기 시간</li>
 * </ul>
 *
 * <p>Map 필드는 방어적으로 복사되며 선언 순서를 유지합니다.</p>
 *
 * @param enabled 격리 적용 여부
 * @param defaults 기본 Bulkhead 설정
 * @param services 이름/prefix별 override
 * @param semaphores Semaphore 이름 → Permit 수
 * @param semaphoreAcquireTimeout Semaphore 획득 기본 대기 시간
 * @author Isolation Team
 * @since 1.0.0
 */
public record IsolationConfig(
    boolean enabled,
    BulkheadConfigOverride defaults,
    Map<String, BulkheadConfigOverride> services,
    Map<String, Integer> semaphores,
    Duration semaphoreAcquireTimeout
) {

    public static final String CPU_INTENSIVE = "global.cpu_intensive";
    public static final String MEMORY_INTENSIVE = "global.memory_intensive";
    public static final String NETWORK_IO = "global.network_io";
    public static final String DISK_IO = "global.disk_io";
    public static final String AI_TOTAL_REQUESTS = "ai.total_requests";
    public static final String CONTAINER_TOTAL = "container.total";

    /**
     * Compact constructor (유효성 검증 및 방어적 복사).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public IsolationConfig {
        if (defaults == null || !defaults.isComplete()) {
            throw new IllegalArgumentException("defaults must specify maxConcurrent, maxQueueSize and queueTimeout");
        }
        if (services == null) {
            throw new IllegalArgumentException("services cannot be null");
        }
        if (semaphores == null) {
            throw new IllegalArgumentException("semaphores cannot be null");
        }
        for (Map.Entry<String, Integer> entry : semaphores.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("semaphore name cannot be null or blank");
            }
            if (entry.getValue() == null || entry.getValue() <= 0) {
                throw new IllegalArgumentException(
                    "semaphore permits must be positive (" + entry.getKey() + ": " + entry.getValue() + ")"
                );
            }
        }
        if (semaphoreAcquireTimeout == null || semaphoreAcquireTimeout.isNegative()) {
            throw new IllegalArgumentException("semaphoreAcquireTimeout cannot be null or negative");
        }
        services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
        semaphores = Collections.unmodifiableMap(new LinkedHashMap<>(semaphores));
    }

    /**
     * 기본 설정 생성.
     *
     * <p>기본값: maxConcurrent=10, maxQueueSize=50, queueTimeout=30s, semaphoreAcquireTimeout=10s</p>
     *
     * <p><strong>Namespace 기본값:</strong></p>
     * <ul>
     *   <li>{@code ai.}: 20 / 100 / 60s</li>
     *   <li>{@code container.}: 5 / 20 / 120s</li>
     *   <li>{@code file.}: 15 / 50 / 60s</li>
     *   <li>{@code db.}: 30 / 100 / 10s</li>
     * </ul>
     *
     * <p><strong>서비스별 override:</strong> ai.deepseek (10 / 50 / 90s), container.execute (10 / 30 / 30s),
     * file.analyze (10 / 40 / 45s), api.metasploit (5 / 20 / 90s), db.write (15 / 50 / 15s)</p>
     *
     * <p><strong>전역 Semaphore:</strong> global.cpu_intensive=5, global.memory_intensive=3,
     * global.network_io=50, global.disk_io=20, ai.total_requests=30, container.total=10</p>
     *
     * @return 기본 IsolationConfig
     */
    public static IsolationConfig standard() {
        Map<String, BulkheadConfigOverride> services = new LinkedHashMap<>();
        services.put("ai.", BulkheadConfigOverride.of(20, 100, Duration.ofSeconds(60)));
        services.put("container.", BulkheadConfigOverride.of(5, 20, Duration.ofSeconds(120)));
        services.put("file.", BulkheadConfigOverride.of(15, 50, Duration.ofSeconds(60)));
        services.put("db.", BulkheadConfigOverride.of(30, 100, Duration.ofSeconds(10)));
        services.put("ai.deepseek", BulkheadConfigOverride.of(10, 50, Duration.ofSeconds(90)));
        services.put("container.execute", BulkheadConfigOverride.of(10, 30, Duration.ofSeconds(30)));
        services.put("file.analyze", BulkheadConfigOverride.of(10, 40, Duration.ofSeconds(45)));
        services.put("api.metasploit", BulkheadConfigOverride.of(5, 20, Duration.ofSeconds(90)));
        services.put("db.write", BulkheadConfigOverride.of(15, 50, Duration.ofSeconds(15)));

        Map<String, Integer> semaphores = new LinkedHashMap<>();
        semaphores.put(CPU_INTENSIVE, 5);
        semaphores.put(MEMORY_INTENSIVE, 3);
        semaphores.put(NETWORK_IO, 50);
        semaphores.put(DISK_IO, 20);
        semaphores.put(AI_TOTAL_REQUESTS, 30);
        semaphores.put(CONTAINER_TOTAL, 10);

        return new IsolationConfig(
            true,
            BulkheadConfigOverride.of(10, 50, Duration.ofSeconds(30)),
            services,
            semaphores,
            Duration.ofSeconds(10)
        );
    }

    /**
     * enabled만 변경한 새 인스턴스 생성.
     */
    public IsolationConfig withEnabled(boolean enabled) {
        return new IsolationConfig(enabled, defaults, services, semaphores, semaphoreAcquireTimeout);
    }

    /**
     * defaults만 변경한 새 인스턴스 생성.
     */
    public IsolationConfig withDefaults(BulkheadConfigOverride defaults) {
        return new IsolationConfig(enabled, defaults, services, semaphores, semaphoreAcquireTimeout);
    }

    /**
     * 서비스 override 하나를 추가(또는 교체)한 새 인스턴스 생성.
     */
    public IsolationConfig withService(String nameOrPrefix, BulkheadConfigOverride override) {
        if (nameOrPrefix == null || nameOrPrefix.isBlank()) {
            throw new IllegalArgumentException("nameOrPrefix cannot be null or blank");
        }
        if (override == null) {
            throw new IllegalArgumentException("override cannot be null");
        }
        Map<String, BulkheadConfigOverride> copy = new LinkedHashMap<>(services);
        copy.put(nameOrPrefix, override);
        return new IsolationConfig(enabled, defaults, copy, semaphores, semaphoreAcquireTimeout);
    }

    /**
     * 서비스 override 전체를 교체한 새 인스턴스 생성.
     */
    public IsolationConfig withServices(Map<String, BulkheadConfigOverride> services) {
        return new IsolationConfig(enabled, defaults, services, semaphores, semaphoreAcquireTimeout);
    }

    /**
     * Semaphore 하나를 추가(또는 교체)한 새 인스턴스 생성.
     */
    public IsolationConfig withSemaphore(String name, int permits) {
        Map<String, Integer> copy = new LinkedHashMap<>(semaphores);
        copy.put(name, permits);
        return new IsolationConfig(enabled, defaults, services, copy, semaphoreAcquireTimeout);
    }

    /**
     * Semaphore 전체를 교체한 새 인스턴스 생성.
     */
    public IsolationConfig withSemaphores(Map<String, Integer> semaphores) {
        return new IsolationConfig(enabled, defaults, services, semaphores, semaphoreAcquireTimeout);
    }

    /**
     * semaphoreAcquireTimeout만 변경한 새 인스턴스 생성.
     */
    public IsolationConfig withSemaphoreAcquireTimeout(Duration semaphoreAcquireTimeout) {
        return new IsolationConfig(enabled, defaults, services, semaphores, semaphoreAcquireTimeout);
    }
}
