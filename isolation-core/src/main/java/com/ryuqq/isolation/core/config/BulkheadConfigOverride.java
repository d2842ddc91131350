package com.ryuqq.isolation.core.config;

import java.time.Duration;

/**
 * 부분 Bulkhead 설정.
 *
 * <p>null 필드는 "지정하지 않음"을 뜻하며, 상위 설정(namespace prefix 또는 기본값)의 값을 그대로 사용합니다.</p>
 *
 * <pre>{@code
 * BulkheadConfigOverride override = BulkheadConfigOverride.empty()
 *     .withMaxConcurrent(50)
 *     .withMaxQueueSize(200);
 * }</pre>
 *
 * @param maxConcurrent 최대 동시 실행 수 (null 허용)
 * @param maxQueueSize 최대 대기 큐 크기 (null 허용)
 * @param queueTimeout 큐 대기 최대 시간 (null 허용)
 * @author Isolation Team
 * @since 1.0.0
 */
public record BulkheadConfigOverride(Integer maxConcurrent, Integer maxQueueSize, Duration queueTimeout) {

    private static final BulkheadConfigOverride EMPTY = new BulkheadConfigOverride(null, null, null);

    /**
     * Compact constructor (지정된 값만 검증).
     *
     * @throws IllegalArgumentException 음수 값이 지정된 경우
     */
    public BulkheadConfigOverride {
        if (maxConcurrent != null && maxConcurrent < 0) {
            throw new IllegalArgumentException(
                "maxConcurrent cannot be negative (current: " + maxConcurrent + ")"
            );
        }
        if (maxQueueSize != null && maxQueueSize < 0) {
            throw new IllegalArgumentException(
                "maxQueueSize cannot be negative (current: " + maxQueueSize + ")"
            );
        }
        if (queueTimeout != null && queueTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "queueTimeout cannot be negative (current: " + queueTimeout + ")"
            );
        }
    }

    /**
     * 아무 값도 지정하지 않은 override.
     *
     * @return 빈 override
     */
    public static BulkheadConfigOverride empty() {
        return EMPTY;
    }

    /**
     * 모든 값을 지정한 override 생성.
     *
     * @param maxConcurrent 최대 동시 실행 수
     * @param maxQueueSize 최대 대기 큐 크기
     * @param queueTimeout 큐 대기 최대 시간
     * @return override
     */
    public static BulkheadConfigOverride of(int maxConcurrent, int maxQueueSize, Duration queueTimeout) {
        return new BulkheadConfigOverride(maxConcurrent, maxQueueSize, queueTimeout);
    }

    public BulkheadConfigOverride withMaxConcurrent(int maxConcurrent) {
        return new BulkheadConfigOverride(maxConcurrent, maxQueueSize, queueTimeout);
    }

    public BulkheadConfigOverride withMaxQueueSize(int maxQueueSize) {
        return new BulkheadConfigOverride(maxConcurrent, maxQueueSize, queueTimeout);
    }

    public BulkheadConfigOverride withQueueTimeout(Duration queueTimeout) {
        return new BulkheadConfigOverride(maxConcurrent, maxQueueSize, queueTimeout);
    }

    /**
     * 모든 필드가 지정되었는지 확인.
     *
     * @return 세 필드 모두 non-null이면 true
     */
    public boolean isComplete() {
        return maxConcurrent != null && maxQueueSize != null && queueTimeout != null;
    }

    /**
     * 다른 override를 위에 덮어씀.
     *
     * <p>{@code other}에 지정된 필드가 우선하며, 지정되지 않은 필드는 현재 값을 유지합니다.</p>
     *
     * @param other 덮어쓸 override (null이면 현재 인스턴스 반환)
     * @return 병합된 override
     */
    public BulkheadConfigOverride merge(BulkheadConfigOverride other) {
        if (other == null) {
            return this;
        }
        return new BulkheadConfigOverride(
            other.maxConcurrent != null ? other.maxConcurrent : maxConcurrent,
            other.maxQueueSize != null ? other.maxQueueSize : maxQueueSize,
            other.queueTimeout != null ? other.queueTimeout : queueTimeout
        );
    }

    /**
     * 지정된 이름으로 완전한 {@link BulkheadConfig} 생성.
     *
     * @param name Bulkhead 이름
     * @return BulkheadConfig
     * @throws IllegalStateException 지정되지 않은 필드가 있는 경우
     */
    public BulkheadConfig toConfig(String name) {
        if (!isComplete()) {
            throw new IllegalStateException("Incomplete bulkhead configuration for " + name + ": " + this);
        }
        return new BulkheadConfig(name, maxConcurrent, maxQueueSize, queueTimeout);
    }
}
