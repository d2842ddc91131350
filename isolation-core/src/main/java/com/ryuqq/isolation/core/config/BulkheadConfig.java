package com.ryuqq.isolation.core.config;

import java.time.Duration;

/**
 * Bulkhead 설정.
 *
 * <p>하나의 Bulkhead 인스턴스가 생성될 때 확정되며, 이후 해당 인스턴스에 대해서는 변경되지 않습니다.
 * 설정 변경은 {@link BulkheadConfigOverride}를 통해 이후 생성되는 인스턴스에만 반영됩니다.</p>
 *
 * <p><strong>용량 계산:</strong></p>
 * <ul>
 *   <li>maxConcurrent: 동시에 실행될 수 있는 작업 수</li>
 *   <li>maxQueueSize: 실행 슬롯을 기다리며 대기할 수 있는 작업 수</li>
 *   <li>totalCapacity = maxConcurrent + maxQueueSize (이를 넘는 제출은 즉시 거절)</li>
 * </ul>
 *
 * @param name Bulkhead 이름 (예: ai.claude, container.create)
 * @param maxConcurrent 최대 동시 실행 수 (0 이상)
 * @param maxQueueSize 최대 대기 큐 크기 (0 이상)
 * @param queueTimeout 큐 대기 최대 시간 (0 이상)
 * @author Isolation Team
 * @since 1.0.0
 */
public record BulkheadConfig(String name, int maxConcurrent, int maxQueueSize, Duration queueTimeout) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BulkheadConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (maxConcurrent < 0) {
            throw new IllegalArgumentException(
                "maxConcurrent cannot be negative (current: " + maxConcurrent + ")"
            );
        }
        if (maxQueueSize < 0) {
            throw new IllegalArgumentException(
                "maxQueueSize cannot be negative (current: " + maxQueueSize + ")"
            );
        }
        if (queueTimeout == null) {
            throw new IllegalArgumentException("queueTimeout cannot be null");
        }
        if (queueTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "queueTimeout cannot be negative (current: " + queueTimeout + ")"
            );
        }
    }

    /**
     * 실행 중 + 대기 중 작업 수의 상한.
     *
     * @return maxConcurrent + maxQueueSize
     */
    public int totalCapacity() {
        return maxConcurrent + maxQueueSize;
    }

    /**
     * maxConcurrent만 변경한 새 인스턴스 생성.
     */
    public BulkheadConfig withMaxConcurrent(int maxConcurrent) {
        return new BulkheadConfig(name, maxConcurrent, maxQueueSize, queueTimeout);
    }

    /**
     * maxQueueSize만 변경한 새 인스턴스 생성.
     */
    public BulkheadConfig withMaxQueueSize(int maxQueueSize) {
        return new BulkheadConfig(name, maxConcurrent, maxQueueSize, queueTimeout);
    }

    /**
     * queueTimeout만 변경한 새 인스턴스 생성.
     */
    public BulkheadConfig withQueueTimeout(Duration queueTimeout) {
        return new BulkheadConfig(name, maxConcurrent, maxQueueSize, queueTimeout);
    }
}
