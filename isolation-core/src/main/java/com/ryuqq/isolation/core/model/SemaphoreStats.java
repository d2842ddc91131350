package com.ryuqq.isolation.core.model;

/**
 * Semaphore 통계 스냅샷.
 *
 * @param name Semaphore 이름
 * @param totalPermits 전체 Permit 수
 * @param availablePermits 현재 사용 가능한 Permit 수
 * @param waitingCount 현재 대기 중인 획득 요청 수
 * @param totalAcquired 누적 획득 수
 * @param totalReleased 누적 반환 수
 * @param totalTimeout 누적 획득 타임아웃 수
 * @author Isolation Team
 * @since 1.0.0
 */
public record SemaphoreStats(
    String name,
    int totalPermits,
    int availablePermits,
    int waitingCount,
    long totalAcquired,
    long totalReleased,
    long totalTimeout
) {
}
