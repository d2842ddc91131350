package com.ryuqq.isolation.core.model;

/**
 * Bulkhead 통계 스냅샷.
 *
 * <p>Bulkhead 내부 lock 안에서 한 번에 캡처되므로 필드 간 값이 서로 일관됩니다.</p>
 *
 * @param name Bulkhead 이름
 * @param activeCount 현재 실행 중인 작업 수
 * @param queuedCount 현재 대기 중인 작업 수
 * @param maxConcurrent 최대 동시 실행 수
 * @param maxQueueSize 최대 대기 큐 크기
 * @param totalExecuted 완료된 작업 수 (성공 + 작업 실패)
 * @param totalRejected 큐가 가득 차 거절된 작업 수
 * @param totalTimeout 큐 대기 시간 초과 작업 수
 * @param averageExecutionTimeMs 평균 실행 시간 (밀리초)
 * @param averageWaitTimeMs 큐를 거쳐 실행된 작업의 평균 대기 시간 (밀리초)
 * @author Isolation Team
 * @since 1.0.0
 */
public record BulkheadStats(
    String name,
    int activeCount,
    int queuedCount,
    int maxConcurrent,
    int maxQueueSize,
    long totalExecuted,
    long totalRejected,
    long totalTimeout,
    double averageExecutionTimeMs,
    double averageWaitTimeMs
) {

    /**
     * 포화 상태 여부.
     *
     * <p>실행 중 + 대기 중 작업 수가 전체 용량에 도달하면 다음 제출은 거절됩니다.</p>
     *
     * @return activeCount + queuedCount가 maxConcurrent + maxQueueSize에 도달했으면 true
     */
    public boolean isSaturated() {
        return activeCount + queuedCount >= maxConcurrent + maxQueueSize;
    }
}
