package com.ryuqq.isolation.manager;

import java.util.List;

/**
 * 격리 계층 상태 요약 (대시보드용 read-model).
 *
 * @param totalBulkheads 등록된 Bulkhead 수
 * @param totalSemaphores 등록된 Semaphore 수
 * @param saturated 포화 상태(다음 제출이 거절될 상태)인 Bulkhead 이름
 * @param queuedTasks 모든 Bulkhead의 대기 작업 합계
 * @param activeTasks 모든 Bulkhead의 실행 중 작업 합계
 * @author Isolation Team
 * @since 1.0.0
 */
public record HealthSummary(
    int totalBulkheads,
    int totalSemaphores,
    List<String> saturated,
    int queuedTasks,
    int activeTasks
) {

    public HealthSummary {
        saturated = List.copyOf(saturated);
    }

    /**
     * 포화된 Bulkhead가 없는지 확인.
     *
     * @return 포화된 Bulkhead가 없으면 true
     */
    public boolean isHealthy() {
        return saturated.isEmpty();
    }
}
