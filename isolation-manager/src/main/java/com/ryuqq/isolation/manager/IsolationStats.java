package com.ryuqq.isolation.manager;

import com.ryuqq.isolation.core.model.BulkheadStats;
import com.ryuqq.isolation.core.model.SemaphoreStats;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 등록된 모든 Bulkhead와 Semaphore의 통계.
 *
 * <p>각 인스턴스별 스냅샷은 개별적으로 일관되며, 이름순으로 정렬됩니다.</p>
 *
 * @param bulkheads Bulkhead 이름 → 통계
 * @param semaphores Semaphore 이름 → 통계
 * @author Isolation Team
 * @since 1.0.0
 */
public record IsolationStats(Map<String, BulkheadStats> bulkheads, Map<String, SemaphoreStats> semaphores) {

    public IsolationStats {
        bulkheads = Collections.unmodifiableMap(new TreeMap<>(bulkheads));
        semaphores = Collections.unmodifiableMap(new TreeMap<>(semaphores));
    }
}
