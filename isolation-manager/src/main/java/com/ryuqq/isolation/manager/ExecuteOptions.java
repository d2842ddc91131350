package com.ryuqq.isolation.manager;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * {@link BulkheadManager#execute} 호출 옵션.
 *
 * @param semaphores Bulkhead 진입 전에 순서대로 획득할 전역 Semaphore 이름
 * @param semaphoreTimeout Semaphore별 획득 대기 시간 (null이면 {@code IsolationConfig.semaphoreAcquireTimeout} 사용)
 * @author Isolation Team
 * @since 1.0.0
 */
public record ExecuteOptions(List<String> semaphores, Duration semaphoreTimeout) {

    private static final ExecuteOptions NONE = new ExecuteOptions(List.of(), null);

    /**
     * Compact constructor (유효성 검증 및 방어적 복사).
     *
     * @throws IllegalArgumentException semaphore 이름이 비어 있거나 timeout이 음수인 경우
     */
    public ExecuteOptions {
        if (semaphores == null) {
            semaphores = List.of();
        }
        for (String semaphore : semaphores) {
            if (semaphore == null || semaphore.isBlank()) {
                throw new IllegalArgumentException("semaphore name cannot be null or blank");
            }
        }
        if (semaphoreTimeout != null && semaphoreTimeout.isNegative()) {
            throw new IllegalArgumentException("semaphoreTimeout cannot be negative (current: " + semaphoreTimeout + ")");
        }
        semaphores = List.copyOf(semaphores);
    }

    /**
     * Semaphore 없이 Bulkhead만 사용.
     */
    public static ExecuteOptions none() {
        return NONE;
    }

    /**
     * 지정된 순서대로 Semaphore를 획득하는 옵션.
     *
     * @param semaphores Semaphore 이름 (획득 순서)
     * @return ExecuteOptions
     */
    public static ExecuteOptions withSemaphores(String... semaphores) {
        return new ExecuteOptions(Arrays.asList(semaphores), null);
    }

    /**
     * semaphoreTimeout만 변경한 새 인스턴스 생성.
     */
    public ExecuteOptions withSemaphoreTimeout(Duration semaphoreTimeout) {
        return new ExecuteOptions(semaphores, semaphoreTimeout);
    }
}
