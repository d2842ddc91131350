package com.ryuqq.isolation.core.exception;

/**
 * 격리 계층이 작업을 정착(settle)시키며 전달하는 예외의 공통 상위 타입.
 *
 * <p>모든 하위 예외는 어떤 Bulkhead 또는 Semaphore에서 발생했는지 식별할 수 있도록
 * 리소스 이름을 함께 보관합니다.</p>
 *
 * <p><strong>예외 분류:</strong></p>
 * <ul>
 *   <li>{@link QueueFullException}: 큐가 가득 차 즉시 거절됨</li>
 *   <li>{@link QueueTimeoutException}: 큐 대기 시간 초과</li>
 *   <li>{@link SemaphoreTimeoutException}: Permit 획득 대기 시간 초과</li>
 *   <li>{@link BulkheadDrainingException}: Bulkhead가 drain 중이어서 거절됨</li>
 *   <li>{@link SchedulerUnavailableException}: 타임아웃 타이머를 등록할 수 없어 대기시키지 못함</li>
 * </ul>
 *
 * <p>작업 자체가 실패한 경우(TaskFailure)는 이 계층이 감싸지 않고 원래 예외를 그대로 전달합니다.
 * 이 계층은 재시도를 수행하지 않습니다.</p>
 *
 * @author Isolation Team
 * @since 1.0.0
 */
public abstract class IsolationException extends RuntimeException {

    private final String resourceName;

    /**
     * 생성자.
     *
     * @param resourceName Bulkhead 또는 Semaphore 이름
     * @param message 오류 메시지
     */
    protected IsolationException(String resourceName, String message) {
        super(message);
        this.resourceName = resourceName;
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param resourceName Bulkhead 또는 Semaphore 이름
     * @param message 오류 메시지
     * @param cause 원인 예외
     */
    protected IsolationException(String resourceName, String message, Throwable cause) {
        super(message, cause);
        this.resourceName = resourceName;
    }

    /**
     * 예외가 발생한 리소스 이름 조회.
     *
     * @return Bulkhead 또는 Semaphore 이름
     */
    public String getResourceName() {
        return resourceName;
    }
}
