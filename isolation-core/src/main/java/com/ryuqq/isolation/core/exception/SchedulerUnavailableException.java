package com.ryuqq.isolation.core.exception;

/**
 * 타임아웃 타이머용 스케줄러가 종료되어 작업이나 획득 요청을 대기시킬 수 없는 경우.
 *
 * <p>대기가 필요한 시점에만 발생하며, 즉시 실행되거나 즉시 획득되는 요청에는 영향이 없습니다.
 * 이 예외가 전달될 때 작업은 호출되지 않았고 대기열에도 남지 않습니다.</p>
 *
 * @author Isolation Team
 * @since 1.0.0
 */
public class SchedulerUnavailableException extends IsolationException {

    public SchedulerUnavailableException(String resourceName, Throwable cause) {
        super(resourceName, "Timeout scheduler unavailable for " + resourceName, cause);
    }
}
