package com.ryuqq.isolation.core.exception;

/**
 * Bulkhead의 실행 슬롯과 대기 큐가 모두 가득 차 작업이 즉시 거절된 경우.
 *
 * <p>이 예외가 전달될 때 작업은 호출되지 않았으며 대기도 발생하지 않았습니다.</p>
 *
 * @author Isolation Team
 * @since 1.0.0
 */
public class QueueFullException extends IsolationException {

    public QueueFullException(String bulkheadName, int maxConcurrent, int maxQueueSize) {
        super(bulkheadName, String.format("Bulkhead %s queue is full (maxConcurrent=%d, maxQueueSize=%d)",
            bulkheadName, maxConcurrent, maxQueueSize));
    }
}
