package com.ryuqq.isolation.core.exception;

import java.time.Duration;

/**
 * 큐에 대기 중인 작업이 슬롯을 할당받기 전에 queueTimeout을 초과한 경우.
 *
 * <p>타임아웃으로 정착된 작업은 이후 절대 실행되지 않습니다.</p>
 *
 * @author Isolation Team
 * @since 1.0.0
 */
public class QueueTimeoutException extends IsolationException {

    private final Duration queueTimeout;

    public QueueTimeoutException(String bulkheadName, Duration queueTimeout) {
        super(bulkheadName, "Task timed out in bulkhead " + bulkheadName
            + " queue after " + queueTimeout.toMillis() + "ms");
        this.queueTimeout = queueTimeout;
    }

    public Duration getQueueTimeout() {
        return queueTimeout;
    }
}
