package com.ryuqq.isolation.core.exception;

import java.time.Duration;

/**
 * Semaphore Permit 획득이 지정된 대기 시간 안에 이루어지지 않은 경우.
 *
 * @author Isolation Team
 * @since 1.0.0
 */
public class SemaphoreTimeoutException extends IsolationException {

    private final Duration timeout;

    public SemaphoreTimeoutException(String semaphoreName, Duration timeout) {
        super(semaphoreName, "Semaphore " + semaphoreName
            + " acquisition timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
