package com.ryuqq.isolation.core.spi;

/**
 * {@link MetricsSink#counter(String, CounterEvent)}로 전달되는 이벤트 종류.
 *
 * @author Isolation Team
 * @since 1.0.0
 */
public enum CounterEvent {
    EXECUTED,
    FAILED,
    REJECTED,
    TIMEOUT,
    ACQUIRED,
    RELEASED
}
