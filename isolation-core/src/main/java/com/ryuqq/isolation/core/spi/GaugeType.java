package com.ryuqq.isolation.core.spi;

/**
 * {@link MetricsSink#gauge(String, GaugeType, long)}로 전달되는 gauge 종류.
 *
 * @author Isolation Team
 * @since 1.0.0
 */
public enum GaugeType {
    ACTIVE_COUNT,
    QUEUED_COUNT,
    AVAILABLE_PERMITS
}
