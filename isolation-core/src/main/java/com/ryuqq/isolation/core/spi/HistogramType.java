package com.ryuqq.isolation.core.spi;

/**
 * {@link MetricsSink#histogram(String, HistogramType, long)}로 전달되는 관측값 종류.
 *
 * @author Isolation Team
 * @since 1.0.0
 */
public enum HistogramType {
    EXECUTION_TIME,
    WAIT_TIME
}
