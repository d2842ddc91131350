package com.ryuqq.isolation.core.spi.noop;

import com.ryuqq.isolation.core.spi.CounterEvent;
import com.ryuqq.isolation.core.spi.GaugeType;
import com.ryuqq.isolation.core.spi.HistogramType;
import com.ryuqq.isolation.core.spi.MetricsSink;

/**
 * MetricsSink NoOp 구현.
 *
 * <p>메트릭을 어디에도 기록하지 않습니다.
 * 메트릭 시스템이 연결되지 않은 환경이나 테스트에서 기본값으로 사용됩니다.</p>
 *
 * @author Isolation Team
 * @since 1.0.0
 */
public final class NoOpMetricsSink implements MetricsSink {

    public static final NoOpMetricsSink INSTANCE = new NoOpMetricsSink();

    @Override
    public void counter(String resourceName, CounterEvent event) {
        // NoOp
    }

    @Override
    public void gauge(String resourceName, GaugeType gauge, long value) {
        // NoOp
    }

    @Override
    public void histogram(String resourceName, HistogramType histogram, long valueMs) {
        // NoOp
    }
}
