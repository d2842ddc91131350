package com.ryuqq.isolation.core.spi;

import com.ryuqq.isolation.core.spi.noop.NoOpMetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 예외를 외부로 전파하지 않는 {@link MetricsSink} 데코레이터.
 *
 * <p>위임 대상이 던진 예외는 ERROR 로그로 남기고 무시합니다.
 * 메트릭 전송 실패가 작업 정착 경로를 깨뜨리지 않게 하기 위함입니다.</p>
 *
 * @author Isolation Team
 * @since 1.0.0
 */
public final class GuardedMetricsSink implements MetricsSink {

    private static final Logger log = LoggerFactory.getLogger(GuardedMetricsSink.class);

    private final MetricsSink delegate;

    private GuardedMetricsSink(MetricsSink delegate) {
        this.delegate = delegate;
    }

    /**
     * 주어진 sink를 감쌈.
     *
     * <p>null이면 {@link NoOpMetricsSink}, 이미 감싸진 sink면 그대로 반환합니다.</p>
     *
     * @param delegate 위임 대상
     * @return 예외를 삼키는 sink
     */
    public static MetricsSink wrap(MetricsSink delegate) {
        if (delegate == null) {
            return new GuardedMetricsSink(NoOpMetricsSink.INSTANCE);
        }
        if (delegate instanceof GuardedMetricsSink) {
            return delegate;
        }
        return new GuardedMetricsSink(delegate);
    }

    @Override
    public void counter(String resourceName, CounterEvent event) {
        try {
            delegate.counter(resourceName, event);
        } catch (RuntimeException e) {
            log.error("Failed to emit counter {} for {}", event, resourceName, e);
        }
    }

    @Override
    public void gauge(String resourceName, GaugeType gauge, long value) {
        try {
            delegate.gauge(resourceName, gauge, value);
        } catch (RuntimeException e) {
            log.error("Failed to emit gauge {}={} for {}", gauge, value, resourceName, e);
        }
    }

    @Override
    public void histogram(String resourceName, HistogramType histogram, long valueMs) {
        try {
            delegate.histogram(resourceName, histogram, valueMs);
        } catch (RuntimeException e) {
            log.error("Failed to emit histogram {}={}ms for {}", histogram, valueMs, resourceName, e);
        }
    }
}
