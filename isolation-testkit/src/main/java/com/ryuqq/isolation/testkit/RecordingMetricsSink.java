package com.ryuqq.isolation.testkit;

import com.ryuqq.isolation.core.spi.CounterEvent;
import com.ryuqq.isolation.core.spi.GaugeType;
import com.ryuqq.isolation.core.spi.HistogramType;
import com.ryuqq.isolation.core.spi.MetricsSink;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 전달받은 메트릭을 메모리에 기록하는 {@link MetricsSink} 구현.
 *
 * <p>테스트에서 카운터, 마지막 gauge 값, histogram 관측값을 검증할 때 사용합니다.
 * 모든 메서드는 thread-safe 합니다.</p>
 *
 * <pre>{@code
 * RecordingMetricsSink metrics = new RecordingMetricsSink();
 * Bulkhead bulkhead = new Bulkhead(config, scheduler, metrics);
 * ...
 * assertEquals(1, metrics.count("ai.claude", CounterEvent.REJECTED));
 * }</pre>
 *
 * @author Isolation Team
 * @since 1.0.0
 */
public class RecordingMetricsSink implements MetricsSink {

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final Map<String, Long> gauges = new ConcurrentHashMap<>();
    private final Map<String, List<Long>> histograms = new ConcurrentHashMap<>();

    @Override
    public void counter(String resourceName, CounterEvent event) {
        counters.computeIfAbsent(key(resourceName, event), k -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public void gauge(String resourceName, GaugeType gauge, long value) {
        gauges.put(key(resourceName, gauge), value);
    }

    @Override
    public void histogram(String resourceName, HistogramType histogram, long valueMs) {
        histograms.computeIfAbsent(key(resourceName, histogram), k -> new CopyOnWriteArrayList<>()).add(valueMs);
    }

    /**
     * 카운터 누적값 조회.
     *
     * @return 기록된 적 없으면 0
     */
    public long count(String resourceName, CounterEvent event) {
        AtomicLong counter = counters.get(key(resourceName, event));
        return counter == null ? 0 : counter.get();
    }

    /**
     * 마지막 gauge 값 조회.
     *
     * @return 기록된 적 없으면 null
     */
    public Long lastGauge(String resourceName, GaugeType gauge) {
        return gauges.get(key(resourceName, gauge));
    }

    /**
     * histogram 관측값 전체 조회.
     *
     * @return 기록 순서대로의 관측값 (없으면 빈 목록)
     */
    public List<Long> observations(String resourceName, HistogramType histogram) {
        List<Long> values = histograms.get(key(resourceName, histogram));
        return values == null ? List.of() : List.copyOf(values);
    }

    /**
     * 기록된 모든 메트릭 제거.
     */
    public void clear() {
        counters.clear();
        gauges.clear();
        histograms.clear();
    }

    private static String key(String resourceName, Enum<?> type) {
        return resourceName + "#" + type.name();
    }
}
