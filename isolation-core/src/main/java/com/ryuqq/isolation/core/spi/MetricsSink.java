package com.ryuqq.isolation.core.spi;

/**
 * Metrics Sink SPI.
 *
 * <p>Bulkhead와 Semaphore가 상태 변화를 외부 메트릭 시스템(APM, Micrometer 등)으로 내보내는 확장점입니다.</p>
 *
 * <p><strong>전달 정보:</strong></p>
 * <ul>
 *   <li>counter: (리소스 이름, 이벤트) 단위 증가</li>
 *   <li>gauge: activeCount, queuedCount, availablePermits 현재값</li>
 *   <li>histogram: 실행 시간, 대기 시간 (밀리초)</li>
 * </ul>
 *
 * <p><strong>주의:</strong> 구현체가 예외를 던지더라도 작업 실행과 정착에는 영향을 주지 않습니다.
 * 호출 측은 {@link GuardedMetricsSink}로 감싸 예외를 로그로만 남깁니다.</p>
 *
 * <p>호출은 여러 스레드에서 동시에 일어날 수 있으므로 구현체는 thread-safe 해야 합니다.</p>
 *
 * @author Isolation Team
 * @since 1.0.0
 * @see com.ryuqq.isolation.core.spi.noop.NoOpMetricsSink
 */
public interface MetricsSink {

    /**
     * 카운터 1 증가.
     *
     * @param resourceName Bulkhead 또는 Semaphore 이름
     * @param event 이벤트 종류
     */
    void counter(String resourceName, CounterEvent event);

    /**
     * gauge 값 갱신.
     *
     * @param resourceName Bulkhead 또는 Semaphore 이름
     * @param gauge gauge 종류
     * @param value 현재값
     */
    void gauge(String resourceName, GaugeType gauge, long value);

    /**
     * histogram 관측값 기록.
     *
     * @param resourceName Bulkhead 이름
     * @param histogram 관측 종류
     * @param valueMs 관측값 (밀리초)
     */
    void histogram(String resourceName, HistogramType histogram, long valueMs);
}
