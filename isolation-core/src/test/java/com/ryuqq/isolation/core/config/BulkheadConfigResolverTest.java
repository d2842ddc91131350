package com.ryuqq.isolation.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BulkheadConfigResolver 테스트.
 *
 * @author Isolation Team
 * @since 1.0.0
 */
@DisplayName("BulkheadConfigResolver 테스트")
class BulkheadConfigResolverTest {

    private static final BulkheadConfigOverride DEFAULTS = BulkheadConfigOverride.of(10, 50, Duration.ofSeconds(30));

    @Test
    @DisplayName("매칭되는 override가 없으면 기본값을 사용한다")
    void 기본값_사용() {
        BulkheadConfig config = BulkheadConfigResolver.resolve("payment.charge", DEFAULTS, Map.of());

        assertThat(config).isEqualTo(new BulkheadConfig("payment.charge", 10, 50, Duration.ofSeconds(30)));
    }

    @Test
    @DisplayName("가장 긴 namespace prefix가 적용되고 정확한 이름 override가 그 위에 덮인다")
    void prefix_후_정확한_이름() {
        // given
        Map<String, BulkheadConfigOverride> overrides = new LinkedHashMap<>();
        overrides.put("ai.", BulkheadConfigOverride.of(20, 100, Duration.ofSeconds(60)));
        overrides.put("ai.vision.", BulkheadConfigOverride.empty().withMaxConcurrent(4));
        overrides.put("ai.vision.ocr", BulkheadConfigOverride.empty().withQueueTimeout(Duration.ofSeconds(5)));

        // when
        BulkheadConfig claude = BulkheadConfigResolver.resolve("ai.claude", DEFAULTS, overrides);
        BulkheadConfig ocr = BulkheadConfigResolver.resolve("ai.vision.ocr", DEFAULTS, overrides);

        // then
        assertThat(claude).isEqualTo(new BulkheadConfig("ai.claude", 20, 100, Duration.ofSeconds(60)));
        // ai.vision. prefix는 maxConcurrent만 지정하므로 나머지는 기본값
        assertThat(ocr).isEqualTo(new BulkheadConfig("ai.vision.ocr", 4, 50, Duration.ofSeconds(5)));
    }

    @Test
    @DisplayName("점으로 끝나지 않는 키는 prefix로 취급하지 않는다")
    void 점_없는_키는_prefix_아님() {
        Map<String, BulkheadConfigOverride> overrides = Map.of(
            "ai", BulkheadConfigOverride.of(1, 1, Duration.ofSeconds(1)));

        BulkheadConfig config = BulkheadConfigResolver.resolve("ai.claude", DEFAULTS, overrides);

        assertThat(config.maxConcurrent()).isEqualTo(10);
        assertThat(BulkheadConfigResolver.isNamespacePrefix("ai.")).isTrue();
        assertThat(BulkheadConfigResolver.isNamespacePrefix("ai")).isFalse();
    }

    @Test
    @DisplayName("기본 설정의 namespace와 서비스별 값이 해석된다")
    void 기본_설정_해석() {
        IsolationConfig standard = IsolationConfig.standard();

        BulkheadConfig deepseek = BulkheadConfigResolver.resolve("ai.deepseek", standard.defaults(), standard.services());
        BulkheadConfig containerCreate = BulkheadConfigResolver.resolve("container.create", standard.defaults(), standard.services());

        assertThat(deepseek).isEqualTo(new BulkheadConfig("ai.deepseek", 10, 50, Duration.ofSeconds(90)));
        assertThat(containerCreate).isEqualTo(new BulkheadConfig("container.create", 5, 20, Duration.ofSeconds(120)));
    }

    @Test
    @DisplayName("불완전한 기본값이나 빈 이름은 IllegalArgumentException")
    void 인자_검증() {
        assertThatThrownBy(() -> BulkheadConfigResolver.resolve(" ", DEFAULTS, Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BulkheadConfigResolver.resolve("svc", BulkheadConfigOverride.empty(), Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
