package com.ryuqq.isolation.core.config;

import java.util.Map;

/**
 * 서비스 이름으로 Bulkhead 설정을 결정하는 prefix 매칭 테이블.
 *
 * <p><strong>해석 순서 (뒤로 갈수록 우선):</strong></p>
 * <ol>
 *   <li>기본값 ({@link IsolationConfig#defaults()})</li>
 *   <li>가장 긴 namespace prefix override (키가 {@code .}으로 끝남, 예: {@code ai.}, {@code container.})</li>
 *   <li>정확히 일치하는 이름의 override (예: {@code ai.deepseek})</li>
 * </ol>
 *
 * <p>각 단계의 override는 부분 설정이므로 지정된 필드만 덮어씁니다.
 * 해석은 Bulkhead 생성 시 한 번만 수행되며, 호출마다 다시 수행되지 않습니다.</p>
 *
 * @author Isolation Team
 * @since 1.0.0
 */
public final class BulkheadConfigResolver {

    private BulkheadConfigResolver() {
    }

    /**
     * 서비스 이름에 대한 최종 설정 결정.
     *
     * @param name 서비스 이름
     * @param defaults 모든 필드가 지정된 기본 설정
     * @param overrides 이름 또는 prefix별 override 테이블
     * @return 최종 BulkheadConfig
     * @throws IllegalArgumentException name이 비어 있거나 defaults가 불완전한 경우
     */
    public static BulkheadConfig resolve(String name,
                                         BulkheadConfigOverride defaults,
                                         Map<String, BulkheadConfigOverride> overrides) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (defaults == null || !defaults.isComplete()) {
            throw new IllegalArgumentException("defaults must specify every field");
        }

        BulkheadConfigOverride resolved = defaults;

        String prefix = longestPrefix(name, overrides);
        if (prefix != null) {
            resolved = resolved.merge(overrides.get(prefix));
        }

        BulkheadConfigOverride exact = overrides.get(name);
        if (exact != null && !name.equals(prefix)) {
            resolved = resolved.merge(exact);
        }

        return resolved.toConfig(name);
    }

    /**
     * 이름에 매칭되는 가장 긴 namespace prefix 키 조회.
     *
     * @return prefix 키, 없으면 null
     */
    static String longestPrefix(String name, Map<String, BulkheadConfigOverride> overrides) {
        String best = null;
        for (String key : overrides.keySet()) {
            if (isNamespacePrefix(key) && name.startsWith(key)
                && (best == null || key.length() > best.length())) {
                best = key;
            }
        }
        return best;
    }

    /**
     * namespace prefix 키 여부 ({@code .}으로 끝나는 키).
     */
    public static boolean isNamespacePrefix(String key) {
        return key.endsWith(".");
    }
}
