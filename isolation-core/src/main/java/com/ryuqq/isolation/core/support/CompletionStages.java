package com.ryuqq.isolation.core.support;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * 비동기 작업 호출 보조 유틸리티.
 *
 * @author Isolation Team
 * @since 1.0.0
 */
public final class CompletionStages {

    private CompletionStages() {
    }

    /**
     * 작업 Supplier 호출.
     *
     * <p>Supplier가 예외를 던지거나 null을 반환해도 호출자에게 예외를 던지지 않고
     * 실패한 stage로 변환합니다. 어떤 경우든 반환된 stage는 언젠가 정착되므로
     * 슬롯과 Permit 반환 경로가 항상 실행됩니다.</p>
     *
     * @param task 작업
     * @param <T> 결과 타입
     * @return 작업이 반환한 stage 또는 실패한 stage
     */
    public static <T> CompletionStage<T> invoke(Supplier<? extends CompletionStage<T>> task) {
        try {
            CompletionStage<T> stage = task.get();
            if (stage == null) {
                return CompletableFuture.failedFuture(new NullPointerException("task returned null CompletionStage"));
            }
            return stage;
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    /**
     * {@link CompletionException} 래핑 제거.
     *
     * <p>작업의 원래 예외를 호출자에게 그대로 전달하기 위해 사용합니다.</p>
     *
     * @param error stage 실패 원인
     * @return 원래 예외
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
