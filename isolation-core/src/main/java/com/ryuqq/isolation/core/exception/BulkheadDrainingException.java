package com.ryuqq.isolation.core.exception;

/**
 * Bulkhead가 drain 중이어서 작업이 거절된 경우.
 *
 * <p>drain 시점에 큐에 남아 있던 작업과 drain 진행 중 새로 제출된 작업에 전달됩니다.
 * 이 예외로 정착된 작업은 실행되지 않습니다.</p>
 *
 * @author Isolation Team
 * @since 1.0.0
 */
public class BulkheadDrainingException extends IsolationException {

    public BulkheadDrainingException(String bulkheadName) {
        super(bulkheadName, "Bulkhead " + bulkheadName + " is draining");
    }
}
