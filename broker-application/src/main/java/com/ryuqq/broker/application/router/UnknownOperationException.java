package com.ryuqq.broker.application.router;

import com.ryuqq.broker.core.exception.BrokerException;

/**
 * 라우터가 알지 못하는 연산 이름으로 요청한 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class UnknownOperationException extends BrokerException {

    public static final String ERROR_CODE = "UNKNOWN_OPERATION";

    private final String operation;

    /**
     * 생성자.
     *
     * @param operation 요청된 연산 이름 (null 허용)
     */
    public UnknownOperationException(String operation) {
        super(ERROR_CODE, "Unknown operation: " + operation);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
