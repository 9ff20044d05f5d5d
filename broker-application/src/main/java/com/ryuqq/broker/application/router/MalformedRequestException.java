package com.ryuqq.broker.application.router;

import com.ryuqq.broker.core.exception.BrokerException;

/**
 * 요청 본문을 해석할 수 없거나 필수 필드가 누락된 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MalformedRequestException extends BrokerException {

    public static final String ERROR_CODE = "MALFORMED_REQUEST";

    public MalformedRequestException(String message) {
        super(ERROR_CODE, message);
    }

    public MalformedRequestException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
