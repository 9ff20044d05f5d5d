package com.ryuqq.broker.application.router;

import com.ryuqq.broker.core.exception.BrokerException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 라우터 예외 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class UnknownOperationExceptionTest {

    @Test
    void 요청된_연산_이름과_오류코드_보존() {
        // when
        UnknownOperationException exception = new UnknownOperationException("/delete");

        // then
        assertThat(exception).isInstanceOf(BrokerException.class);
        assertThat(exception.getOperation()).isEqualTo("/delete");
        assertThat(exception.getErrorCode()).isEqualTo("UNKNOWN_OPERATION");
        assertThat(exception.getMessage()).isEqualTo("Unknown operation: /delete");
    }

    @Test
    void null_연산_이름도_메시지에_표시() {
        assertThat(new UnknownOperationException(null).getMessage()).isEqualTo("Unknown operation: null");
    }
}
