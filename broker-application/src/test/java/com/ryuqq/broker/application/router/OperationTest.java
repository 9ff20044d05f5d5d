package com.ryuqq.broker.application.router;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Operation 이름 해석 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OperationTest {

    @ParameterizedTest
    @CsvSource({
        "register, REGISTER",
        "send, PUBLISH",
        "publish, PUBLISH",
        "read, CONSUME",
        "consume, CONSUME",
        "confirm, ACKNOWLEDGE",
        "acknowledge, ACKNOWLEDGE",
        "purge, PURGE",
        "stats, STATS"
    })
    void 이름으로_연산_해석(String name, Operation expected) {
        assertThat(Operation.resolve(name)).contains(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"/send", "SEND", "/Send", " send "})
    void 앞쪽_슬래시와_대소문자_무시(String name) {
        assertThat(Operation.resolve(name)).contains(Operation.PUBLISH);
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "/", "delete", "//send", "send/", "sends"})
    void 알_수_없는_이름은_empty(String name) {
        assertThat(Operation.resolve(name)).isEmpty();
    }

    @Test
    void 모든_연산은_첫_번째_alias로_해석() {
        for (Operation operation : Operation.values()) {
            assertThat(Operation.resolve(operation.aliases().get(0))).contains(operation);
        }
    }
}
