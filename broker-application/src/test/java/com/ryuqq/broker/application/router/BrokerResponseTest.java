package com.ryuqq.broker.application.router;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BrokerResponse 기본값 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class BrokerResponseTest {

    @Test
    void null_필드는_기본값으로_치환() {
        // when
        BrokerResponse response = new BrokerResponse(null, null, null, null);

        // then
        assertThat(response.data()).isEmpty();
        assertThat(response.message()).isEmpty();
        assertThat(response.error()).isEmpty();
        assertThat(response.messageId()).isEmpty();
        assertThat(response.hasError()).isFalse();
    }

    @Test
    void ofError_오류_응답() {
        BrokerResponse response = BrokerResponse.ofError("boom");

        assertThat(response.hasError()).isTrue();
        assertThat(response.error()).isEqualTo("boom");
        assertThat(response.message()).isEmpty();
    }

    @Test
    void withMessageId_나머지_필드_유지() {
        BrokerResponse response = BrokerResponse.ofData(Map.of("id", 1)).withMessageId("m1");

        assertThat(response.data()).containsEntry("id", 1);
        assertThat(response.messageId()).isEqualTo("m1");
    }

    @Test
    void data는_수정_불가() {
        BrokerResponse response = BrokerResponse.ofData(Map.of("id", 1));

        assertThatThrownBy(() -> response.data().put("x", 2))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
