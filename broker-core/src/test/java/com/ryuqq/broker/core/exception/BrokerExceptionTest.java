package com.ryuqq.broker.core.exception;

import com.ryuqq.broker.core.model.ChannelName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Broker 예외 분류 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class BrokerExceptionTest {

    @Test
    void channelNotFound_메시지와_오류코드() {
        // when
        ChannelNotFoundException exception = new ChannelNotFoundException(ChannelName.of("orders"));

        // then
        assertThat(exception).isInstanceOf(BrokerException.class);
        assertThat(exception.getErrorCode()).isEqualTo("CHANNEL_NOT_FOUND");
        assertThat(exception.getMessage()).isEqualTo("Channel orders does not exist");
        assertThat(exception.getChannel()).isEqualTo(ChannelName.of("orders"));
    }

    @Test
    void channelAlreadyExists_메시지와_오류코드() {
        // when
        ChannelAlreadyExistsException exception = new ChannelAlreadyExistsException(ChannelName.of("orders"));

        // then
        assertThat(exception).isInstanceOf(BrokerException.class);
        assertThat(exception.getErrorCode()).isEqualTo("ALREADY_EXISTS");
        assertThat(exception.getMessage()).isEqualTo("Channel orders already exists");
        assertThat(exception.getChannel()).isEqualTo(ChannelName.of("orders"));
    }
}
