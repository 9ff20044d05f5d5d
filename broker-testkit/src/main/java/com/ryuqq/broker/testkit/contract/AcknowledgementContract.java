package com.ryuqq.broker.testkit.contract;

import com.ryuqq.broker.core.exception.ChannelNotFoundException;
import com.ryuqq.broker.core.model.Message;
import com.ryuqq.broker.core.model.MessageId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract: acknowledge.
 *
 * <ul>
 *   <li>Acknowledging a consumed message succeeds exactly once</li>
 *   <li>Acknowledging an unknown or never-delivered id is a no-op reporting not found</li>
 *   <li>Acknowledge only touches the addressed channel</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AcknowledgementContract extends AbstractContractTest {

    @BeforeEach
    void registerChannels() {
        registry.register(ORDERS);
        registry.register(PAYMENTS);
    }

    @Test
    void acknowledge_ConsumedMessage_SucceedsOnce() {
        // Given
        publishNumbered(ORDERS, 1);
        Message message = consumeDelivered(ORDERS);

        // When
        boolean first = registry.acknowledge(ORDERS, message.id());
        boolean second = registry.acknowledge(ORDERS, message.id());

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(registry.stateOf(ORDERS, message.id())).isEmpty();
        assertStats(ORDERS, 0, 0);
    }

    @Test
    void acknowledge_ReadyMessage_ReportsNotFoundAndKeepsMessage() {
        // Given
        MessageId id = publishNumbered(ORDERS, 1);

        // When
        boolean acknowledged = registry.acknowledge(ORDERS, id);

        // Then
        assertThat(acknowledged).isFalse();
        assertStats(ORDERS, 1, 0);
        assertThat(consumeDelivered(ORDERS).id()).isEqualTo(id);
    }

    @Test
    void acknowledge_UnknownId_ReportsNotFound() {
        // Given
        publishNumbered(ORDERS, 1);
        consumeDelivered(ORDERS);

        // When
        boolean acknowledged = registry.acknowledge(ORDERS, MessageId.of("never-published"));

        // Then
        assertThat(acknowledged).isFalse();
        assertStats(ORDERS, 0, 1);
    }

    @Test
    void acknowledge_IdFromOtherChannel_ReportsNotFound() {
        // Given
        publishNumbered(ORDERS, 1);
        Message message = consumeDelivered(ORDERS);

        // When
        boolean acknowledged = registry.acknowledge(PAYMENTS, message.id());

        // Then
        assertThat(acknowledged).isFalse();
        assertStats(ORDERS, 0, 1);
    }

    @Test
    void acknowledge_OutOfDeliveryOrder_RemovesOnlyAddressedMessage() {
        // Given
        publishNumbered(ORDERS, 1);
        publishNumbered(ORDERS, 2);
        Message first = consumeDelivered(ORDERS);
        Message second = consumeDelivered(ORDERS);

        // When
        boolean acknowledged = registry.acknowledge(ORDERS, second.id());

        // Then
        assertThat(acknowledged).isTrue();
        assertStats(ORDERS, 0, 1);
        assertThat(registry.acknowledge(ORDERS, first.id())).isTrue();
        assertStats(ORDERS, 0, 0);
    }

    @Test
    void acknowledge_MissingChannel_FailsWithChannelNotFound() {
        assertThatThrownBy(() -> registry.acknowledge(MISSING, MessageId.of("m1")))
            .isInstanceOf(ChannelNotFoundException.class);
    }

    @Test
    void acknowledge_NullMessageId_ThrowsIllegalArgument() {
        assertThatThrownBy(() -> registry.acknowledge(ORDERS, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
