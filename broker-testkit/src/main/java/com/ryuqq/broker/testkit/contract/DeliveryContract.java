package com.ryuqq.broker.testkit.contract;

import com.ryuqq.broker.core.delivery.ConsumeResult;
import com.ryuqq.broker.core.delivery.Delivered;
import com.ryuqq.broker.core.delivery.NoMessage;
import com.ryuqq.broker.core.exception.ChannelNotFoundException;
import com.ryuqq.broker.core.model.Message;
import com.ryuqq.broker.core.model.MessageId;
import com.ryuqq.broker.core.model.Payload;
import com.ryuqq.broker.core.statemachine.MessageState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract: publish and consume.
 *
 * <ul>
 *   <li>Consume order equals publish order (FIFO)</li>
 *   <li>Each message is consumed at most once</li>
 *   <li>An empty ready queue yields NoMessage, not an error</li>
 *   <li>A consumed message moves from READY to UNACKED</li>
 *   <li>Missing channels fail with ChannelNotFound (strict configuration)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class DeliveryContract extends AbstractContractTest {

    @BeforeEach
    void registerOrders() {
        registry.register(ORDERS);
    }

    @Test
    void publish_ReturnsGeneratedIdAndAppendsToReady() {
        // When
        MessageId id = publishNumbered(ORDERS, 1);

        // Then
        assertThat(id).isEqualTo(MessageId.of("m1"));
        assertThat(registry.stateOf(ORDERS, id)).contains(MessageState.READY);
        assertStats(ORDERS, 1, 0);
    }

    @Test
    void consume_ReturnsMessagesInPublishOrder() {
        // Given
        List<MessageId> published = new ArrayList<>();
        for (int i = 1; i <= 50; i++) {
            published.add(publishNumbered(ORDERS, i));
        }

        // When
        List<MessageId> consumed = new ArrayList<>();
        List<Payload> payloads = new ArrayList<>();
        for (int i = 1; i <= 50; i++) {
            Message message = consumeDelivered(ORDERS);
            consumed.add(message.id());
            payloads.add(message.payload());
        }

        // Then
        assertThat(consumed).containsExactlyElementsOf(published);
        assertThat(payloads.get(0)).isEqualTo(payloadOf(1));
        assertThat(payloads.get(49)).isEqualTo(payloadOf(50));
    }

    @Test
    void consume_InterleavedWithPublish_KeepsFifo() {
        // Given
        publishNumbered(ORDERS, 1);
        publishNumbered(ORDERS, 2);

        // When
        Message first = consumeDelivered(ORDERS);
        publishNumbered(ORDERS, 3);
        Message second = consumeDelivered(ORDERS);
        Message third = consumeDelivered(ORDERS);

        // Then
        assertThat(first.payload()).isEqualTo(payloadOf(1));
        assertThat(second.payload()).isEqualTo(payloadOf(2));
        assertThat(third.payload()).isEqualTo(payloadOf(3));
    }

    @Test
    void consume_EachMessageAtMostOnce() {
        // Given
        for (int i = 1; i <= 10; i++) {
            publishNumbered(ORDERS, i);
        }

        // When
        Set<MessageId> seen = new HashSet<>();
        ConsumeResult result;
        int deliveries = 0;
        while ((result = registry.consume(ORDERS)).isDelivered()) {
            deliveries++;
            seen.add(consumeId(result));
        }

        // Then
        assertThat(deliveries).isEqualTo(10);
        assertThat(seen).hasSize(10);
        assertThat(result).isEqualTo(new NoMessage(ORDERS));
    }

    @Test
    void consume_EmptyChannel_ReturnsNoMessage() {
        // When
        ConsumeResult result = registry.consume(ORDERS);

        // Then
        assertThat(result.isEmpty()).isTrue();
        assertThat(result.channel()).isEqualTo(ORDERS);
    }

    @Test
    void consume_MovesMessageFromReadyToUnacked() {
        // Given
        MessageId id = publishNumbered(ORDERS, 1);

        // When
        consumeDelivered(ORDERS);

        // Then
        assertThat(registry.stateOf(ORDERS, id)).contains(MessageState.UNACKED);
        assertStats(ORDERS, 0, 1);
    }

    @Test
    void consume_UnackedMessageIsNeverRedelivered() {
        // Given
        publishNumbered(ORDERS, 1);
        consumeDelivered(ORDERS);

        // When & Then
        assertThat(registry.consume(ORDERS).isEmpty()).isTrue();
        assertThat(registry.consume(ORDERS).isEmpty()).isTrue();
        assertStats(ORDERS, 0, 1);
    }

    @Test
    void consume_ReturnedPayloadCannotMutateEngineState() {
        // Given
        Map<String, Object> source = new HashMap<>(Map.of("id", 1));
        MessageId id = registry.publish(ORDERS, Payload.of(source));
        source.put("id", 999);

        // When
        Message message = consumeDelivered(ORDERS);

        // Then
        assertThat(message.id()).isEqualTo(id);
        assertThat(message.payload().getValue()).containsEntry("id", 1);
        assertThatThrownBy(() -> message.payload().getValue().put("id", 2))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void publish_MissingChannel_FailsAndCreatesNothing() {
        // When & Then
        assertThatThrownBy(() -> publishNumbered(MISSING, 1))
            .isInstanceOf(ChannelNotFoundException.class)
            .hasMessageContaining("missing");
        assertThat(registry.exists(MISSING)).isFalse();
        assertThat(registry.channelNames()).containsExactly(ORDERS);
    }

    @Test
    void consume_MissingChannel_FailsWithChannelNotFound() {
        assertThatThrownBy(() -> registry.consume(MISSING))
            .isInstanceOf(ChannelNotFoundException.class);
    }

    @Test
    void stateOf_MissingChannel_FailsWithChannelNotFound() {
        assertThatThrownBy(() -> registry.stateOf(MISSING, MessageId.of("m1")))
            .isInstanceOf(ChannelNotFoundException.class)
            .hasMessage("Channel missing does not exist");
    }

    @Test
    void stateOf_AcknowledgedMessage_IsEmpty() {
        // Given
        MessageId id = publishNumbered(ORDERS, 1);
        consumeDelivered(ORDERS);

        // When
        registry.acknowledge(ORDERS, id);

        // Then
        assertThat(registry.stateOf(ORDERS, id)).isEmpty();
    }

    @Test
    void publish_NullPayload_ThrowsIllegalArgument() {
        assertThatThrownBy(() -> registry.publish(ORDERS, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertStats(ORDERS, 0, 0);
    }

    private static MessageId consumeId(ConsumeResult result) {
        return ((Delivered) result).message().id();
    }
}
