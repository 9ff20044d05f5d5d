package com.ryuqq.broker.testkit.contract;

import com.ryuqq.broker.core.model.Message;
import com.ryuqq.broker.core.model.MessageId;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract: end-to-end publish, consume and acknowledge on the {@code orders} channel.
 *
 * <pre>
 * register("orders")
 * publish("orders", {"id":1})  → m1
 * publish("orders", {"id":2})  → m2
 * consume("orders")            → {"id":1} / m1
 * stats("orders")              → ready 1, unacked 1, total 2
 * acknowledge("orders", m1)    → true
 * stats("orders")              → ready 1, unacked 0, total 1
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class OrdersScenarioContract extends AbstractContractTest {

    @Test
    void ordersScenario() {
        // Given
        registry.register(ORDERS);

        // When: two messages published
        MessageId m1 = publishNumbered(ORDERS, 1);
        MessageId m2 = publishNumbered(ORDERS, 2);

        // Then
        assertThat(m1).isEqualTo(MessageId.of("m1"));
        assertThat(m2).isEqualTo(MessageId.of("m2"));

        // When: first message consumed
        Message consumed = consumeDelivered(ORDERS);

        // Then
        assertThat(consumed.id()).isEqualTo(m1);
        assertThat(consumed.payload()).isEqualTo(payloadOf(1));
        assertStats(ORDERS, 1, 1);
        assertThat(registry.stats(ORDERS).orElseThrow().total()).isEqualTo(2);

        // When: first message acknowledged
        boolean acknowledged = registry.acknowledge(ORDERS, m1);

        // Then
        assertThat(acknowledged).isTrue();
        assertStats(ORDERS, 1, 0);
        assertThat(registry.stats(ORDERS).orElseThrow().total()).isEqualTo(1);
    }
}
