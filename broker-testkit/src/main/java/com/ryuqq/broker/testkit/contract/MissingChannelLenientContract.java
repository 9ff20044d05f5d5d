package com.ryuqq.broker.testkit.contract;

import com.ryuqq.broker.core.config.BrokerConfig;
import com.ryuqq.broker.core.delivery.NoMessage;
import com.ryuqq.broker.core.exception.ChannelAlreadyExistsException;
import com.ryuqq.broker.core.model.MessageId;
import com.ryuqq.broker.core.statemachine.MessageState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract: lenient configuration ({@link BrokerConfig#lenient()}).
 *
 * <ul>
 *   <li>Publishing to an unknown channel creates it</li>
 *   <li>Consume, acknowledge, purge and stats on an unknown channel return benign empty results</li>
 *   <li>Explicit registration still rejects duplicates</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class MissingChannelLenientContract extends AbstractContractTest {

    @Override
    protected BrokerConfig config() {
        return BrokerConfig.lenient();
    }

    @Test
    void publish_UnknownChannel_CreatesChannel() {
        // When
        MessageId id = publishNumbered(ORDERS, 1);

        // Then
        assertThat(registry.exists(ORDERS)).isTrue();
        assertThat(registry.stateOf(ORDERS, id)).contains(MessageState.READY);
        assertStats(ORDERS, 1, 0);
    }

    @Test
    void register_AfterAutoCreation_FailsWithAlreadyExists() {
        // Given
        publishNumbered(ORDERS, 1);

        // When & Then
        assertThatThrownBy(() -> registry.register(ORDERS))
            .isInstanceOf(ChannelAlreadyExistsException.class);
        assertStats(ORDERS, 1, 0);
    }

    @Test
    void consume_UnknownChannel_ReturnsNoMessage() {
        assertThat(registry.consume(MISSING)).isEqualTo(new NoMessage(MISSING));
        assertThat(registry.exists(MISSING)).isFalse();
    }

    @Test
    void acknowledge_UnknownChannel_ReturnsFalse() {
        assertThat(registry.acknowledge(MISSING, MessageId.of("m1"))).isFalse();
    }

    @Test
    void purge_UnknownChannel_ReturnsZero() {
        assertThat(registry.purge(MISSING)).isZero();
        assertThat(registry.exists(MISSING)).isFalse();
    }

    @Test
    void stats_UnknownChannel_IsAbsent() {
        assertThat(registry.stats(MISSING)).isEmpty();
        assertThat(registry.stats()).doesNotContainKey(MISSING);
    }

    @Test
    void stateOf_UnknownChannel_IsEmpty() {
        assertThat(registry.stateOf(MISSING, MessageId.of("m1"))).isEmpty();
    }
}
