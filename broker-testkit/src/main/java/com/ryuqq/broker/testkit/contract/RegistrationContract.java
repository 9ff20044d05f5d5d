package com.ryuqq.broker.testkit.contract;

import com.ryuqq.broker.core.exception.ChannelAlreadyExistsException;
import com.ryuqq.broker.core.model.ChannelStats;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract: channel registration.
 *
 * <ul>
 *   <li>A registered channel exists and starts empty</li>
 *   <li>Registering a name twice fails with AlreadyExists and leaves the channel untouched</li>
 *   <li>Channels are independent of each other</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class RegistrationContract extends AbstractContractTest {

    @Test
    void register_NewName_CreatesEmptyChannel() {
        // When
        registry.register(ORDERS);

        // Then
        assertThat(registry.exists(ORDERS)).isTrue();
        assertThat(registry.channelNames()).containsExactly(ORDERS);
        assertThat(registry.stats(ORDERS)).contains(ChannelStats.empty());
    }

    @Test
    void register_SameNameTwice_SecondFailsWithAlreadyExists() {
        // Given
        registry.register(ORDERS);

        // When & Then
        assertThatThrownBy(() -> registry.register(ORDERS))
            .isInstanceOf(ChannelAlreadyExistsException.class)
            .hasMessageContaining("orders");
    }

    @Test
    void register_SameNameTwice_ExistingMessagesUnaffected() {
        // Given
        registry.register(ORDERS);
        publishNumbered(ORDERS, 1);
        publishNumbered(ORDERS, 2);
        consumeDelivered(ORDERS);

        // When
        assertThatThrownBy(() -> registry.register(ORDERS))
            .isInstanceOf(ChannelAlreadyExistsException.class);

        // Then
        assertStats(ORDERS, 1, 1);
        assertThat(consumeDelivered(ORDERS).payload()).isEqualTo(payloadOf(2));
    }

    @Test
    void register_TwoNames_ChannelsAreIndependent() {
        // Given
        registry.register(ORDERS);
        registry.register(PAYMENTS);

        // When
        publishNumbered(ORDERS, 1);

        // Then
        assertStats(ORDERS, 1, 0);
        assertStats(PAYMENTS, 0, 0);
        assertThat(registry.consume(PAYMENTS).isEmpty()).isTrue();
    }

    @Test
    void register_NullName_ThrowsIllegalArgument() {
        assertThatThrownBy(() -> registry.register(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
