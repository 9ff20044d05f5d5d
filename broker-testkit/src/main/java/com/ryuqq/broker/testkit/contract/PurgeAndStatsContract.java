package com.ryuqq.broker.testkit.contract;

import com.ryuqq.broker.core.exception.ChannelNotFoundException;
import com.ryuqq.broker.core.model.ChannelName;
import com.ryuqq.broker.core.model.ChannelStats;
import com.ryuqq.broker.core.model.Message;
import com.ryuqq.broker.core.model.MessageId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract: purge and stats.
 *
 * <ul>
 *   <li>After N publishes and K consumes: ready = N-K, unacked = K, total = N</li>
 *   <li>Purge discards ready and unacked messages and leaves all-zero stats</li>
 *   <li>Stats without a name covers every channel</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class PurgeAndStatsContract extends AbstractContractTest {

    @BeforeEach
    void registerChannels() {
        registry.register(ORDERS);
        registry.register(PAYMENTS);
    }

    @ParameterizedTest
    @CsvSource({"0, 0", "1, 0", "1, 1", "5, 2", "5, 5", "20, 7"})
    void stats_AfterPublishAndConsume_ReportsReadyUnackedTotal(int published, int consumed) {
        // Given
        for (int i = 1; i <= published; i++) {
            publishNumbered(ORDERS, i);
        }
        for (int i = 0; i < consumed; i++) {
            consumeDelivered(ORDERS);
        }

        // When
        ChannelStats stats = registry.stats(ORDERS).orElseThrow();

        // Then
        assertThat(stats.ready()).isEqualTo(published - consumed);
        assertThat(stats.unacked()).isEqualTo(consumed);
        assertThat(stats.total()).isEqualTo(published);
    }

    @Test
    void purge_DiscardsReadyAndUnacked() {
        // Given
        publishNumbered(ORDERS, 1);
        publishNumbered(ORDERS, 2);
        publishNumbered(ORDERS, 3);
        Message delivered = consumeDelivered(ORDERS);
        Message acknowledged = consumeDelivered(ORDERS);
        registry.acknowledge(ORDERS, acknowledged.id());

        // When
        int discarded = registry.purge(ORDERS);

        // Then
        assertThat(discarded).isEqualTo(2);
        assertThat(registry.stats(ORDERS)).contains(ChannelStats.empty());
        assertThat(registry.consume(ORDERS).isEmpty()).isTrue();
        assertThat(registry.stateOf(ORDERS, delivered.id())).isEmpty();
        assertThat(registry.acknowledge(ORDERS, delivered.id())).isFalse();
    }

    @Test
    void purge_EmptyChannel_ReturnsZero() {
        assertThat(registry.purge(ORDERS)).isZero();
        assertStats(ORDERS, 0, 0);
    }

    @Test
    void purge_KeepsChannelRegisteredAndUsable() {
        // Given
        publishNumbered(ORDERS, 1);
        registry.purge(ORDERS);

        // When
        MessageId id = publishNumbered(ORDERS, 2);

        // Then
        assertThat(registry.exists(ORDERS)).isTrue();
        Message message = consumeDelivered(ORDERS);
        assertThat(message.id()).isEqualTo(id);
        assertThat(message.payload()).isEqualTo(payloadOf(2));
    }

    @Test
    void purge_OnlyAffectsAddressedChannel() {
        // Given
        publishNumbered(ORDERS, 1);
        publishNumbered(PAYMENTS, 1);

        // When
        registry.purge(ORDERS);

        // Then
        assertStats(ORDERS, 0, 0);
        assertStats(PAYMENTS, 1, 0);
    }

    @Test
    void stats_WithoutName_ReportsEveryChannelSortedByName() {
        // Given
        ChannelName audit = ChannelName.of("audit");
        registry.register(audit);
        publishNumbered(ORDERS, 1);
        publishNumbered(ORDERS, 2);
        consumeDelivered(ORDERS);
        publishNumbered(PAYMENTS, 1);

        // When
        SortedMap<ChannelName, ChannelStats> all = registry.stats();

        // Then
        assertThat(all.keySet()).containsExactly(audit, ORDERS, PAYMENTS);
        assertThat(all).containsAllEntriesOf(Map.of(
            audit, new ChannelStats(0, 0),
            ORDERS, new ChannelStats(1, 1),
            PAYMENTS, new ChannelStats(1, 0)
        ));
    }

    @Test
    void stats_WithoutName_IsSnapshot() {
        // Given
        SortedMap<ChannelName, ChannelStats> before = registry.stats();

        // When
        publishNumbered(ORDERS, 1);

        // Then
        assertThat(before.get(ORDERS)).isEqualTo(ChannelStats.empty());
        assertThatThrownBy(() -> before.put(MISSING, ChannelStats.empty()))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void purge_MissingChannel_FailsWithChannelNotFound() {
        assertThatThrownBy(() -> registry.purge(MISSING))
            .isInstanceOf(ChannelNotFoundException.class);
    }

    @Test
    void stats_MissingChannel_FailsWithChannelNotFound() {
        assertThatThrownBy(() -> registry.stats(MISSING))
            .isInstanceOf(ChannelNotFoundException.class);
    }
}
