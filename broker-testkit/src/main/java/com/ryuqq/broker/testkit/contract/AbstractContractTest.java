package com.ryuqq.broker.testkit.contract;

import com.ryuqq.broker.core.config.BrokerConfig;
import com.ryuqq.broker.core.delivery.ConsumeResult;
import com.ryuqq.broker.core.delivery.Delivered;
import com.ryuqq.broker.core.model.ChannelName;
import com.ryuqq.broker.core.model.ChannelStats;
import com.ryuqq.broker.core.model.Message;
import com.ryuqq.broker.core.model.MessageId;
import com.ryuqq.broker.core.model.Payload;
import com.ryuqq.broker.core.spi.ChannelRegistry;
import com.ryuqq.broker.core.spi.MessageIdGenerator;
import com.ryuqq.broker.testkit.support.SequentialMessageIdGenerator;
import org.junit.jupiter.api.BeforeEach;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Abstract base class for {@link ChannelRegistry} contract tests.
 *
 * <p>Each contract class in this package extends this base and declares the behavior every
 * registry implementation must exhibit. An adapter proves compliance by subclassing a contract
 * and implementing {@link #createRegistry(BrokerConfig, MessageIdGenerator)}.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class InMemoryDeliveryContractTest extends DeliveryContract {
 *     {@literal @}Override
 *     protected ChannelRegistry createRegistry(BrokerConfig config, MessageIdGenerator idGenerator) {
 *         return new InMemoryChannelRegistry(config, idGenerator);
 *     }
 * }
 * </pre>
 *
 * <p>Message ids are produced by {@link SequentialMessageIdGenerator}, so the n-th published
 * message of a test has id {@code "m" + n}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final ChannelName ORDERS = ChannelName.of("orders");
    protected static final ChannelName PAYMENTS = ChannelName.of("payments");
    protected static final ChannelName MISSING = ChannelName.of("missing");

    protected ChannelRegistry registry;
    protected SequentialMessageIdGenerator idGenerator;

    /**
     * Creates the registry under test.
     *
     * @param config engine configuration
     * @param idGenerator id generator the registry must use
     * @return a fresh, empty registry
     */
    protected abstract ChannelRegistry createRegistry(BrokerConfig config, MessageIdGenerator idGenerator);

    /**
     * Configuration used to create the registry. Strict by default.
     *
     * @return engine configuration
     */
    protected BrokerConfig config() {
        return BrokerConfig.strict();
    }

    @BeforeEach
    void setUpRegistry() {
        idGenerator = new SequentialMessageIdGenerator();
        registry = createRegistry(config(), idGenerator);
    }

    /**
     * Publishes a single-field payload {@code {"id": n}}.
     *
     * @param channel target channel
     * @param n payload id
     * @return generated message id
     */
    protected MessageId publishNumbered(ChannelName channel, int n) {
        return registry.publish(channel, payloadOf(n));
    }

    protected static Payload payloadOf(int n) {
        return Payload.of(Map.of("id", n));
    }

    /**
     * Consumes and asserts that a message was delivered.
     *
     * @param channel source channel
     * @return the delivered message
     */
    protected Message consumeDelivered(ChannelName channel) {
        ConsumeResult result = registry.consume(channel);
        assertThat(result).isInstanceOf(Delivered.class);
        return ((Delivered) result).message();
    }

    /**
     * Asserts the ready and unacked counts of a channel.
     *
     * @param channel channel to inspect
     * @param ready expected ready count
     * @param unacked expected unacked count
     */
    protected void assertStats(ChannelName channel, int ready, int unacked) {
        assertThat(registry.stats(channel))
            .as("stats of %s", channel)
            .contains(new ChannelStats(ready, unacked));
    }
}
