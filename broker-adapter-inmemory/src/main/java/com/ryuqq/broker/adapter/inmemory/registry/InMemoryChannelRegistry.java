package com.ryuqq.broker.adapter.inmemory.registry;

import com.ryuqq.broker.core.config.BrokerConfig;
import com.ryuqq.broker.core.delivery.ConsumeResult;
import com.ryuqq.broker.core.delivery.Delivered;
import com.ryuqq.broker.core.delivery.NoMessage;
import com.ryuqq.broker.core.exception.ChannelAlreadyExistsException;
import com.ryuqq.broker.core.exception.ChannelNotFoundException;
import com.ryuqq.broker.core.model.ChannelName;
import com.ryuqq.broker.core.model.ChannelStats;
import com.ryuqq.broker.core.model.Message;
import com.ryuqq.broker.core.model.MessageId;
import com.ryuqq.broker.core.model.Payload;
import com.ryuqq.broker.core.spi.ChannelRegistry;
import com.ryuqq.broker.core.spi.MessageIdGenerator;
import com.ryuqq.broker.core.statemachine.MessageState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ChannelRegistry} SPI.
 *
 * <p>This implementation keeps every channel in process memory. A restart is equivalent
 * to a full purge of all channels.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>channels:</strong> ConcurrentHashMap&lt;ChannelName, InMemoryChannel&gt; - registry, atomic put-if-absent registration</li>
 *   <li><strong>InMemoryChannel.ready:</strong> LinkedHashMap&lt;MessageId, Message&gt; - FIFO ready queue</li>
 *   <li><strong>InMemoryChannel.unacked:</strong> LinkedHashMap&lt;MessageId, Message&gt; - delivered, awaiting acknowledge</li>
 * </ul>
 *
 * <p><strong>Concurrency Model:</strong></p>
 * <ul>
 *   <li>Registration: {@code putIfAbsent} (exactly one of two concurrent registrations wins)</li>
 *   <li>Channel auto-creation: {@code computeIfAbsent} (one channel instance per name)</li>
 *   <li>Channel mutations: {@code synchronized} per channel (consumers never share a message)</li>
 *   <li>Stats over all channels: per-channel snapshots, not a global snapshot</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>publish / consume / acknowledge:</strong> O(1)</li>
 *   <li><strong>purge:</strong> O(N) in the channel's message count</li>
 *   <li><strong>stats():</strong> O(C log C) in the channel count</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ChannelRegistry registry = new InMemoryChannelRegistry(BrokerConfig.strict());
 * registry.register(ChannelName.of("orders"));
 * MessageId id = registry.publish(ChannelName.of("orders"), Payload.of(Map.of("id", 1)));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryChannelRegistry implements ChannelRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChannelRegistry.class);

    private final ConcurrentHashMap<ChannelName, InMemoryChannel> channels;
    private final BrokerConfig config;
    private final MessageIdGenerator idGenerator;

    /**
     * Creates a strict registry with random UUID message ids.
     */
    public InMemoryChannelRegistry() {
        this(BrokerConfig.strict());
    }

    /**
     * Creates a registry with random UUID message ids.
     *
     * @param config engine configuration
     * @throws IllegalArgumentException if config is null
     */
    public InMemoryChannelRegistry(BrokerConfig config) {
        this(config, new UuidMessageIdGenerator());
    }

    /**
     * Creates a registry with a custom id generation strategy.
     *
     * @param config engine configuration
     * @param idGenerator message id generator
     * @throws IllegalArgumentException if any argument is null
     */
    public InMemoryChannelRegistry(BrokerConfig config, MessageIdGenerator idGenerator) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator cannot be null");
        }
        this.channels = new ConcurrentHashMap<>();
        this.config = config;
        this.idGenerator = idGenerator;
    }

    @Override
    public void register(ChannelName channel) {
        requireChannelName(channel);

        if (channels.putIfAbsent(channel, new InMemoryChannel(channel)) != null) {
            throw new ChannelAlreadyExistsException(channel);
        }
        log.info("Channel {} registered", channel);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>The id is generated only after the channel is resolved, so a failed publish creates nothing</li>
     *   <li>With auto-creation enabled the channel is created through {@code computeIfAbsent}</li>
     * </ul>
     */
    @Override
    public MessageId publish(ChannelName channel, Payload payload) {
        requireChannelName(channel);
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }

        InMemoryChannel target = config.autoCreateChannels()
            ? channels.computeIfAbsent(channel, this::createOnPublish)
            : channels.get(channel);
        if (target == null) {
            throw new ChannelNotFoundException(channel);
        }

        Message message = Message.now(idGenerator.nextId(), payload);
        target.enqueue(message);
        log.debug("Published {} to {}", message.id().getValue(), channel);
        return message.id();
    }

    @Override
    public ConsumeResult consume(ChannelName channel) {
        requireChannelName(channel);

        InMemoryChannel target = find(channel);
        if (target == null) {
            return new NoMessage(channel);
        }
        return target.dequeue()
            .<ConsumeResult>map(message -> new Delivered(channel, message))
            .orElseGet(() -> new NoMessage(channel));
    }

    @Override
    public boolean acknowledge(ChannelName channel, MessageId messageId) {
        requireChannelName(channel);
        if (messageId == null) {
            throw new IllegalArgumentException("messageId cannot be null");
        }

        InMemoryChannel target = find(channel);
        return target != null && target.acknowledge(messageId);
    }

    @Override
    public int purge(ChannelName channel) {
        requireChannelName(channel);

        InMemoryChannel target = find(channel);
        if (target == null) {
            return 0;
        }
        int discarded = target.purge();
        log.info("Channel {} purged: {} messages discarded", channel, discarded);
        return discarded;
    }

    @Override
    public Optional<ChannelStats> stats(ChannelName channel) {
        requireChannelName(channel);

        InMemoryChannel target = find(channel);
        return target == null ? Optional.empty() : Optional.of(target.stats());
    }

    @Override
    public SortedMap<ChannelName, ChannelStats> stats() {
        SortedMap<ChannelName, ChannelStats> result = new TreeMap<>();
        for (InMemoryChannel channel : channels.values()) {
            result.put(channel.name(), channel.stats());
        }
        return Collections.unmodifiableSortedMap(result);
    }

    @Override
    public boolean exists(ChannelName channel) {
        requireChannelName(channel);
        return channels.containsKey(channel);
    }

    @Override
    public Set<ChannelName> channelNames() {
        return Collections.unmodifiableSet(new TreeSet<>(channels.keySet()));
    }

    @Override
    public Optional<MessageState> stateOf(ChannelName channel, MessageId messageId) {
        requireChannelName(channel);
        if (messageId == null) {
            throw new IllegalArgumentException("messageId cannot be null");
        }

        InMemoryChannel target = find(channel);
        return target == null ? Optional.empty() : target.stateOf(messageId);
    }

    /**
     * Returns the engine configuration.
     *
     * @return configuration
     */
    public BrokerConfig config() {
        return config;
    }

    /**
     * Resolves a channel according to the missing-channel policy.
     *
     * @return the channel, or null if it does not exist and the policy is IGNORE
     * @throws ChannelNotFoundException if it does not exist and the policy is FAIL
     */
    private InMemoryChannel find(ChannelName channel) {
        InMemoryChannel target = channels.get(channel);
        if (target == null && !config.ignoresMissingChannels()) {
            throw new ChannelNotFoundException(channel);
        }
        return target;
    }

    private InMemoryChannel createOnPublish(ChannelName channel) {
        log.info("Channel {} created on first publish", channel);
        return new InMemoryChannel(channel);
    }

    private static void requireChannelName(ChannelName channel) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
    }
}
