package com.ryuqq.broker.core.spi;

import com.ryuqq.broker.core.delivery.ConsumeResult;
import com.ryuqq.broker.core.exception.ChannelAlreadyExistsException;
import com.ryuqq.broker.core.exception.ChannelNotFoundException;
import com.ryuqq.broker.core.model.ChannelName;
import com.ryuqq.broker.core.model.ChannelStats;
import com.ryuqq.broker.core.model.MessageId;
import com.ryuqq.broker.core.model.Payload;
import com.ryuqq.broker.core.statemachine.MessageState;

import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;

/**
 * Channel Registry / Queue Engine SPI.
 *
 * <p>This interface owns every channel and its message queues. It is the only component
 * with real invariants: FIFO delivery per channel and the
 * {@code ready → unacked → acknowledged | purged} message lifecycle.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Registering named channels</li>
 *   <li>Appending published messages to the tail of a channel's ready queue</li>
 *   <li>Moving the ready head to the unacked set on consume</li>
 *   <li>Destroying unacked messages on acknowledge</li>
 *   <li>Discarding every message of a channel on purge</li>
 *   <li>Reporting per-channel queue depth</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: mutations of one channel must be serialized so that two concurrent
 *       consumers never receive the same message</li>
 *   <li>Atomic registration: of two concurrent {@code register} calls for one name exactly one succeeds</li>
 *   <li>Non-blocking: {@code consume} on an empty channel returns immediately</li>
 *   <li>At-least-once delivery without automatic redelivery: an unacked message stays unacked
 *       until acknowledged or purged</li>
 *   <li>Value semantics: returned messages must not expose mutable engine state</li>
 * </ul>
 *
 * <p><strong>Missing channels:</strong> every method addressing a channel that is not registered throws
 * {@link ChannelNotFoundException}, unless the implementation is configured with
 * {@link com.ryuqq.broker.core.config.MissingChannelPolicy#IGNORE} (benign empty results) or, for
 * {@link #publish}, with channel auto-creation.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * registry.register(ChannelName.of("orders"));
 * MessageId id = registry.publish(ChannelName.of("orders"), Payload.of(Map.of("id", 1)));
 *
 * ConsumeResult result = registry.consume(ChannelName.of("orders"));
 * if (result instanceof Delivered delivered) {
 *     process(delivered.message());
 *     registry.acknowledge(ChannelName.of("orders"), delivered.message().id());
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ChannelRegistry {

    /**
     * Registers a new empty channel.
     *
     * @param channel the channel name
     * @throws ChannelAlreadyExistsException if the name is already registered (no side effect)
     * @throws IllegalArgumentException if channel is null
     */
    void register(ChannelName channel);

    /**
     * Publishes a payload to the tail of the channel's ready queue.
     *
     * <p>A new message with a freshly generated id is created. No message is created
     * when the call fails.</p>
     *
     * @param channel the channel name
     * @param payload the opaque payload
     * @return the generated message id
     * @throws ChannelNotFoundException if the channel does not exist and auto-creation is disabled
     * @throws IllegalArgumentException if channel or payload is null
     */
    MessageId publish(ChannelName channel, Payload payload);

    /**
     * Delivers the head of the channel's ready queue.
     *
     * <p>The delivered message moves to the unacked set. An empty ready queue yields
     * {@link com.ryuqq.broker.core.delivery.NoMessage}, which is a normal outcome.</p>
     *
     * @param channel the channel name
     * @return {@link com.ryuqq.broker.core.delivery.Delivered} or {@link com.ryuqq.broker.core.delivery.NoMessage}
     * @throws ChannelNotFoundException if the channel does not exist (FAIL policy)
     * @throws IllegalArgumentException if channel is null
     */
    ConsumeResult consume(ChannelName channel);

    /**
     * Acknowledges a delivered message, destroying it.
     *
     * <p><strong>Idempotency:</strong> acknowledging an id that was already acknowledged,
     * never delivered or never existed is a no-op that returns {@code false}.</p>
     *
     * @param channel the channel name
     * @param messageId the id returned by {@link #consume}
     * @return true if a message was removed from the unacked set
     * @throws ChannelNotFoundException if the channel does not exist (FAIL policy)
     * @throws IllegalArgumentException if channel or messageId is null
     */
    boolean acknowledge(ChannelName channel, MessageId messageId);

    /**
     * Atomically discards every ready and unacked message of the channel.
     *
     * @param channel the channel name
     * @return number of discarded messages
     * @throws ChannelNotFoundException if the channel does not exist (FAIL policy)
     * @throws IllegalArgumentException if channel is null
     */
    int purge(ChannelName channel);

    /**
     * Returns the queue depth of one channel.
     *
     * @param channel the channel name
     * @return the channel's stats, or empty if the channel does not exist (IGNORE policy)
     * @throws ChannelNotFoundException if the channel does not exist (FAIL policy)
     * @throws IllegalArgumentException if channel is null
     */
    Optional<ChannelStats> stats(ChannelName channel);

    /**
     * Returns the queue depth of every registered channel.
     *
     * @return stats keyed by channel name, sorted by name
     */
    SortedMap<ChannelName, ChannelStats> stats();

    /**
     * Checks whether a channel is registered.
     *
     * @param channel the channel name
     * @return true if registered
     * @throws IllegalArgumentException if channel is null
     */
    boolean exists(ChannelName channel);

    /**
     * Returns the names of all registered channels.
     *
     * @return snapshot of channel names
     */
    Set<ChannelName> channelNames();

    /**
     * Returns the lifecycle state of a live message.
     *
     * <p>Live messages are either {@link MessageState#READY} or {@link MessageState#UNACKED}.
     * Acknowledged and purged messages no longer exist and yield an empty result.</p>
     *
     * @param channel the channel name
     * @param messageId the message id
     * @return READY or UNACKED, or empty if the message does not exist
     * @throws ChannelNotFoundException if the channel does not exist (FAIL policy)
     * @throws IllegalArgumentException if channel or messageId is null
     */
    Optional<MessageState> stateOf(ChannelName channel, MessageId messageId);
}
