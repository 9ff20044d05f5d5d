package com.ryuqq.broker.adapter.inmemory.registry;

import com.ryuqq.broker.core.model.ChannelName;
import com.ryuqq.broker.core.model.ChannelStats;
import com.ryuqq.broker.core.model.Message;
import com.ryuqq.broker.core.model.MessageId;
import com.ryuqq.broker.core.statemachine.MessageState;
import com.ryuqq.broker.core.statemachine.MessageTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * State of a single channel: the FIFO ready queue and the unacked set.
 *
 * <p>Every method is {@code synchronized} on the channel instance, so mutations of one
 * channel are serialized while different channels proceed independently.</p>
 *
 * <p><strong>Invariant:</strong> a live message id is a key of exactly one of
 * {@code ready} or {@code unacked}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class InMemoryChannel {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChannel.class);

    private final ChannelName name;

    /**
     * Ready queue. Insertion order is delivery order.
     */
    private final LinkedHashMap<MessageId, Message> ready;

    /**
     * Delivered but not yet acknowledged messages.
     */
    private final Map<MessageId, Message> unacked;

    InMemoryChannel(ChannelName name) {
        this.name = name;
        this.ready = new LinkedHashMap<>();
        this.unacked = new LinkedHashMap<>();
    }

    ChannelName name() {
        return name;
    }

    synchronized void enqueue(Message message) {
        if (ready.containsKey(message.id()) || unacked.containsKey(message.id())) {
            throw new IllegalStateException("Duplicate message id " + message.id().getValue() + " in channel " + name);
        }
        ready.put(message.id(), message);
    }

    /**
     * Moves the ready head to the unacked set.
     *
     * @return the delivered message, or empty if the ready queue is empty
     */
    synchronized Optional<Message> dequeue() {
        Iterator<Message> iterator = ready.values().iterator();
        if (!iterator.hasNext()) {
            return Optional.empty();
        }
        Message head = iterator.next();
        move(head.id(), MessageState.UNACKED);
        unacked.put(head.id(), head);
        return Optional.of(head);
    }

    /**
     * Destroys a delivered message.
     *
     * <p>Only an UNACKED message may be acknowledged. A READY message (never delivered)
     * or an unknown id is left untouched and reported as not found.</p>
     *
     * @return true if the message was unacked and is now destroyed
     */
    synchronized boolean acknowledge(MessageId messageId) {
        Optional<MessageState> current = stateOf(messageId);
        if (current.isEmpty() || !MessageTransition.isAllowed(current.get(), MessageState.ACKNOWLEDGED)) {
            log.debug("Acknowledge of {} in {} ignored: state {}", messageId.getValue(), name,
                current.map(Enum::name).orElse("unknown"));
            return false;
        }
        move(messageId, MessageState.ACKNOWLEDGED);
        return true;
    }

    /**
     * Discards every ready and unacked message.
     *
     * @return number of discarded messages
     */
    synchronized int purge() {
        List<MessageId> live = new ArrayList<>(ready.keySet());
        live.addAll(unacked.keySet());
        for (MessageId messageId : live) {
            move(messageId, MessageState.PURGED);
        }
        return live.size();
    }

    synchronized ChannelStats stats() {
        return new ChannelStats(ready.size(), unacked.size());
    }

    synchronized Optional<MessageState> stateOf(MessageId messageId) {
        if (ready.containsKey(messageId)) {
            return Optional.of(MessageState.READY);
        }
        if (unacked.containsKey(messageId)) {
            return Optional.of(MessageState.UNACKED);
        }
        return Optional.empty();
    }

    /**
     * Removes a message from its current location after checking the move against
     * {@link MessageTransition}. The caller places it at the new location, if any.
     */
    private void move(MessageId messageId, MessageState to) {
        MessageState from = stateOf(messageId)
            .orElseThrow(() -> new IllegalStateException("Message " + messageId.getValue() + " is not in channel " + name));
        MessageTransition.validate(from, to);
        Map<MessageId, Message> source = from == MessageState.READY ? ready : unacked;
        source.remove(messageId);
        if (log.isDebugEnabled()) {
            log.debug("Message {} in {}: {} → {}", messageId.getValue(), name, from, to);
        }
    }
}
