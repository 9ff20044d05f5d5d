package com.ryuqq.broker.adapter.inmemory.registry;

import com.ryuqq.broker.core.model.MessageId;
import com.ryuqq.broker.core.spi.MessageIdGenerator;

import java.util.UUID;

/**
 * Default {@link MessageIdGenerator} producing random (version 4) UUIDs.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class UuidMessageIdGenerator implements MessageIdGenerator {

    @Override
    public MessageId nextId() {
        return MessageId.of(UUID.randomUUID().toString());
    }
}
