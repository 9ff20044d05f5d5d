package com.ryuqq.broker.adapter.inmemory.registry;

import com.ryuqq.broker.core.config.BrokerConfig;
import com.ryuqq.broker.core.spi.ChannelRegistry;
import com.ryuqq.broker.core.spi.MessageIdGenerator;
import com.ryuqq.broker.testkit.contract.DeliveryContract;

/**
 * Runs {@link DeliveryContract} against {@link InMemoryChannelRegistry}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryDeliveryContractTest extends DeliveryContract {

    @Override
    protected ChannelRegistry createRegistry(BrokerConfig config, MessageIdGenerator idGenerator) {
        return new InMemoryChannelRegistry(config, idGenerator);
    }
}
