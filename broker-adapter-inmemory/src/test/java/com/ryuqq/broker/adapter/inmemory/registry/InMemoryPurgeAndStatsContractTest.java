package com.ryuqq.broker.adapter.inmemory.registry;

import com.ryuqq.broker.core.config.BrokerConfig;
import com.ryuqq.broker.core.spi.ChannelRegistry;
import com.ryuqq.broker.core.spi.MessageIdGenerator;
import com.ryuqq.broker.testkit.contract.PurgeAndStatsContract;

/**
 * Runs {@link PurgeAndStatsContract} against {@link InMemoryChannelRegistry}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryPurgeAndStatsContractTest extends PurgeAndStatsContract {

    @Override
    protected ChannelRegistry createRegistry(BrokerConfig config, MessageIdGenerator idGenerator) {
        return new InMemoryChannelRegistry(config, idGenerator);
    }
}
