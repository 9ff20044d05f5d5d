/**
 * Contract tests for {@link com.ryuqq.broker.core.spi.ChannelRegistry} implementations.
 *
 * <p>Every class here is abstract. An adapter module runs a contract by extending it in its own
 * {@code src/test/java} and implementing
 * {@link com.ryuqq.broker.testkit.contract.AbstractContractTest#createRegistry}.</p>
 *
 * <h2>Contracts</h2>
 * <ul>
 *   <li>{@link com.ryuqq.broker.testkit.contract.RegistrationContract} - registration and AlreadyExists</li>
 *   <li>{@link com.ryuqq.broker.testkit.contract.DeliveryContract} - FIFO, at-most-once consume, NoMessage</li>
 *   <li>{@link com.ryuqq.broker.testkit.contract.AcknowledgementContract} - idempotent acknowledge</li>
 *   <li>{@link com.ryuqq.broker.testkit.contract.PurgeAndStatsContract} - purge and queue depth</li>
 *   <li>{@link com.ryuqq.broker.testkit.contract.ConcurrencyContract} - concurrent callers</li>
 *   <li>{@link com.ryuqq.broker.testkit.contract.MissingChannelLenientContract} - lenient configuration</li>
 *   <li>{@link com.ryuqq.broker.testkit.contract.OrdersScenarioContract} - end-to-end scenario</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.broker.testkit.contract;
