/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide concrete functionality for the Broker.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.broker.core.spi.ChannelRegistry} - Channel registry and queue engine</li>
 *   <li>{@link com.ryuqq.broker.core.spi.MessageIdGenerator} - Message id generation strategy</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., broker-adapter-inmemory) are responsible for providing concrete
 * implementations of these SPIs. The router in broker-application depends only on the interfaces.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Explicit Ownership:</strong> A registry is an object handed to the router, never a global singleton</li>
 *   <li><strong>Pluggability:</strong> Id generation is replaceable (random UUID in production, sequential ids in tests)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.broker.core.spi;
