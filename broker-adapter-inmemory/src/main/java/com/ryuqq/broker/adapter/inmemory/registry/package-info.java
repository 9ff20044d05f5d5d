/**
 * In-memory Channel Registry adapter: the broker's queue engine.
 *
 * <p>This package contains the reference implementation of the
 * {@link com.ryuqq.broker.core.spi.ChannelRegistry} SPI using in-memory data structures.</p>
 *
 * <h2>Message Lifecycle</h2>
 *
 * <pre>
 * ┌─────────────┐
 * │   publish   │ (new MessageId from MessageIdGenerator)
 * └──────┬──────┘
 *        │
 *        ▼
 * ┌─────────────┐
 * │ ready queue │ (FIFO, insertion order)
 * └──────┬──────┘
 *        │ consume
 *        ▼
 * ┌─────────────┐
 * │ unacked set │ (no visibility timeout, no automatic redelivery)
 * └──────┬──────┘
 *        │
 *        └──► acknowledge() ──────────────────────► [Destroyed]
 *
 * purge() ──► ready + unacked cleared atomically ──► [Destroyed]
 * </pre>
 *
 * <h2>Concurrency Model</h2>
 *
 * <ul>
 *   <li><strong>ConcurrentHashMap:</strong> registry of channels, atomic registration</li>
 *   <li><strong>synchronized InMemoryChannel:</strong> per-channel mutual exclusion for queue transitions</li>
 * </ul>
 *
 * <h2>Limitations</h2>
 *
 * <ul>
 *   <li><strong>In-Memory Only:</strong> Data lost on process restart</li>
 *   <li><strong>Single JVM:</strong> No distributed operation</li>
 *   <li><strong>No Channel Deletion:</strong> Channels live as long as the registry</li>
 * </ul>
 *
 * @see com.ryuqq.broker.core.spi.ChannelRegistry
 * @see com.ryuqq.broker.adapter.inmemory.registry.InMemoryChannelRegistry
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.broker.adapter.inmemory.registry;
