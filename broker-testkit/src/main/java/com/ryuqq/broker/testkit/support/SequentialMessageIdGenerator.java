package com.ryuqq.broker.testkit.support;

import com.ryuqq.broker.core.model.MessageId;
import com.ryuqq.broker.core.spi.MessageIdGenerator;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic {@link MessageIdGenerator} producing {@code m1, m2, m3, ...}.
 *
 * <p>Thread-safe. Used by contract tests to assert on concrete message ids.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SequentialMessageIdGenerator implements MessageIdGenerator {

    private final String prefix;
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Creates a generator with the {@code "m"} prefix.
     */
    public SequentialMessageIdGenerator() {
        this("m");
    }

    /**
     * Creates a generator with a custom prefix.
     *
     * @param prefix id prefix
     * @throws IllegalArgumentException if prefix is null
     */
    public SequentialMessageIdGenerator(String prefix) {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        this.prefix = prefix;
    }

    @Override
    public MessageId nextId() {
        return MessageId.of(prefix + sequence.incrementAndGet());
    }

    /**
     * Returns the number of ids generated so far.
     *
     * @return generated count
     */
    public long generatedCount() {
        return sequence.get();
    }
}
