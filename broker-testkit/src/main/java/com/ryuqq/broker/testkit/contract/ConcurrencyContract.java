package com.ryuqq.broker.testkit.contract;

import com.ryuqq.broker.core.delivery.ConsumeResult;
import com.ryuqq.broker.core.delivery.Delivered;
import com.ryuqq.broker.core.exception.ChannelAlreadyExistsException;
import com.ryuqq.broker.core.model.ChannelName;
import com.ryuqq.broker.core.model.MessageId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract: concurrent callers.
 *
 * <ul>
 *   <li>Concurrent consumers of one channel never receive the same message</li>
 *   <li>Exactly one of many concurrent registrations of one name succeeds</li>
 *   <li>Concurrent publishers lose no message</li>
 *   <li>Concurrent acknowledges of one id succeed exactly once</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class ConcurrencyContract extends AbstractContractTest {

    private static final int THREADS = 8;

    @Test
    void concurrentConsumers_EachMessageDeliveredExactlyOnce() throws Exception {
        // Given
        registry.register(ORDERS);
        int messageCount = 2_000;
        for (int i = 1; i <= messageCount; i++) {
            publishNumbered(ORDERS, i);
        }

        // When
        Set<MessageId> delivered = ConcurrentHashMap.newKeySet();
        AtomicInteger deliveries = new AtomicInteger();
        runConcurrently(() -> {
            ConsumeResult result;
            while ((result = registry.consume(ORDERS)).isDelivered()) {
                delivered.add(((Delivered) result).message().id());
                deliveries.incrementAndGet();
            }
        });

        // Then
        assertThat(deliveries.get()).isEqualTo(messageCount);
        assertThat(delivered).hasSize(messageCount);
        assertStats(ORDERS, 0, messageCount);
    }

    @Test
    void concurrentRegistration_ExactlyOneSucceeds() throws Exception {
        // Given
        ChannelName contested = ChannelName.of("contested");
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        // When
        runConcurrently(() -> {
            try {
                registry.register(contested);
                succeeded.incrementAndGet();
            } catch (ChannelAlreadyExistsException e) {
                rejected.incrementAndGet();
            }
        });

        // Then
        assertThat(succeeded.get()).isEqualTo(1);
        assertThat(rejected.get()).isEqualTo(THREADS - 1);
        assertThat(registry.channelNames()).containsExactly(contested);
    }

    @Test
    void concurrentPublishers_NoMessageLost() throws Exception {
        // Given
        registry.register(ORDERS);
        int perThread = 250;
        Queue<MessageId> published = new ConcurrentLinkedQueue<>();

        // When
        runConcurrently(() -> {
            for (int i = 0; i < perThread; i++) {
                published.add(publishNumbered(ORDERS, i));
            }
        });

        // Then
        assertThat(published).hasSize(THREADS * perThread).doesNotHaveDuplicates();
        assertStats(ORDERS, THREADS * perThread, 0);
    }

    @Test
    void concurrentAcknowledge_SameId_SucceedsExactlyOnce() throws Exception {
        // Given
        registry.register(ORDERS);
        publishNumbered(ORDERS, 1);
        MessageId id = consumeDelivered(ORDERS).id();
        AtomicInteger acknowledged = new AtomicInteger();

        // When
        runConcurrently(() -> {
            if (registry.acknowledge(ORDERS, id)) {
                acknowledged.incrementAndGet();
            }
        });

        // Then
        assertThat(acknowledged.get()).isEqualTo(1);
        assertStats(ORDERS, 0, 0);
    }

    /**
     * Runs the task on {@link #THREADS} threads released at the same instant and waits for all of them.
     */
    private void runConcurrently(ThrowingRunnable task) throws Exception {
        ExecutorService executorService = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < THREADS; i++) {
                futures.add(executorService.submit(() -> {
                    start.await();
                    task.run();
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executorService.shutdownNow();
        }
    }

    @FunctionalInterface
    private interface ThrowingRunnable {
        void run() throws Exception;
    }
}
