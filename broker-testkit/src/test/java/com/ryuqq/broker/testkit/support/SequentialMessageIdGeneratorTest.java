package com.ryuqq.broker.testkit.support;

import com.ryuqq.broker.core.model.MessageId;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SequentialMessageIdGenerator 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SequentialMessageIdGeneratorTest {

    @Test
    void nextId_기본_접두사로_1부터_순차_생성() {
        // given
        SequentialMessageIdGenerator generator = new SequentialMessageIdGenerator();

        // when & then
        assertThat(generator.nextId()).isEqualTo(MessageId.of("m1"));
        assertThat(generator.nextId()).isEqualTo(MessageId.of("m2"));
        assertThat(generator.generatedCount()).isEqualTo(2);
    }

    @Test
    void nextId_사용자_지정_접두사() {
        // given
        SequentialMessageIdGenerator generator = new SequentialMessageIdGenerator("msg-");

        // then
        assertThat(generator.nextId().getValue()).isEqualTo("msg-1");
    }

    @Test
    void nextId_동시_호출에도_중복_없음() throws Exception {
        // given
        SequentialMessageIdGenerator generator = new SequentialMessageIdGenerator();
        Set<MessageId> ids = ConcurrentHashMap.newKeySet();
        ExecutorService executorService = Executors.newFixedThreadPool(4);

        // when
        for (int i = 0; i < 1_000; i++) {
            executorService.submit(() -> ids.add(generator.nextId()));
        }
        executorService.shutdown();
        assertThat(executorService.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // then
        assertThat(ids).hasSize(1_000);
        assertThat(generator.generatedCount()).isEqualTo(1_000);
    }

    @Test
    void 접두사가_null이면_예외() {
        assertThatThrownBy(() -> new SequentialMessageIdGenerator(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
