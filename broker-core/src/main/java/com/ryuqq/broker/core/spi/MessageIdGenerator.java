package com.ryuqq.broker.core.spi;

import com.ryuqq.broker.core.model.MessageId;

/**
 * 메시지 식별자 생성 전략 SPI.
 *
 * <p>엔진은 메시지를 생성할 때마다 이 전략을 호출합니다. 충돌 가능성이 충분히 낮은
 * 어떤 방식(UUID, Snowflake ID, 순번 등)이든 사용할 수 있습니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>프로세스 수명 동안 고유한 값 생성</li>
 *   <li>여러 스레드에서 동시에 호출되어도 안전해야 함</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageIdGenerator {

    /**
     * 새 MessageId 생성.
     *
     * @return 고유한 MessageId
     */
    MessageId nextId();
}
