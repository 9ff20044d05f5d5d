package com.ryuqq.broker.core.model;

/**
 * 채널에 게시된 메시지.
 *
 * <p>Message는 게시 시점에 생성되어 정확히 하나의 채널에 소속되며,
 * 확인(acknowledge) 또는 채널 비우기(purge) 시 소멸합니다. 채널 간에 복사되지 않습니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>id:</strong> 엔진이 생성한 메시지 식별자</li>
 *   <li><strong>payload:</strong> 업무 데이터 (엔진은 해석하지 않음)</li>
 *   <li><strong>publishedAt:</strong> 게시 시각 (epoch milliseconds)</li>
 * </ul>
 *
 * @param id 메시지 식별자
 * @param payload 업무 데이터
 * @param publishedAt 게시 시각 (epoch millis)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Message(
    MessageId id,
    Payload payload,
    long publishedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 publishedAt이 음수인 경우
     */
    public Message {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (publishedAt < 0) {
            throw new IllegalArgumentException("publishedAt must be non-negative (current: " + publishedAt + ")");
        }
    }

    /**
     * 현재 시각으로 Message 생성.
     *
     * @param id 메시지 식별자
     * @param payload 업무 데이터
     * @return 생성된 Message
     * @throws IllegalArgumentException id 또는 payload가 null인 경우
     */
    public static Message now(MessageId id, Payload payload) {
        return new Message(id, payload, System.currentTimeMillis());
    }
}
