package com.ryuqq.broker.core.model;

/**
 * 메시지의 고유 식별자.
 *
 * <p>MessageId는 게시(publish) 시점에 엔진이 {@link com.ryuqq.broker.core.spi.MessageIdGenerator}로
 * 생성하며, 호출자가 직접 지정하지 않습니다. 메시지가 소멸될 때까지 값이 유지됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MessageId {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private MessageId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("MessageId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("MessageId length cannot exceed " + MAX_LENGTH + " characters");
        }
        this.value = value;
    }

    /**
     * MessageId 생성.
     *
     * @param value MessageId 값
     * @return MessageId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static MessageId of(String value) {
        return new MessageId(value);
    }

    /**
     * 값이 MessageId 규칙을 만족하는지 확인.
     *
     * <p>외부 입력이 유효하지 않으면 해당 ID의 메시지는 존재할 수 없습니다.</p>
     *
     * @param value 검사할 값 (null 허용)
     * @return {@link #of(String)}가 성공하는 값이면 true
     */
    public static boolean isValid(String value) {
        return value != null && !value.isBlank() && value.length() <= MAX_LENGTH;
    }

    /**
     * MessageId 값 조회.
     *
     * @return MessageId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessageId messageId = (MessageId) o;
        return value.equals(messageId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "MessageId{" + value + '}';
    }
}
