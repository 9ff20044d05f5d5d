package com.ryuqq.broker.core.model;

/**
 * 채널의 고유 이름.
 *
 * <p>ChannelName은 Registry 내에서 채널을 식별하는 키이며,
 * 등록 시점에 결정되어 이후 변경되지 않습니다.</p>
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
public final class ChannelName implements Comparable<ChannelName> {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private ChannelName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ChannelName cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("ChannelName length cannot exceed " + MAX_LENGTH + " characters");
        }
        this.value = value;
    }

    /**
     * ChannelName 생성.
     *
     * @param value 채널 이름
     * @return ChannelName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ChannelName of(String value) {
        return new ChannelName(value);
    }

    /**
     * ChannelName 값 조회.
     *
     * @return 채널 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(ChannelName other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChannelName that = (ChannelName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
