package com.ryuqq.broker.core.model;

/**
 * 채널의 큐 깊이 통계.
 *
 * @param ready 전달 대기 중인 메시지 수
 * @param unacked 전달되었으나 확인되지 않은 메시지 수
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ChannelStats(
    int ready,
    int unacked
) {

    private static final ChannelStats EMPTY = new ChannelStats(0, 0);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 음수 값이 전달된 경우
     */
    public ChannelStats {
        if (ready < 0) {
            throw new IllegalArgumentException("ready must be non-negative (current: " + ready + ")");
        }
        if (unacked < 0) {
            throw new IllegalArgumentException("unacked must be non-negative (current: " + unacked + ")");
        }
    }

    /**
     * 빈 채널의 통계.
     *
     * @return ready, unacked 모두 0인 통계
     */
    public static ChannelStats empty() {
        return EMPTY;
    }

    /**
     * 채널에 살아있는 전체 메시지 수.
     *
     * @return ready + unacked
     */
    public int total() {
        return ready + unacked;
    }
}
