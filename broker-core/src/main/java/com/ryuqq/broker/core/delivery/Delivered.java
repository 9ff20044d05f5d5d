package com.ryuqq.broker.core.delivery;

import com.ryuqq.broker.core.model.ChannelName;
import com.ryuqq.broker.core.model.Message;

/**
 * 메시지 전달 성공.
 *
 * <p>전달된 메시지는 확인(acknowledge)되거나 채널이 비워질 때까지 unacked 상태로 남습니다.
 * 타임아웃에 의한 자동 재전달은 없습니다.</p>
 *
 * @param channel 채널 이름
 * @param message 전달된 메시지
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Delivered(
    ChannelName channel,
    Message message
) implements ConsumeResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException channel 또는 message가 null인 경우
     */
    public Delivered {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
    }
}
