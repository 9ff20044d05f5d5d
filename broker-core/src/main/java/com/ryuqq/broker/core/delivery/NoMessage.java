package com.ryuqq.broker.core.delivery;

import com.ryuqq.broker.core.model.ChannelName;

/**
 * 전달할 메시지 없음.
 *
 * <p>ready 큐가 비어있을 때의 정상 결과입니다. 소비자는 대기하지 않고 즉시 이 결과를 받습니다.</p>
 *
 * @param channel 채널 이름
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record NoMessage(ChannelName channel) implements ConsumeResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException channel이 null인 경우
     */
    public NoMessage {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
    }
}
