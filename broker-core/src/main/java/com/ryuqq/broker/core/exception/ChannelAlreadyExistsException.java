package com.ryuqq.broker.core.exception;

import com.ryuqq.broker.core.model.ChannelName;

/**
 * 이미 사용 중인 이름으로 채널을 등록하려는 경우.
 *
 * <p>기존 채널과 그 메시지는 영향을 받지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ChannelAlreadyExistsException extends BrokerException {

    public static final String ERROR_CODE = "ALREADY_EXISTS";

    private final ChannelName channel;

    /**
     * 생성자.
     *
     * @param channel 이미 존재하는 채널 이름
     */
    public ChannelAlreadyExistsException(ChannelName channel) {
        super(ERROR_CODE, "Channel " + channel + " already exists");
        this.channel = channel;
    }

    public ChannelName getChannel() {
        return channel;
    }
}
