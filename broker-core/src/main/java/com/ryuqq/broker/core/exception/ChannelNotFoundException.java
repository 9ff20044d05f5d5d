package com.ryuqq.broker.core.exception;

import com.ryuqq.broker.core.model.ChannelName;

/**
 * Registry에 존재하지 않는 채널을 지정한 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ChannelNotFoundException extends BrokerException {

    public static final String ERROR_CODE = "CHANNEL_NOT_FOUND";

    private final ChannelName channel;

    /**
     * 생성자.
     *
     * @param channel 존재하지 않는 채널 이름
     */
    public ChannelNotFoundException(ChannelName channel) {
        super(ERROR_CODE, "Channel " + channel + " does not exist");
        this.channel = channel;
    }

    public ChannelName getChannel() {
        return channel;
    }
}
