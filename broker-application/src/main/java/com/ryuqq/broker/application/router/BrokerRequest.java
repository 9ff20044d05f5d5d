package com.ryuqq.broker.application.router;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ryuqq.broker.core.model.ChannelName;
import com.ryuqq.broker.core.model.MessageId;
import com.ryuqq.broker.core.model.Payload;

import java.util.Map;
import java.util.Optional;

/**
 * 라우터 요청 본문.
 *
 * <p>모든 필드는 선택적이며, 연산별 필수 여부는 {@code requireX} 메서드가 검증합니다.
 * 알 수 없는 필드는 무시합니다.</p>
 *
 * <p><strong>JSON 형식:</strong></p>
 * <pre>
 * {"channel": "orders", "data": {"id": 1}}
 * {"channel": "orders", "message_id": "..."}
 * </pre>
 *
 * @param channel 채널 이름
 * @param messageId 메시지 ID (confirm 전용)
 * @param data 게시할 Payload (send 전용)
 * @author Orchestrator Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BrokerRequest(
    @JsonProperty("channel") String channel,
    @JsonProperty("message_id") String messageId,
    @JsonProperty("data") Map<String, Object> data
) {

    private static final BrokerRequest EMPTY = new BrokerRequest(null, null, null);

    /**
     * 필드가 없는 요청.
     *
     * @return 빈 요청
     */
    public static BrokerRequest empty() {
        return EMPTY;
    }

    /**
     * 채널만 지정한 요청.
     *
     * @param channel 채널 이름
     * @return 요청
     */
    public static BrokerRequest ofChannel(String channel) {
        return new BrokerRequest(channel, null, null);
    }

    /**
     * 채널 이름 필수 조회.
     *
     * @return 채널 이름
     * @throws MalformedRequestException channel이 없거나 빈 문자열인 경우
     * @throws IllegalArgumentException channel이 255자를 초과하는 경우
     */
    public ChannelName requireChannel() {
        if (channel == null) {
            throw new MalformedRequestException("Field 'channel' is required");
        }
        return toChannelName();
    }

    /**
     * 채널 이름 선택 조회.
     *
     * <p>필드가 없거나 null인 경우만 "지정되지 않음"입니다.
     * 빈 문자열은 지정된 값으로 보고 거부합니다.</p>
     *
     * @return 채널 이름, 필드가 없으면 empty
     * @throws MalformedRequestException channel이 빈 문자열인 경우
     */
    public Optional<ChannelName> optionalChannel() {
        if (channel == null) {
            return Optional.empty();
        }
        return Optional.of(toChannelName());
    }

    /**
     * 메시지 ID 원문 필수 조회.
     *
     * <p>값이 {@link MessageId} 규칙을 만족하는지는 검사하지 않습니다.
     * 규칙에 맞지 않는 ID는 "존재하지 않는 메시지"로 처리됩니다.</p>
     *
     * @return message_id 원문
     * @throws MalformedRequestException message_id가 없거나 빈 문자열인 경우
     */
    public String requireMessageIdValue() {
        if (messageId == null || messageId.isBlank()) {
            throw new MalformedRequestException("Field 'message_id' is required");
        }
        return messageId;
    }

    /**
     * Payload 필수 조회.
     *
     * @return Payload
     * @throws MalformedRequestException data가 없는 경우
     */
    public Payload requireData() {
        if (data == null) {
            throw new MalformedRequestException("Field 'data' is required");
        }
        return Payload.of(data);
    }

    private ChannelName toChannelName() {
        if (channel.isBlank()) {
            throw new MalformedRequestException("Field 'channel' must not be blank");
        }
        return ChannelName.of(channel);
    }
}
