package com.ryuqq.broker.application.router;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 라우터 응답 본문.
 *
 * <p>네 필드는 항상 존재합니다. 값이 없는 필드는 기본값({@code data}는 빈 객체,
 * 나머지는 빈 문자열)으로 채워집니다.</p>
 *
 * <p><strong>JSON 형식:</strong></p>
 * <pre>
 * {"data": {}, "message": "", "error": "", "message_id": ""}
 * </pre>
 *
 * @param data 응답 데이터 (Payload 또는 통계)
 * @param message 안내 메시지
 * @param error 오류 설명 (성공 시 빈 문자열)
 * @param messageId 관련 메시지 ID
 * @author Orchestrator Team
 * @since 1.0.0
 */
@JsonPropertyOrder({"data", "message", "error", "message_id"})
public record BrokerResponse(
    @JsonProperty("data") Map<String, Object> data,
    @JsonProperty("message") String message,
    @JsonProperty("error") String error,
    @JsonProperty("message_id") String messageId
) {

    /**
     * Compact Constructor.
     *
     * <p>null 필드를 기본값으로 치환하고 data를 수정 불가능한 복사본으로 보관합니다.</p>
     */
    public BrokerResponse {
        data = data == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        message = message == null ? "" : message;
        error = error == null ? "" : error;
        messageId = messageId == null ? "" : messageId;
    }

    public static BrokerResponse ofMessage(String message) {
        return new BrokerResponse(null, message, null, null);
    }

    public static BrokerResponse ofError(String error) {
        return new BrokerResponse(null, null, error, null);
    }

    public static BrokerResponse ofData(Map<String, Object> data) {
        return new BrokerResponse(data, null, null, null);
    }

    /**
     * 같은 응답에 메시지 ID를 지정한 복사본.
     *
     * @param messageId 메시지 ID
     * @return 새 응답
     */
    public BrokerResponse withMessageId(String messageId) {
        return new BrokerResponse(data, message, error, messageId);
    }

    /**
     * 오류 응답 여부.
     *
     * @return error가 비어 있지 않으면 true
     */
    public boolean hasError() {
        return !error.isEmpty();
    }
}
