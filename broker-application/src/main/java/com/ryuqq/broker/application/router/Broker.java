package com.ryuqq.broker.application.router;

/**
 * 연산 이름으로 요청을 받아 응답을 돌려주는 Broker 진입점.
 *
 * <p>구현체는 어떤 요청에도 예외를 던지지 않고, 실패를 응답의 {@code error} 필드로 표현합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Broker broker = new RequestRouter(new InMemoryChannelRegistry());
 * broker.dispatch("register", BrokerRequest.ofChannel("orders"));
 *
 * BrokerResponse sent = broker.dispatch("send",
 *     new BrokerRequest("orders", null, Map.of("id", 1)));
 * String messageId = sent.messageId();
 *
 * BrokerResponse read = broker.dispatch("read", BrokerRequest.ofChannel("orders"));
 * broker.dispatch("confirm", new BrokerRequest("orders", read.messageId(), null));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Broker {

    /**
     * 요청 처리.
     *
     * @param operation 연산 이름 (앞쪽 "/" 허용, 대소문자 무시)
     * @param request 요청 본문 (null이면 빈 요청으로 처리)
     * @return 응답 (null 아님)
     */
    BrokerResponse dispatch(String operation, BrokerRequest request);
}
