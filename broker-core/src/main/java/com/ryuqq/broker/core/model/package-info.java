/**
 * Broker 도메인 모델 패키지.
 *
 * <p>채널 이름, 메시지 식별자, Payload, Message, 채널 통계 등
 * 엔진과 라우터가 공유하는 불변 값 객체를 정의합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.broker.core.model;
