/**
 * Request Router.
 *
 * <p>연산 이름과 요청 본문을 {@link com.ryuqq.broker.core.spi.ChannelRegistry} 호출로 변환하고,
 * 결과를 {@code data / message / error / message_id} 네 필드의 응답으로 돌려줍니다.</p>
 *
 * <p>진입점은 {@link com.ryuqq.broker.application.router.Broker}이며,
 * 기본 구현체는 {@link com.ryuqq.broker.application.router.RequestRouter}입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.broker.application.router;
