/**
 * 메시지 소비 결과 패키지.
 *
 * <p>{@link com.ryuqq.broker.core.delivery.ConsumeResult}는 sealed interface이며
 * {@link com.ryuqq.broker.core.delivery.Delivered}와 {@link com.ryuqq.broker.core.delivery.NoMessage}
 * 두 가지 구현만 허용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.broker.core.delivery;
