package com.ryuqq.broker.core.delivery;

import com.ryuqq.broker.core.model.ChannelName;

/**
 * 메시지 소비(consume) 결과.
 *
 * <p>ConsumeResult는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Delivered}: ready 큐의 선두 메시지가 전달되어 unacked 상태로 이동함</li>
 *   <li>{@link NoMessage}: 전달할 메시지가 없음 (오류가 아닌 정상 결과)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface ConsumeResult permits Delivered, NoMessage {

    /**
     * 결과가 발생한 채널.
     *
     * @return 채널 이름
     */
    ChannelName channel();

    /**
     * 메시지가 전달되었는지 확인.
     *
     * @return 전달 여부
     */
    default boolean isDelivered() {
        return this instanceof Delivered;
    }

    /**
     * 전달할 메시지가 없었는지 확인.
     *
     * @return 빈 결과 여부
     */
    default boolean isEmpty() {
        return this instanceof NoMessage;
    }
}
