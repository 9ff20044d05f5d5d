package com.ryuqq.broker.core.statemachine;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 메시지 상태 전이 규칙.
 *
 * <p>채널 구현체는 메시지의 현재 위치(ready 큐 또는 unacked 집합)에서 현재 상태를 구하고,
 * 요청된 연산의 목표 상태로 옮길 수 있는지 이 클래스로 판정합니다.
 * 예를 들어 아직 전달되지 않은 READY 메시지에 대한 확인(acknowledge)은 허용되지 않습니다.</p>
 *
 * <table>
 *   <caption>현재 상태별 허용 목표 상태</caption>
 *   <tr><th>현재</th><th>허용</th></tr>
 *   <tr><td>READY</td><td>UNACKED, PURGED</td></tr>
 *   <tr><td>UNACKED</td><td>ACKNOWLEDGED, PURGED</td></tr>
 *   <tr><td>ACKNOWLEDGED, PURGED</td><td>(없음)</td></tr>
 * </table>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MessageTransition {

    private static final Map<MessageState, Set<MessageState>> ALLOWED;

    static {
        Map<MessageState, Set<MessageState>> allowed = new EnumMap<>(MessageState.class);
        allowed.put(MessageState.READY, EnumSet.of(MessageState.UNACKED, MessageState.PURGED));
        allowed.put(MessageState.UNACKED, EnumSet.of(MessageState.ACKNOWLEDGED, MessageState.PURGED));
        allowed.put(MessageState.ACKNOWLEDGED, EnumSet.noneOf(MessageState.class));
        allowed.put(MessageState.PURGED, EnumSet.noneOf(MessageState.class));
        ALLOWED = Collections.unmodifiableMap(allowed);
    }

    private MessageTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 현재 상태에서 이동 가능한 상태 목록.
     *
     * @param from 현재 상태
     * @return 허용 목표 상태 (종료 상태면 빈 집합)
     * @throws IllegalArgumentException from이 null인 경우
     */
    public static Set<MessageState> allowedTargets(MessageState from) {
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        return Collections.unmodifiableSet(ALLOWED.get(from));
    }

    /**
     * 전이 허용 여부.
     *
     * @param from 현재 상태
     * @param to 목표 상태
     * @return 허용되면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(MessageState from, MessageState to) {
        if (to == null) {
            throw new IllegalArgumentException("to cannot be null");
        }
        return allowedTargets(from).contains(to);
    }

    /**
     * 전이 검증.
     *
     * @param from 현재 상태
     * @param to 목표 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public static void validate(MessageState from, MessageState to) {
        if (!isAllowed(from, to)) {
            String reason = from.isTerminal() ? "message already destroyed" : "allowed: " + ALLOWED.get(from);
            throw new IllegalStateException("Message cannot move " + from + " → " + to + " (" + reason + ")");
        }
    }
}
