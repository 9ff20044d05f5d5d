package com.ryuqq.broker.core.statemachine;

/**
 * 메시지의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>READY → UNACKED (소비)</li>
 *   <li>UNACKED → ACKNOWLEDGED (확인)</li>
 *   <li>READY → PURGED, UNACKED → PURGED (채널 비우기)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * READY ──────────────┐
 *    │                │
 *    ▼ (소비)          │ (purge)
 * UNACKED ────────────┤
 *    │                │
 *    ▼ (확인)          ▼
 * ACKNOWLEDGED      PURGED
 *
 * 금지된 전이:
 * - UNACKED → READY ❌ (자동 재전달 없음)
 * - READY → ACKNOWLEDGED ❌ (전달되지 않은 메시지는 확인 불가)
 * - ACKNOWLEDGED, PURGED → * ❌
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum MessageState {

    /**
     * 전달 대기 중.
     */
    READY,

    /**
     * 전달되었으나 확인되지 않음.
     */
    UNACKED,

    /**
     * 확인 완료 (소멸).
     */
    ACKNOWLEDGED,

    /**
     * 채널 비우기로 폐기됨 (소멸).
     */
    PURGED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태의 메시지는 채널에서 제거되어 더 이상 존재하지 않습니다.</p>
     *
     * @return ACKNOWLEDGED 또는 PURGED인 경우 true
     */
    public boolean isTerminal() {
        return this == ACKNOWLEDGED || this == PURGED;
    }
}
