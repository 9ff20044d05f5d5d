/**
 * 메시지 상태 머신 패키지.
 *
 * <p>메시지는 READY에서 시작하여 UNACKED를 거쳐 ACKNOWLEDGED로 끝나거나,
 * 채널 비우기로 어느 단계에서든 PURGED가 됩니다. "rejected"나 "dead-letter" 상태는 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.broker.core.statemachine;
