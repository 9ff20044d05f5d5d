package com.ryuqq.broker.core.config;

/**
 * 존재하지 않는 채널을 대상으로 한 조회/변경 요청의 처리 정책.
 *
 * <p>consume, acknowledge, purge, stats에 적용됩니다.
 * publish는 {@link BrokerConfig#autoCreateChannels()}가 결정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum MissingChannelPolicy {

    /**
     * ChannelNotFoundException 발생 (기본값).
     */
    FAIL,

    /**
     * 빈 결과 반환 (consume → NoMessage, acknowledge → false, purge → 0, stats → 결과에서 제외).
     */
    IGNORE
}
