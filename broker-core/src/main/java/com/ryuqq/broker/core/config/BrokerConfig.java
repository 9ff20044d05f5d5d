package com.ryuqq.broker.core.config;

/**
 * Broker 엔진 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>autoCreateChannels: 첫 publish 시 채널 자동 생성 여부 (기본 false)</li>
 *   <li>missingChannelPolicy: 존재하지 않는 채널에 대한 처리 정책 (기본 FAIL)</li>
 * </ul>
 *
 * <p><strong>프리셋:</strong></p>
 * <ul>
 *   <li>{@link #strict()}: 명시적 등록 필수, 없는 채널은 항상 ChannelNotFoundException</li>
 *   <li>{@link #lenient()}: publish 시 자동 생성, 없는 채널은 빈 결과</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param autoCreateChannels 첫 publish 시 채널 자동 생성 여부
 * @param missingChannelPolicy 존재하지 않는 채널 처리 정책 (null 불가)
 */
public record BrokerConfig(
    boolean autoCreateChannels,
    MissingChannelPolicy missingChannelPolicy
) {

    /**
     * 기본 설정 생성자 (strict).
     */
    public BrokerConfig() {
        this(false, MissingChannelPolicy.FAIL);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException missingChannelPolicy가 null인 경우
     */
    public BrokerConfig {
        if (missingChannelPolicy == null) {
            throw new IllegalArgumentException("missingChannelPolicy cannot be null");
        }
    }

    /**
     * 명시적 등록을 요구하는 기본 설정.
     *
     * @return strict 설정
     */
    public static BrokerConfig strict() {
        return new BrokerConfig();
    }

    /**
     * 자동 생성 및 빈 결과를 허용하는 설정.
     *
     * @return lenient 설정
     */
    public static BrokerConfig lenient() {
        return new BrokerConfig(true, MissingChannelPolicy.IGNORE);
    }

    /**
     * 없는 채널을 빈 결과로 처리하는지 확인.
     *
     * @return IGNORE 정책이면 true
     */
    public boolean ignoresMissingChannels() {
        return missingChannelPolicy == MissingChannelPolicy.IGNORE;
    }

    /**
     * autoCreateChannels만 변경한 새 인스턴스 생성.
     */
    public BrokerConfig withAutoCreateChannels(boolean autoCreateChannels) {
        return new BrokerConfig(autoCreateChannels, missingChannelPolicy);
    }

    /**
     * missingChannelPolicy만 변경한 새 인스턴스 생성.
     */
    public BrokerConfig withMissingChannelPolicy(MissingChannelPolicy missingChannelPolicy) {
        return new BrokerConfig(autoCreateChannels, missingChannelPolicy);
    }
}
