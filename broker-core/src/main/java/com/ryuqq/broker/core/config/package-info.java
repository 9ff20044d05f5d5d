/**
 * Broker 엔진 설정 패키지.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.broker.core.config;
