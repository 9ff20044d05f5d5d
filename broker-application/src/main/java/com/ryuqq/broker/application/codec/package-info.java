/**
 * JSON boundary for the request router.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.broker.application.codec;
