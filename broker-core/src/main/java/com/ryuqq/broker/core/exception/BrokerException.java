package com.ryuqq.broker.core.exception;

/**
 * Broker 오류의 최상위 예외.
 *
 * <p>모든 Broker 오류는 호출자에게 그대로 전달되는 복구 가능한 로컬 조건이며,
 * 프로세스를 중단시키지 않습니다. 라우터는 이 예외를 응답의 {@code error} 문자열로 변환합니다.</p>
 *
 * <p><strong>오류 분류:</strong></p>
 * <ul>
 *   <li>{@link ChannelAlreadyExistsException}: ALREADY_EXISTS</li>
 *   <li>{@link ChannelNotFoundException}: CHANNEL_NOT_FOUND</li>
 *   <li>UnknownOperationException (라우터): UNKNOWN_OPERATION</li>
 *   <li>MalformedRequestException (라우터): MALFORMED_REQUEST</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class BrokerException extends RuntimeException {

    private final String errorCode;

    /**
     * 생성자.
     *
     * @param errorCode 오류 코드 (예: CHANNEL_NOT_FOUND)
     * @param message 오류 메시지
     * @throws IllegalArgumentException errorCode가 null이거나 빈 문자열인 경우
     */
    protected BrokerException(String errorCode, String message) {
        super(message);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    /**
     * 원인 예외를 포함하는 생성자.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param cause 원인 예외
     * @throws IllegalArgumentException errorCode가 null이거나 빈 문자열인 경우
     */
    protected BrokerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드
     */
    public String getErrorCode() {
        return errorCode;
    }
}
