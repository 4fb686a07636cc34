package com.ryuqq.backoff.core.exception;

/**
 * Backoff 라이브러리의 기본 예외.
 *
 * <p>라이브러리 자체의 오류만 이 계층으로 표현합니다.
 * 사용자 작업(operation)이 던진 예외는 감싸지 않고 그대로 전파됩니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public class BackoffException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public BackoffException(String message) {
        super(message);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public BackoffException(String message, Throwable cause) {
        super(message, cause);
    }
}
