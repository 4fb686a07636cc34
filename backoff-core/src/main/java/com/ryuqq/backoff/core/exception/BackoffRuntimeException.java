package com.ryuqq.backoff.core.exception;

/**
 * 실행 중 오용(misuse) 오류.
 *
 * <p>호출자의 프로그래밍 오류를 나타내며, 조용히 무시되지 않습니다.</p>
 *
 * <p><strong>발생 조건:</strong></p>
 * <ul>
 *   <li>시작된 전략의 설정 변경</li>
 *   <li>중단된 전략에서 startOfAttempt() 호출</li>
 *   <li>startOfAttempt() 없이 endOfAttempt() 호출</li>
 *   <li>callback 알고리즘이 유효하지 않은 값 반환</li>
 *   <li>sleep 중 인터럽트</li>
 * </ul>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public class BackoffRuntimeException extends BackoffException {

    private BackoffRuntimeException(String message) {
        super(message);
    }

    private BackoffRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * callback 알고리즘이 유효하지 않은 값을 반환한 경우.
     *
     * @param value 반환된 값
     * @return 예외 인스턴스
     */
    public static BackoffRuntimeException callbackGaveInvalidDelay(Double value) {
        return new BackoffRuntimeException(
            "The callback backoff algorithm gave an invalid delay (current: " + value + ")"
        );
    }

    /**
     * 시작된 전략을 재설정하려 한 경우.
     *
     * @param method 호출된 설정 메서드 이름
     * @return 예외 인스턴스
     */
    public static BackoffRuntimeException attemptToChangeAfterStart(String method) {
        return new BackoffRuntimeException(
            "Backoff strategies cannot be reconfigured after starting - attempted to call \"" + method + "\""
        );
    }

    /**
     * 중단된 전략에서 startOfAttempt()를 호출한 경우.
     *
     * @return 예외 인스턴스
     */
    public static BackoffRuntimeException startOfAttemptNotAllowed() {
        return new BackoffRuntimeException(
            "Method startOfAttempt() cannot be called after the backoff has stopped"
        );
    }

    /**
     * startOfAttempt() 없이 endOfAttempt()를 호출한 경우.
     *
     * @return 예외 인스턴스
     */
    public static BackoffRuntimeException attemptLogHasNotStarted() {
        return new BackoffRuntimeException(
            "Method endOfAttempt() was called without startOfAttempt() being called first"
        );
    }

    /**
     * 재시도 대기 중 인터럽트된 경우.
     *
     * @param cause 원인 InterruptedException
     * @return 예외 인스턴스
     */
    public static BackoffRuntimeException sleepInterrupted(InterruptedException cause) {
        return new BackoffRuntimeException("Backoff sleep interrupted", cause);
    }
}
