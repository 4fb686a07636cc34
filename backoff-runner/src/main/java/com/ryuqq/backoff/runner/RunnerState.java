package com.ryuqq.backoff.runner;

/**
 * 재시도 실행 상태.
 *
 * <pre>
 * IDLE → ATTEMPTING → (RETRYING → ATTEMPTING)* → TERMINATED
 * </pre>
 *
 * <p>TERMINATED 이후 다시 attempt()를 호출하면 전략을 리셋하고 새 실행을 시작합니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public enum RunnerState {

    /**
     * 실행 전.
     */
    IDLE,

    /**
     * 작업 실행 중.
     */
    ATTEMPTING,

    /**
     * 재시도 대기 중.
     */
    RETRYING,

    /**
     * 실행 종료.
     */
    TERMINATED;

    /**
     * 종료 상태인지 확인.
     *
     * @return TERMINATED인 경우 true
     */
    public boolean isTerminal() {
        return this == TERMINATED;
    }
}
