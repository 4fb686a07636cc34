package com.ryuqq.backoff.core.strategy;

/**
 * Backoff 전략의 생명주기 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * NOT_STARTED
 *    │
 *    ▼ (calculate / sleep / step / startOfAttempt / getDelay / simulate ...)
 * RUNNING
 *    │
 *    ▼ (알고리즘 중단 신호, maxAttempts 도달, 재시도 비활성화)
 * STOPPED
 *
 * reset() → NOT_STARTED (maxAttempts가 0이면 바로 STOPPED)
 * </pre>
 *
 * <p>maxAttempts가 0이면 시작 전에도 STOPPED일 수 있습니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public enum StrategyState {

    /**
     * 시작 전 (설정 변경 가능).
     */
    NOT_STARTED,

    /**
     * 실행 중 (설정 고정).
     */
    RUNNING,

    /**
     * 중단 (더 이상 시도 없음).
     */
    STOPPED;

    /**
     * 종료 상태인지 확인.
     *
     * @return STOPPED인 경우 true
     */
    public boolean isTerminal() {
        return this == STOPPED;
    }

    static StrategyState of(boolean started, boolean stopped) {
        if (stopped) {
            return STOPPED;
        }
        return started ? RUNNING : NOT_STARTED;
    }
}
