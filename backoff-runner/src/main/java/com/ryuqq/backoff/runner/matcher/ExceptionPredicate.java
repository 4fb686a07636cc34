package com.ryuqq.backoff.runner.matcher;

import com.ryuqq.backoff.core.strategy.AttemptLog;

/**
 * 예외 재시도 여부 판단 콜백.
 *
 * @author Backoff Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExceptionPredicate {

    /**
     * @param exception 작업이 던진 예외
     * @param log 현재 시도 로그
     * @return 재시도 대상이면 true
     */
    boolean test(Exception exception, AttemptLog log);
}
