package com.ryuqq.backoff.runner.callback;

import com.ryuqq.backoff.core.strategy.AttemptLog;

import java.util.List;

/**
 * 작업이 예외를 던질 때마다 호출.
 *
 * @author Backoff Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExceptionCallback {

    /**
     * @param exception 작업이 던진 예외
     * @param willRetry 다시 시도할 예정인지 여부
     * @param log 현재 시도 로그
     * @param logs 지금까지의 시도 로그
     */
    void onException(Exception exception, boolean willRetry, AttemptLog log, List<AttemptLog> logs);
}
