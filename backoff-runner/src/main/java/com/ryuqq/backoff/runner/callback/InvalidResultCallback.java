package com.ryuqq.backoff.runner.callback;

import com.ryuqq.backoff.core.strategy.AttemptLog;

import java.util.List;

/**
 * 결과 matcher가 결과를 유효하지 않다고 판단할 때마다 호출.
 *
 * @author Backoff Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface InvalidResultCallback {

    void onInvalidResult(Object result, boolean willRetry, AttemptLog log, List<AttemptLog> logs);
}
