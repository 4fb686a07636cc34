package com.ryuqq.backoff.runner.callback;

import com.ryuqq.backoff.core.strategy.AttemptLog;

import java.util.List;

/**
 * 유효한 결과로 실행이 끝났을 때 한 번 호출.
 *
 * @author Backoff Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SuccessCallback {

    void onSuccess(Object result, AttemptLog log, List<AttemptLog> logs);
}
