package com.ryuqq.backoff.runner.callback;

import com.ryuqq.backoff.core.strategy.AttemptLog;

import java.util.List;

/**
 * 성공하지 못하고 실행이 끝났을 때 한 번 호출.
 *
 * <p>시도가 한 번도 없었다면 log는 null입니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FailureCallback {

    void onFailure(AttemptLog log, List<AttemptLog> logs);
}
