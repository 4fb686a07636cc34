package com.ryuqq.backoff.runner.callback;

import com.ryuqq.backoff.core.strategy.AttemptLog;

import java.util.List;

/**
 * 성공/실패와 무관하게 실행 종료 시 한 번 호출.
 *
 * <p>예외를 다시 던지는 경우와 다른 콜백이 예외를 던진 경우에도 호출됩니다.
 * 시도가 한 번도 없었다면 log는 null입니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FinallyCallback {

    void onFinally(AttemptLog log, List<AttemptLog> logs);
}
