package com.ryuqq.backoff.runner.matcher;

import java.util.ArrayList;
import java.util.List;

/**
 * 결과 matcher 집합.
 *
 * <p><strong>모드:</strong></p>
 * <ul>
 *   <li>{@link Mode#NONE}: 모든 결과가 유효</li>
 *   <li>{@link Mode#RETRY_WHEN}: 하나라도 일치하면 유효하지 않음 (첫 일치 matcher 중 기본값이 있는 것을 사용)</li>
 *   <li>{@link Mode#RETRY_UNTIL}: 하나라도 일치해야 유효</li>
 * </ul>
 *
 * <p>다른 모드의 matcher를 추가하면 기존 matcher는 제거됩니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class ResultMatchers {

    /**
     * 결과 평가 모드.
     */
    public enum Mode {
        NONE,
        RETRY_WHEN,
        RETRY_UNTIL
    }

    private final List<ResultMatcher> matchers = new ArrayList<>();
    private Mode mode = Mode.NONE;

    public void retryWhen(ResultMatcher matcher) {
        add(Mode.RETRY_WHEN, matcher);
    }

    public void retryUntil(ResultMatcher matcher) {
        add(Mode.RETRY_UNTIL, matcher);
    }

    /**
     * 결과 평가.
     *
     * @param result 작업 결과
     * @return 평가 결과
     */
    public ResultCheck check(Object result) {
        switch (mode) {
            case RETRY_WHEN:
                return checkRetryWhen(result);
            case RETRY_UNTIL:
                return checkRetryUntil(result);
            default:
                return ResultCheck.VALID;
        }
    }

    public Mode mode() {
        return mode;
    }

    public int size() {
        return matchers.size();
    }

    private ResultCheck checkRetryWhen(Object result) {
        boolean matched = false;
        for (ResultMatcher matcher : matchers) {
            if (!matcher.matches(result)) {
                continue;
            }
            if (matcher.defaultValue() != null) {
                return ResultCheck.invalid(matcher.defaultValue());
            }
            matched = true;
        }
        return matched ? ResultCheck.invalid(null) : ResultCheck.VALID;
    }

    private ResultCheck checkRetryUntil(Object result) {
        for (ResultMatcher matcher : matchers) {
            if (matcher.matches(result)) {
                return ResultCheck.VALID;
            }
        }
        return ResultCheck.invalid(null);
    }

    private void add(Mode newMode, ResultMatcher matcher) {
        if (matcher == null) {
            throw new IllegalArgumentException("matcher cannot be null");
        }
        if (mode != newMode) {
            matchers.clear();
            mode = newMode;
        }
        matchers.add(matcher);
    }
}
