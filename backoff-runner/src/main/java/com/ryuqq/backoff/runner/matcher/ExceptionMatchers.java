package com.ryuqq.backoff.runner.matcher;

import com.ryuqq.backoff.core.strategy.AttemptLog;
import com.ryuqq.backoff.runner.DefaultValue;

import java.util.ArrayList;
import java.util.List;

/**
 * 예외 matcher 집합.
 *
 * <p><strong>설정 규칙:</strong></p>
 * <ul>
 *   <li>설정하지 않으면 모든 예외를 재시도</li>
 *   <li>{@link #add(ExceptionMatcher)}는 누적됨</li>
 *   <li>{@link #disable(DefaultValue)}는 목록을 비우고 모든 예외를 재시도하지 않음 (이후 add 시 다시 활성화)</li>
 * </ul>
 *
 * <p><strong>평가 순서:</strong> 기본값 있는 특정 matcher → 기본값 있는 전체 matcher →
 * 기본값 없는 특정 matcher → 기본값 없는 전체 matcher. 각 그룹 안에서는 등록 순서입니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class ExceptionMatchers {

    private final List<ExceptionMatcher> matchers = new ArrayList<>();
    private boolean configured;
    private boolean disabled;
    private DefaultValue<?> disabledDefault;

    /**
     * matcher 추가.
     *
     * @param matcher matcher
     * @throws IllegalArgumentException matcher가 null인 경우
     */
    public void add(ExceptionMatcher matcher) {
        if (matcher == null) {
            throw new IllegalArgumentException("matcher cannot be null");
        }
        if (disabled) {
            disabled = false;
            disabledDefault = null;
        }
        configured = true;
        matchers.add(matcher);
    }

    /**
     * 예외 재시도 비활성화.
     *
     * @param defaultValue 예외 발생 시 사용할 기본값 (nullable)
     */
    public void disable(DefaultValue<?> defaultValue) {
        matchers.clear();
        configured = true;
        disabled = true;
        disabledDefault = defaultValue;
    }

    /**
     * 예외 평가.
     *
     * @param exception 작업이 던진 예외
     * @param log 현재 시도 로그
     * @return 평가 결과
     */
    public ExceptionMatch match(Exception exception, AttemptLog log) {
        if (!configured) {
            return ExceptionMatch.matched(null);
        }
        if (disabled) {
            return ExceptionMatch.unmatched(disabledDefault);
        }

        ExceptionMatcher matched = firstMatch(exception, log, false, true);
        if (matched == null) {
            matched = firstMatch(exception, log, true, true);
        }
        if (matched == null) {
            matched = firstMatch(exception, log, false, false);
        }
        if (matched == null) {
            matched = firstMatch(exception, log, true, false);
        }
        return matched != null
            ? ExceptionMatch.matched(matched.defaultValue())
            : ExceptionMatch.unmatched(null);
    }

    public boolean isDisabled() {
        return disabled;
    }

    private ExceptionMatcher firstMatch(Exception exception, AttemptLog log, boolean catchAll, boolean withDefault) {
        for (ExceptionMatcher matcher : matchers) {
            if (matcher.isCatchAll() == catchAll
                && matcher.hasDefault() == withDefault
                && matcher.matches(exception, log)) {
                return matcher;
            }
        }
        return null;
    }
}
