package com.ryuqq.backoff.runner.matcher;

import com.ryuqq.backoff.runner.DefaultValue;

import java.util.function.Predicate;

/**
 * 결과 값 matcher.
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class ResultMatcher {

    private final Predicate<Object> predicate;
    private final DefaultValue<?> defaultValue;

    private ResultMatcher(Predicate<Object> predicate, DefaultValue<?> defaultValue) {
        this.predicate = predicate;
        this.defaultValue = defaultValue;
    }

    /**
     * 값 비교 matcher.
     *
     * @param expected 비교 값 (null 허용)
     * @param strict strict 비교 여부 ({@link ValueEquality} 참고)
     * @param defaultValue 일치 시 기본값 (nullable)
     * @return matcher
     */
    public static ResultMatcher value(Object expected, boolean strict, DefaultValue<?> defaultValue) {
        return new ResultMatcher(actual -> ValueEquality.matches(expected, actual, strict), defaultValue);
    }

    /**
     * 콜백 matcher.
     *
     * @param predicate 판단 콜백
     * @param defaultValue 일치 시 기본값 (nullable)
     * @return matcher
     * @throws IllegalArgumentException predicate가 null인 경우
     */
    public static ResultMatcher when(Predicate<Object> predicate, DefaultValue<?> defaultValue) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        return new ResultMatcher(predicate, defaultValue);
    }

    public boolean matches(Object result) {
        return predicate.test(result);
    }

    public DefaultValue<?> defaultValue() {
        return defaultValue;
    }
}
