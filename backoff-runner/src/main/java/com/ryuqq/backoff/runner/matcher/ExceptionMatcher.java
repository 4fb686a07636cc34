package com.ryuqq.backoff.runner.matcher;

import com.ryuqq.backoff.core.strategy.AttemptLog;
import com.ryuqq.backoff.runner.DefaultValue;

/**
 * 재시도할 예외를 판별하는 matcher.
 *
 * <p><strong>종류:</strong></p>
 * <ul>
 *   <li>{@link #ofType(Class, DefaultValue)}: 예외 타입 (instanceof)</li>
 *   <li>{@link #when(ExceptionPredicate, DefaultValue)}: 사용자 판단 콜백</li>
 *   <li>{@link #all(DefaultValue)}: 모든 예외</li>
 * </ul>
 *
 * <p>각 matcher는 자신이 일치했을 때만 사용되는 기본값을 가질 수 있습니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class ExceptionMatcher {

    private final ExceptionPredicate predicate;
    private final boolean catchAll;
    private final DefaultValue<?> defaultValue;

    private ExceptionMatcher(ExceptionPredicate predicate, boolean catchAll, DefaultValue<?> defaultValue) {
        this.predicate = predicate;
        this.catchAll = catchAll;
        this.defaultValue = defaultValue;
    }

    /**
     * 예외 타입 matcher.
     *
     * @param type 재시도할 예외 타입 (하위 타입 포함)
     * @param defaultValue 일치 시 기본값 (nullable)
     * @return matcher
     * @throws IllegalArgumentException type이 null인 경우
     */
    public static ExceptionMatcher ofType(Class<? extends Exception> type, DefaultValue<?> defaultValue) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return new ExceptionMatcher((exception, log) -> type.isInstance(exception), false, defaultValue);
    }

    /**
     * 콜백 matcher.
     *
     * @param predicate 판단 콜백
     * @param defaultValue 일치 시 기본값 (nullable)
     * @return matcher
     * @throws IllegalArgumentException predicate가 null인 경우
     */
    public static ExceptionMatcher when(ExceptionPredicate predicate, DefaultValue<?> defaultValue) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        return new ExceptionMatcher(predicate, false, defaultValue);
    }

    /**
     * 모든 예외 matcher.
     *
     * @param defaultValue 일치 시 기본값 (nullable)
     * @return matcher
     */
    public static ExceptionMatcher all(DefaultValue<?> defaultValue) {
        return new ExceptionMatcher((exception, log) -> true, true, defaultValue);
    }

    public boolean matches(Exception exception, AttemptLog log) {
        return predicate.test(exception, log);
    }

    public boolean isCatchAll() {
        return catchAll;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public DefaultValue<?> defaultValue() {
        return defaultValue;
    }
}
