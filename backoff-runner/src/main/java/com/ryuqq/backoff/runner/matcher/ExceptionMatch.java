package com.ryuqq.backoff.runner.matcher;

import com.ryuqq.backoff.runner.DefaultValue;

/**
 * 예외 matcher 평가 결과.
 *
 * @author Backoff Team
 * @since 1.0.0
 * @param retryable 재시도 대상 여부
 * @param defaultValue 적용할 기본값 (nullable)
 */
public record ExceptionMatch(boolean retryable, DefaultValue<?> defaultValue) {

    static ExceptionMatch matched(DefaultValue<?> defaultValue) {
        return new ExceptionMatch(true, defaultValue);
    }

    static ExceptionMatch unmatched(DefaultValue<?> defaultValue) {
        return new ExceptionMatch(false, defaultValue);
    }
}
