package com.ryuqq.backoff.runner.matcher;

import com.ryuqq.backoff.runner.DefaultValue;

/**
 * 결과 평가 결과.
 *
 * @author Backoff Team
 * @since 1.0.0
 * @param valid 유효한 결과인지 여부
 * @param defaultValue 유효하지 않을 때 적용할 기본값 (nullable)
 */
public record ResultCheck(boolean valid, DefaultValue<?> defaultValue) {

    static final ResultCheck VALID = new ResultCheck(true, null);

    static ResultCheck invalid(DefaultValue<?> defaultValue) {
        return new ResultCheck(false, defaultValue);
    }
}
