package com.ryuqq.backoff.runner;

/**
 * 기본값 후보 공급자.
 *
 * <p>{@link DefaultValueCascade}가 순서대로 조회하며, 값을 제공하지 않는 후보는 null을 반환합니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DefaultCandidate {

    /**
     * 후보 기본값 조회.
     *
     * @return 기본값, 제공하지 않으면 null
     */
    DefaultValue<?> candidate();
}
