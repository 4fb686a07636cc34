package com.ryuqq.backoff.runner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 기본값 결정 순서.
 *
 * <p>후보를 등록 순서대로 조회하고 처음으로 값을 제공한 후보를 사용합니다 (short-circuit).</p>
 *
 * <p><strong>Backoff 실행 종료 시 순서:</strong></p>
 * <ol>
 *   <li>일치한 matcher의 기본값 (예외 matcher 또는 결과 matcher)</li>
 *   <li>attempt()에 전달된 기본값</li>
 * </ol>
 *
 * <p>모두 비어 있으면 호출자가 예외를 다시 던지거나 마지막 결과를 반환합니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class DefaultValueCascade {

    private final List<DefaultCandidate> candidates;

    private DefaultValueCascade(List<DefaultCandidate> candidates) {
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
    }

    /**
     * 후보 목록으로 생성.
     *
     * @param candidates 우선순위 순서의 후보
     * @return cascade
     * @throws IllegalArgumentException 후보가 null인 경우
     */
    public static DefaultValueCascade of(DefaultCandidate... candidates) {
        if (candidates == null) {
            throw new IllegalArgumentException("candidates cannot be null");
        }
        List<DefaultCandidate> list = new ArrayList<>();
        for (DefaultCandidate candidate : candidates) {
            if (candidate == null) {
                throw new IllegalArgumentException("candidate cannot be null");
            }
            list.add(candidate);
        }
        return new DefaultValueCascade(list);
    }

    /**
     * 첫 번째로 값을 제공한 후보의 기본값.
     *
     * @return 기본값 (없으면 empty)
     */
    public Optional<DefaultValue<?>> resolve() {
        for (DefaultCandidate candidate : candidates) {
            DefaultValue<?> value = candidate.candidate();
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
