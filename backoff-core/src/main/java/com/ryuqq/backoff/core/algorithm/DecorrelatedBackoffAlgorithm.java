package com.ryuqq.backoff.core.algorithm;

import com.ryuqq.backoff.core.support.Randoms;

/**
 * Decorrelated jitter 알고리즘.
 *
 * <pre>
 * delay = random(baseDelay, (prevBaseDelay ?? baseDelay) * multiplier)
 * </pre>
 *
 * <p>값 자체가 무작위이므로 별도 jitter는 적용하지 않습니다.
 * 직전 값에 의존하므로 전략은 재시도 번호별 결과를 캐시합니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class DecorrelatedBackoffAlgorithm implements BackoffAlgorithm {

    /**
     * 기본 배수.
     */
    public static final double DEFAULT_MULTIPLIER = 3.0;

    private final double baseDelay;
    private final double multiplier;

    public DecorrelatedBackoffAlgorithm(double baseDelay) {
        this(baseDelay, DEFAULT_MULTIPLIER);
    }

    public DecorrelatedBackoffAlgorithm(double baseDelay, double multiplier) {
        this.baseDelay = baseDelay;
        this.multiplier = multiplier;
    }

    @Override
    public Double calculateBaseDelay(int retryNumber, Double prevBaseDelay) {
        double prev = prevBaseDelay != null ? prevBaseDelay : baseDelay;
        double upper = Math.max(baseDelay, prev * multiplier);
        return Randoms.between(baseDelay, upper);
    }

    @Override
    public boolean jitterMayBeApplied() {
        return false;
    }
}
