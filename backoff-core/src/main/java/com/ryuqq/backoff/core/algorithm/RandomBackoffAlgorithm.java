package com.ryuqq.backoff.core.algorithm;

import com.ryuqq.backoff.core.exception.BackoffInitializationException;
import com.ryuqq.backoff.core.support.Randoms;

/**
 * 범위 내 무작위 지연 알고리즘.
 *
 * <p>매 재시도마다 [min, max] 범위의 값을 선택합니다. 음수 경계는 0으로 보정되고,
 * 별도 jitter는 적용하지 않습니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class RandomBackoffAlgorithm implements BackoffAlgorithm {

    private final double min;
    private final double max;

    /**
     * 생성자.
     *
     * @param min 최소 지연 값
     * @param max 최대 지연 값
     * @throws BackoffInitializationException min이 max보다 큰 경우
     */
    public RandomBackoffAlgorithm(double min, double max) {
        if (min > max) {
            throw BackoffInitializationException.minIsGreaterThanMax(min, max);
        }
        this.min = Math.max(0, min);
        this.max = Math.max(0, max);
    }

    @Override
    public Double calculateBaseDelay(int retryNumber, Double prevBaseDelay) {
        return Randoms.between(min, max);
    }

    @Override
    public boolean jitterMayBeApplied() {
        return false;
    }
}
