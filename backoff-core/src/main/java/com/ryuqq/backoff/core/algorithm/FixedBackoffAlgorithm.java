package com.ryuqq.backoff.core.algorithm;

/**
 * 고정 지연 알고리즘.
 *
 * <p>모든 재시도에 같은 지연 값을 사용합니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class FixedBackoffAlgorithm implements BackoffAlgorithm {

    private final double delay;

    /**
     * 생성자.
     *
     * @param delay 지연 값
     */
    public FixedBackoffAlgorithm(double delay) {
        this.delay = delay;
    }

    @Override
    public Double calculateBaseDelay(int retryNumber, Double prevBaseDelay) {
        return delay;
    }
}
