package com.ryuqq.backoff.core.algorithm;

/**
 * 피보나치 증가 알고리즘.
 *
 * <p>피보나치 수열에 initialDelay를 곱한 값을 사용합니다.</p>
 *
 * <p><strong>예시 (initialDelay=1):</strong></p>
 * <ul>
 *   <li>includeFirst=true: 1, 1, 2, 3, 5, 8, ...</li>
 *   <li>includeFirst=false: 1, 2, 3, 5, 8, 13, ...</li>
 * </ul>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class FibonacciBackoffAlgorithm implements BackoffAlgorithm {

    private final double initialDelay;
    private final boolean includeFirst;

    public FibonacciBackoffAlgorithm(double initialDelay) {
        this(initialDelay, true);
    }

    /**
     * 생성자.
     *
     * @param initialDelay 수열의 배율
     * @param includeFirst 수열의 첫 번째 1을 포함할지 여부
     */
    public FibonacciBackoffAlgorithm(double initialDelay, boolean includeFirst) {
        this.initialDelay = initialDelay;
        this.includeFirst = includeFirst;
    }

    @Override
    public Double calculateBaseDelay(int retryNumber, Double prevBaseDelay) {
        int steps = includeFirst ? retryNumber : retryNumber + 1;
        double delay = 0;
        double next = initialDelay;
        for (int i = 0; i < steps; i++) {
            double sum = next + delay;
            delay = next;
            next = sum;
        }
        return delay;
    }
}
