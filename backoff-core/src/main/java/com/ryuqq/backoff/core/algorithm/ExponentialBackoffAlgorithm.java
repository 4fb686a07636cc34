package com.ryuqq.backoff.core.algorithm;

/**
 * 지수 증가 알고리즘.
 *
 * <pre>
 * delay = initialDelay * factor^(retryNumber - 1)
 * </pre>
 *
 * <p><strong>예시 (initialDelay=1, factor=2):</strong> 1, 2, 4, 8, 16, ...</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class ExponentialBackoffAlgorithm implements BackoffAlgorithm {

    /**
     * 기본 증가 계수.
     */
    public static final double DEFAULT_FACTOR = 2.0;

    private final double initialDelay;
    private final double factor;

    /**
     * 기본 계수(2)로 생성.
     *
     * @param initialDelay 첫 재시도 지연 값
     */
    public ExponentialBackoffAlgorithm(double initialDelay) {
        this(initialDelay, DEFAULT_FACTOR);
    }

    /**
     * 생성자.
     *
     * @param initialDelay 첫 재시도 지연 값
     * @param factor 증가 계수
     */
    public ExponentialBackoffAlgorithm(double initialDelay, double factor) {
        this.initialDelay = initialDelay;
        this.factor = factor;
    }

    @Override
    public Double calculateBaseDelay(int retryNumber, Double prevBaseDelay) {
        return initialDelay * Math.pow(factor, retryNumber - 1);
    }
}
