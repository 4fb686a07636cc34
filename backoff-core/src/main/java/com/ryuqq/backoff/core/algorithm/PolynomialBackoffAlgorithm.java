package com.ryuqq.backoff.core.algorithm;

/**
 * 다항식 증가 알고리즘.
 *
 * <pre>
 * delay = initialDelay * retryNumber^power
 * </pre>
 *
 * <p><strong>예시 (initialDelay=1, power=2):</strong> 1, 4, 9, 16, 25, ...</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class PolynomialBackoffAlgorithm implements BackoffAlgorithm {

    /**
     * 기본 지수.
     */
    public static final double DEFAULT_POWER = 2.0;

    private final double initialDelay;
    private final double power;

    public PolynomialBackoffAlgorithm(double initialDelay) {
        this(initialDelay, DEFAULT_POWER);
    }

    public PolynomialBackoffAlgorithm(double initialDelay, double power) {
        this.initialDelay = initialDelay;
        this.power = power;
    }

    @Override
    public Double calculateBaseDelay(int retryNumber, Double prevBaseDelay) {
        return initialDelay * Math.pow(retryNumber, power);
    }
}
