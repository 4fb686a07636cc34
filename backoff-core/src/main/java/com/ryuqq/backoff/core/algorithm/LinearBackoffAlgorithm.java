package com.ryuqq.backoff.core.algorithm;

/**
 * 선형 증가 알고리즘.
 *
 * <pre>
 * delay = initialDelay + (retryNumber - 1) * delayIncrease
 * </pre>
 *
 * <p>delayIncrease를 생략하면 initialDelay만큼 증가합니다 (예: linear(5) → 5, 10, 15, ...).</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class LinearBackoffAlgorithm implements BackoffAlgorithm {

    private final double initialDelay;
    private final Double delayIncrease;

    /**
     * initialDelay만큼 증가하는 알고리즘 생성.
     *
     * @param initialDelay 첫 재시도 지연 값
     */
    public LinearBackoffAlgorithm(double initialDelay) {
        this(initialDelay, null);
    }

    /**
     * 생성자.
     *
     * @param initialDelay 첫 재시도 지연 값
     * @param delayIncrease 재시도마다 증가할 값 (null이면 initialDelay)
     */
    public LinearBackoffAlgorithm(double initialDelay, Double delayIncrease) {
        this.initialDelay = initialDelay;
        this.delayIncrease = delayIncrease;
    }

    @Override
    public Double calculateBaseDelay(int retryNumber, Double prevBaseDelay) {
        double increase = delayIncrease != null ? delayIncrease : initialDelay;
        return initialDelay + ((retryNumber - 1) * increase);
    }
}
