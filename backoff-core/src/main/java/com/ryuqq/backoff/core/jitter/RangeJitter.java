package com.ryuqq.backoff.core.jitter;

import com.ryuqq.backoff.core.exception.BackoffInitializationException;
import com.ryuqq.backoff.core.support.Randoms;

/**
 * 범위 jitter.
 *
 * <pre>
 * jittered = random(delay * min, delay * max)
 * </pre>
 *
 * <p>min, max는 지연 값에 곱할 비율이며 음수는 0으로 보정됩니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public class RangeJitter implements Jitter {

    private final double min;
    private final double max;

    /**
     * 생성자.
     *
     * @param min 최소 비율
     * @param max 최대 비율
     * @throws BackoffInitializationException min이 max보다 큰 경우
     */
    public RangeJitter(double min, double max) {
        if (min > max) {
            throw BackoffInitializationException.minIsGreaterThanMax(min, max);
        }
        this.min = Math.max(0, min);
        this.max = Math.max(0, max);
    }

    @Override
    public double apply(double delay, int retryNumber) {
        Double jittered = Randoms.between(delay * min, delay * max);
        return jittered != null ? jittered : 0;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }
}
