package com.ryuqq.backoff.core.algorithm;

import com.ryuqq.backoff.core.exception.BackoffRuntimeException;

/**
 * 사용자 콜백에 지연 계산을 위임하는 알고리즘.
 *
 * <p>콜백이 null을 반환하면 중단합니다. NaN이나 무한대를 반환하면
 * {@link BackoffRuntimeException}이 발생합니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class CallbackBackoffAlgorithm implements BackoffAlgorithm {

    /**
     * 지연 계산 콜백.
     */
    @FunctionalInterface
    public interface DelayCallback {

        /**
         * @param retryNumber 재시도 번호 (1부터 시작)
         * @param prevBaseDelay 직전 기본 지연 값 (nullable)
         * @return 지연 값, 중단하려면 null
         */
        Double delayFor(int retryNumber, Double prevBaseDelay);
    }

    private final DelayCallback callback;

    /**
     * 생성자.
     *
     * @param callback 지연 계산 콜백
     * @throws IllegalArgumentException callback이 null인 경우
     */
    public CallbackBackoffAlgorithm(DelayCallback callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        this.callback = callback;
    }

    @Override
    public Double calculateBaseDelay(int retryNumber, Double prevBaseDelay) {
        Double delay = callback.delayFor(retryNumber, prevBaseDelay);
        if (delay == null) {
            return null;
        }
        if (delay.isNaN() || delay.isInfinite()) {
            throw BackoffRuntimeException.callbackGaveInvalidDelay(delay);
        }
        return delay;
    }
}
