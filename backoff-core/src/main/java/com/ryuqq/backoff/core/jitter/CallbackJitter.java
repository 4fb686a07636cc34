package com.ryuqq.backoff.core.jitter;

/**
 * 사용자 콜백에 jitter 계산을 위임합니다.
 *
 * <p>콜백이 null이나 NaN을 반환하면 원래 지연 값을 그대로 사용합니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class CallbackJitter implements Jitter {

    /**
     * jitter 계산 콜백.
     */
    @FunctionalInterface
    public interface JitterCallback {

        /**
         * @param delay 원래 지연 값
         * @param retryNumber 재시도 번호
         * @return jitter 적용 값 (nullable)
         */
        Double jitter(double delay, int retryNumber);
    }

    private final JitterCallback callback;

    /**
     * 생성자.
     *
     * @param callback jitter 콜백
     * @throws IllegalArgumentException callback이 null인 경우
     */
    public CallbackJitter(JitterCallback callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        this.callback = callback;
    }

    @Override
    public double apply(double delay, int retryNumber) {
        Double jittered = callback.jitter(delay, retryNumber);
        if (jittered == null || jittered.isNaN()) {
            return delay;
        }
        return jittered;
    }
}
