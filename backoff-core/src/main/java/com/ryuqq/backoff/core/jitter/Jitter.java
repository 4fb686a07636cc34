package com.ryuqq.backoff.core.jitter;

/**
 * Jitter 계약.
 *
 * <p>알고리즘이 계산한 지연 값을 무작위로 흔들어 여러 클라이언트가 동시에
 * 재시도하는 상황을 완화합니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Jitter {

    /**
     * jitter 적용.
     *
     * @param delay 원래 지연 값 (0보다 큼)
     * @param retryNumber 재시도 번호 (1부터 시작)
     * @return jitter가 적용된 지연 값
     */
    double apply(double delay, int retryNumber);
}
