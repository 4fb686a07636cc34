package com.ryuqq.backoff.core.strategy;

/**
 * 재시도 사이 대기 SPI.
 *
 * <p>기본 구현은 {@link DefaultSleeper}이며, 테스트에서는 실제로 대기하지 않는
 * 구현으로 교체할 수 있습니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정 시간 동안 대기.
     *
     * @param nanos 대기 시간 (나노초, 0 이하이면 즉시 반환)
     */
    void sleep(long nanos);
}
