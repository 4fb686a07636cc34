package com.ryuqq.backoff.core.algorithm;

/**
 * 재시도하지 않는 알고리즘.
 *
 * <p>항상 중단 신호(null)를 반환하므로 첫 시도만 실행됩니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class NoBackoffAlgorithm implements BackoffAlgorithm {

    @Override
    public Double calculateBaseDelay(int retryNumber, Double prevBaseDelay) {
        return null;
    }

    @Override
    public boolean jitterMayBeApplied() {
        return false;
    }
}
