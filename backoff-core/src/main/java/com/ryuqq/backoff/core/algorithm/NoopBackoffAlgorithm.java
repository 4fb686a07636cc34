package com.ryuqq.backoff.core.algorithm;

/**
 * 지연 없이 무제한 재시도하는 알고리즘.
 *
 * <p>항상 0을 반환합니다. 시도 횟수 제한은 maxAttempts로 지정합니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class NoopBackoffAlgorithm implements BackoffAlgorithm {

    @Override
    public Double calculateBaseDelay(int retryNumber, Double prevBaseDelay) {
        return 0.0;
    }

    @Override
    public boolean jitterMayBeApplied() {
        return false;
    }
}
