package com.ryuqq.backoff.core.support;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 난수 유틸리티.
 *
 * <p>decorrelated/random 알고리즘과 range jitter가 공유합니다.
 * {@link ThreadLocalRandom}을 사용하므로 인스턴스 간 공유 상태가 없습니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class Randoms {

    // Utility class - prevent instantiation
    private Randoms() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * [min, max] 범위의 난수 생성.
     *
     * @param min 최솟값 (포함)
     * @param max 최댓값 (포함)
     * @return 난수 (min &gt; max 이면 null, min == max 이면 min)
     */
    public static Double between(double min, double max) {
        if (min > max) {
            return null;
        }
        if (min == max) {
            return min;
        }
        double value = min + ThreadLocalRandom.current().nextDouble() * (max - min);
        return Math.min(value, max);
    }
}
