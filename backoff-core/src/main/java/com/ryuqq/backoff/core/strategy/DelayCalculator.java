package com.ryuqq.backoff.core.strategy;

import java.util.HashMap;
import java.util.Map;

/**
 * 시도 번호별 지연 계산기.
 *
 * <p>시작 시점의 {@link StrategyConfig} 스냅샷으로 생성되며, 시도 번호별 기본 지연과
 * jitter 적용 지연을 캐시합니다. 같은 시도 번호는 항상 같은 지연을 반환합니다.</p>
 *
 * <p><strong>계산 순서 (시도 번호 n):</strong></p>
 * <ol>
 *   <li>n &lt;= 1 이거나 n &gt; maxAttempts → null</li>
 *   <li>재시도 비활성화 → null</li>
 *   <li>immediateFirstRetry: n == 2 → 0, 이후 시도는 한 칸씩 밀림</li>
 *   <li>알고리즘 조회 (retryNumber, 직전 기본 지연) → null이면 중단</li>
 *   <li>지연 비활성화 → 0</li>
 *   <li>[0, maxDelay] 범위로 제한</li>
 *   <li>jitter 적용 후 다시 [0, maxDelay] 범위로 제한</li>
 * </ol>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
final class DelayCalculator {

    private final StrategyConfig config;
    private final Map<Integer, Double> baseDelays = new HashMap<>();
    private final Map<Integer, Double> jitteredDelays = new HashMap<>();

    DelayCalculator(StrategyConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 시도 번호의 기본 지연 (jitter 미적용).
     *
     * @param attemptNumber 시도 번호
     * @return 기본 지연, 중단이면 null
     */
    Double baseDelay(int attemptNumber) {
        if (attemptNumber <= 1) {
            return null;
        }
        if (baseDelays.containsKey(attemptNumber)) {
            return baseDelays.get(attemptNumber);
        }

        // 캐시되지 않은 가장 낮은 시도 번호부터 순서대로 채움 (prevBaseDelay 의존성)
        int from = attemptNumber;
        while (from > 2 && !baseDelays.containsKey(from - 1)) {
            from--;
        }
        for (int current = from; current <= attemptNumber; current++) {
            baseDelays.put(current, computeBaseDelay(current));
        }
        return baseDelays.get(attemptNumber);
    }

    /**
     * 시도 번호의 실제 지연 (jitter 및 범위 제한 적용).
     *
     * @param attemptNumber 시도 번호
     * @return 지연, 중단이면 null
     */
    Double jitteredDelay(int attemptNumber) {
        if (jitteredDelays.containsKey(attemptNumber)) {
            return jitteredDelays.get(attemptNumber);
        }
        Double delay = baseDelay(attemptNumber);
        if (delay != null
            && delay > 0
            && config.jitter() != null
            && config.algorithm().jitterMayBeApplied()) {
            delay = applyBounds(config.jitter().apply(delay, attemptNumber - 1));
        }
        jitteredDelays.put(attemptNumber, delay);
        return delay;
    }

    /**
     * 해당 시도 전에 중단해야 하는지 확인.
     *
     * @param attemptNumber 시도 번호
     * @return 첫 시도가 아니고 지연이 없으면 true
     */
    boolean shouldStop(int attemptNumber) {
        return attemptNumber > 1 && baseDelay(attemptNumber) == null;
    }

    private Double computeBaseDelay(int attemptNumber) {
        if (config.maxAttempts() != null && attemptNumber > config.maxAttempts()) {
            return null;
        }
        if (!config.retriesEnabled()) {
            return null;
        }
        if (config.immediateFirstRetry() && attemptNumber == 2) {
            return 0.0;
        }

        // 즉시 재시도가 켜져 있으면 첫 실제 재시도는 직전의 0 지연을 prevBaseDelay 로 받음
        int retryNumber = retryNumber(attemptNumber);
        Double prevBaseDelay = baseDelays.get(attemptNumber - 1);
        Double delay = config.algorithm().calculateBaseDelay(retryNumber, prevBaseDelay);
        if (delay == null) {
            return null;
        }
        if (!config.delaysEnabled()) {
            return 0.0;
        }
        return applyBounds(delay);
    }

    private int retryNumber(int attemptNumber) {
        int retryNumber = attemptNumber - 1;
        return config.immediateFirstRetry() ? retryNumber - 1 : retryNumber;
    }

    private double applyBounds(double delay) {
        double bounded = Math.max(delay, 0);
        if (config.maxDelay() != null) {
            bounded = Math.min(bounded, config.maxDelay());
        }
        return bounded;
    }
}
