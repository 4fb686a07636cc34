package com.ryuqq.backoff.core.strategy;

import com.ryuqq.backoff.core.algorithm.BackoffAlgorithm;
import com.ryuqq.backoff.core.jitter.Jitter;
import com.ryuqq.backoff.core.unit.UnitType;

/**
 * Backoff 전략 설정 (불변 record).
 *
 * <p>{@link BackoffStrategy}는 이 스냅샷을 보관하며, 전략이 시작되는 시점에
 * 스냅샷으로 {@link DelayCalculator}를 만듭니다. 시작 이후에는 교체할 수 없습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>algorithm: 지연 계산 알고리즘 (필수)</li>
 *   <li>jitter: jitter (null이면 미적용)</li>
 *   <li>maxAttempts: 최대 시도 횟수 (null이면 무제한, 음수는 0으로 보정)</li>
 *   <li>maxDelay: 최대 지연 값 (null이면 무제한, 음수는 0으로 보정)</li>
 *   <li>unit: 지연 값 단위 (기본 SECONDS)</li>
 *   <li>runsAtStartOfLoop: 루프 시작에서 step()을 호출하는지 여부 (기본 false)</li>
 *   <li>immediateFirstRetry: 첫 재시도를 지연 없이 실행할지 여부 (기본 false)</li>
 *   <li>delaysEnabled: false이면 모든 지연이 0 (기본 true)</li>
 *   <li>retriesEnabled: false이면 재시도 없음 (기본 true)</li>
 * </ul>
 *
 * @author Backoff Team
 * @since 1.0.0
 * @param algorithm 지연 계산 알고리즘 (null이 아니어야 함)
 * @param jitter jitter (nullable)
 * @param maxAttempts 최대 시도 횟수 (nullable)
 * @param maxDelay 최대 지연 값 (nullable)
 * @param unit 단위 (null이 아니어야 함)
 * @param runsAtStartOfLoop 루프 시작 실행 여부
 * @param immediateFirstRetry 즉시 첫 재시도 여부
 * @param delaysEnabled 지연 활성화 여부
 * @param retriesEnabled 재시도 활성화 여부
 */
public record StrategyConfig(
    BackoffAlgorithm algorithm,
    Jitter jitter,
    Integer maxAttempts,
    Double maxDelay,
    UnitType unit,
    boolean runsAtStartOfLoop,
    boolean immediateFirstRetry,
    boolean delaysEnabled,
    boolean retriesEnabled
) {

    /**
     * Compact constructor (유효성 검증 및 보정).
     *
     * @throws IllegalArgumentException algorithm 또는 unit이 null이거나 maxDelay가 NaN인 경우
     */
    public StrategyConfig {
        if (algorithm == null) {
            throw new IllegalArgumentException("algorithm cannot be null");
        }
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        if (maxDelay != null && maxDelay.isNaN()) {
            throw new IllegalArgumentException("maxDelay must be a number (current: " + maxDelay + ")");
        }
        if (maxAttempts != null && maxAttempts < 0) {
            maxAttempts = 0;
        }
        if (maxDelay != null && maxDelay < 0) {
            maxDelay = 0.0;
        }
    }

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: jitter 없음, 무제한 시도, 최대 지연 없음, SECONDS, 루프 끝 실행,
     * 즉시 재시도 없음, 지연/재시도 활성화</p>
     *
     * @param algorithm 지연 계산 알고리즘
     * @return 설정
     */
    public static StrategyConfig of(BackoffAlgorithm algorithm) {
        return new StrategyConfig(algorithm, null, null, null, UnitType.SECONDS, false, false, true, true);
    }

    /**
     * 시도 횟수 제한 때문에 시작 전부터 중단 상태인지 확인.
     *
     * @return maxAttempts가 0이면 true
     */
    public boolean allowsNoAttempts() {
        return maxAttempts != null && maxAttempts <= 0;
    }

    /**
     * jitter만 변경한 새 인스턴스 생성.
     */
    public StrategyConfig withJitter(Jitter jitter) {
        return new StrategyConfig(algorithm, jitter, maxAttempts, maxDelay, unit,
            runsAtStartOfLoop, immediateFirstRetry, delaysEnabled, retriesEnabled);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public StrategyConfig withMaxAttempts(Integer maxAttempts) {
        return new StrategyConfig(algorithm, jitter, maxAttempts, maxDelay, unit,
            runsAtStartOfLoop, immediateFirstRetry, delaysEnabled, retriesEnabled);
    }

    /**
     * maxDelay만 변경한 새 인스턴스 생성.
     */
    public StrategyConfig withMaxDelay(Double maxDelay) {
        return new StrategyConfig(algorithm, jitter, maxAttempts, maxDelay, unit,
            runsAtStartOfLoop, immediateFirstRetry, delaysEnabled, retriesEnabled);
    }

    /**
     * unit만 변경한 새 인스턴스 생성.
     */
    public StrategyConfig withUnit(UnitType unit) {
        return new StrategyConfig(algorithm, jitter, maxAttempts, maxDelay, unit,
            runsAtStartOfLoop, immediateFirstRetry, delaysEnabled, retriesEnabled);
    }

    public StrategyConfig withRunsAtStartOfLoop(boolean runsAtStartOfLoop) {
        return new StrategyConfig(algorithm, jitter, maxAttempts, maxDelay, unit,
            runsAtStartOfLoop, immediateFirstRetry, delaysEnabled, retriesEnabled);
    }

    public StrategyConfig withImmediateFirstRetry(boolean immediateFirstRetry) {
        return new StrategyConfig(algorithm, jitter, maxAttempts, maxDelay, unit,
            runsAtStartOfLoop, immediateFirstRetry, delaysEnabled, retriesEnabled);
    }

    public StrategyConfig withDelaysEnabled(boolean delaysEnabled) {
        return new StrategyConfig(algorithm, jitter, maxAttempts, maxDelay, unit,
            runsAtStartOfLoop, immediateFirstRetry, delaysEnabled, retriesEnabled);
    }

    public StrategyConfig withRetriesEnabled(boolean retriesEnabled) {
        return new StrategyConfig(algorithm, jitter, maxAttempts, maxDelay, unit,
            runsAtStartOfLoop, immediateFirstRetry, delaysEnabled, retriesEnabled);
    }
}
