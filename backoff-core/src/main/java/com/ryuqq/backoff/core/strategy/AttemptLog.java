package com.ryuqq.backoff.core.strategy;

import com.ryuqq.backoff.core.unit.TimeSpans;
import com.ryuqq.backoff.core.unit.UnitType;

import java.time.Instant;

/**
 * 한 번의 시도에 대한 시간 및 지연 기록.
 *
 * <p>{@link BackoffStrategy#startOfAttempt()} 시점에 생성되고,
 * {@link BackoffStrategy#endOfAttempt()} 또는 다음 시도 시작 시점에 작업 시간이 확정됩니다.
 * 확정 이후에는 변경되지 않습니다. 생성과 확정은 소유 전략만 수행합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>k번째 로그의 overallDelay = 1..k 로그의 prevDelay 합</li>
 *   <li>k번째 로그의 overallWorkingTime = 1..k 로그의 workingTime 합 (null은 0)</li>
 * </ul>
 *
 * <p>모든 시간/지연 값은 {@link #unitType()} 단위이며, InSeconds/InMs/InUs 접근자로
 * 다른 단위 값을 조회할 수 있습니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class AttemptLog {

    private final int attemptNumber;
    private final Integer maxAttempts;
    private final Instant firstAttemptOccurredAt;
    private final Instant thisAttemptOccurredAt;
    private final Double prevDelay;
    private final Double nextDelay;
    private final Double overallDelay;
    private final UnitType unitType;
    private Double workingTime;
    private Double overallWorkingTime;

    AttemptLog(
        int attemptNumber,
        Integer maxAttempts,
        Instant firstAttemptOccurredAt,
        Instant thisAttemptOccurredAt,
        Double prevDelay,
        Double nextDelay,
        Double overallDelay,
        UnitType unitType
    ) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be positive (current: " + attemptNumber + ")");
        }
        if (firstAttemptOccurredAt == null || thisAttemptOccurredAt == null) {
            throw new IllegalArgumentException("Attempt timestamps cannot be null");
        }
        if (unitType == null) {
            throw new IllegalArgumentException("unitType cannot be null");
        }
        this.attemptNumber = attemptNumber;
        this.maxAttempts = maxAttempts;
        this.firstAttemptOccurredAt = firstAttemptOccurredAt;
        this.thisAttemptOccurredAt = thisAttemptOccurredAt;
        this.prevDelay = prevDelay;
        this.nextDelay = nextDelay;
        this.overallDelay = overallDelay;
        this.unitType = unitType;
    }

    /**
     * 작업 시간 확정.
     *
     * <p>첫 호출만 반영되고 이후 호출은 무시됩니다.</p>
     *
     * @param endedAt 시도 종료 시각
     * @param previousOverallWorkingTime 직전 로그의 누적 작업 시간 (nullable)
     * @return 이번 호출로 확정되었으면 true
     */
    boolean finish(Instant endedAt, Double previousOverallWorkingTime) {
        if (workingTime != null) {
            return false;
        }
        double seconds = Math.max(0, TimeSpans.between(thisAttemptOccurredAt, endedAt));
        workingTime = TimeSpans.convert(seconds, UnitType.SECONDS, unitType);
        overallWorkingTime = workingTime + (previousOverallWorkingTime != null ? previousOverallWorkingTime : 0);
        return true;
    }

    /**
     * 시도 번호 (1부터 시작).
     */
    public int attemptNumber() {
        return attemptNumber;
    }

    /**
     * 재시도 번호 (첫 시도는 0).
     */
    public int retryNumber() {
        return attemptNumber - 1;
    }

    /**
     * 최대 시도 횟수 (null이면 무제한).
     */
    public Integer maxAttempts() {
        return maxAttempts;
    }

    /**
     * 이 시도 이후 재시도가 예정되어 있는지 여부.
     *
     * @return nextDelay가 있으면 true
     */
    public boolean willRetry() {
        return nextDelay != null;
    }

    public Instant firstAttemptOccurredAt() {
        return firstAttemptOccurredAt;
    }

    public Instant thisAttemptOccurredAt() {
        return thisAttemptOccurredAt;
    }

    public UnitType unitType() {
        return unitType;
    }

    // ============================================================
    // 작업 시간
    // ============================================================

    /**
     * 이 시도에서 작업에 걸린 시간 (확정 전이면 null).
     */
    public Double workingTime() {
        return workingTime;
    }

    public Double workingTimeInSeconds() {
        return in(workingTime, UnitType.SECONDS);
    }

    public Double workingTimeInMs() {
        return in(workingTime, UnitType.MILLISECONDS);
    }

    public Double workingTimeInUs() {
        return in(workingTime, UnitType.MICROSECONDS);
    }

    /**
     * 첫 시도부터 이 시도까지 누적 작업 시간 (확정 전이면 null).
     */
    public Double overallWorkingTime() {
        return overallWorkingTime;
    }

    public Double overallWorkingTimeInSeconds() {
        return in(overallWorkingTime, UnitType.SECONDS);
    }

    public Double overallWorkingTimeInMs() {
        return in(overallWorkingTime, UnitType.MILLISECONDS);
    }

    public Double overallWorkingTimeInUs() {
        return in(overallWorkingTime, UnitType.MICROSECONDS);
    }

    /**
     * 누적 작업 시간 (확정 전이면 0).
     */
    public double overallWorkingTimeAsNumber() {
        return overallWorkingTime != null ? overallWorkingTime : 0;
    }

    // ============================================================
    // 지연
    // ============================================================

    /**
     * 이 시도 직전의 지연 (첫 시도면 null).
     */
    public Double prevDelay() {
        return prevDelay;
    }

    public Double prevDelayInSeconds() {
        return in(prevDelay, UnitType.SECONDS);
    }

    public Double prevDelayInMs() {
        return in(prevDelay, UnitType.MILLISECONDS);
    }

    public Double prevDelayInUs() {
        return in(prevDelay, UnitType.MICROSECONDS);
    }

    /**
     * 이 시도 이후 예정된 지연 (마지막 시도면 null).
     */
    public Double nextDelay() {
        return nextDelay;
    }

    public Double nextDelayInSeconds() {
        return in(nextDelay, UnitType.SECONDS);
    }

    public Double nextDelayInMs() {
        return in(nextDelay, UnitType.MILLISECONDS);
    }

    public Double nextDelayInUs() {
        return in(nextDelay, UnitType.MICROSECONDS);
    }

    /**
     * 이 시도 전까지 실제로 대기한 지연의 합 (대기한 적이 없으면 null).
     */
    public Double overallDelay() {
        return overallDelay;
    }

    public Double overallDelayInSeconds() {
        return in(overallDelay, UnitType.SECONDS);
    }

    public Double overallDelayInMs() {
        return in(overallDelay, UnitType.MILLISECONDS);
    }

    public Double overallDelayInUs() {
        return in(overallDelay, UnitType.MICROSECONDS);
    }

    private Double in(Double value, UnitType target) {
        return TimeSpans.convert(value, unitType, target);
    }

    @Override
    public String toString() {
        return "AttemptLog{attemptNumber=" + attemptNumber
            + ", maxAttempts=" + maxAttempts
            + ", workingTime=" + workingTime
            + ", prevDelay=" + prevDelay
            + ", nextDelay=" + nextDelay
            + ", overallDelay=" + overallDelay
            + ", unit=" + unitType + "}";
    }
}
