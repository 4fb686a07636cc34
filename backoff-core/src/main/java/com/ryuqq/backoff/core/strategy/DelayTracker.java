package com.ryuqq.backoff.core.strategy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 대기 기록기.
 *
 * <p>{@link BackoffStrategy#useTracker()}로 설치하면 전략은 실제로 대기하지 않고
 * 요청된 지연을 이 객체에 기록합니다. 측정과 테스트 용도입니다.</p>
 *
 * <p><strong>기록 항목:</strong></p>
 * <ul>
 *   <li>sleep() 호출마다 계산된 지연 (설정 단위, 초, 밀리초, 마이크로초)</li>
 *   <li>sleep() 호출 횟수</li>
 *   <li>실제로 대기가 필요했던 횟수</li>
 *   <li>요청된 총 대기 시간 (나노초)</li>
 * </ul>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class DelayTracker {

    private final List<Double> delays = new ArrayList<>();
    private final List<Double> delaysInSeconds = new ArrayList<>();
    private final List<Double> delaysInMs = new ArrayList<>();
    private final List<Double> delaysInUs = new ArrayList<>();
    private int sleepCallCount;
    private int actualTimesSlept;
    private long totalRequestedNanos;

    void recordSleepCall() {
        sleepCallCount++;
    }

    void recordDelay(Double delay, Double inSeconds, Double inMs, Double inUs) {
        delays.add(delay);
        delaysInSeconds.add(inSeconds);
        delaysInMs.add(inMs);
        delaysInUs.add(inUs);
    }

    void recordSleep(long nanos) {
        actualTimesSlept++;
        totalRequestedNanos += Math.max(0, nanos);
    }

    /**
     * 기록된 지연 (설정 단위). 아직 지연이 없던 호출은 null로 기록됩니다.
     */
    public List<Double> delays() {
        return Collections.unmodifiableList(delays);
    }

    public List<Double> delaysInSeconds() {
        return Collections.unmodifiableList(delaysInSeconds);
    }

    public List<Double> delaysInMs() {
        return Collections.unmodifiableList(delaysInMs);
    }

    public List<Double> delaysInUs() {
        return Collections.unmodifiableList(delaysInUs);
    }

    public int sleepCallCount() {
        return sleepCallCount;
    }

    public int actualTimesSlept() {
        return actualTimesSlept;
    }

    public long totalRequestedNanos() {
        return totalRequestedNanos;
    }
}
