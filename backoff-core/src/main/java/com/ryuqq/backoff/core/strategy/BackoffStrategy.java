package com.ryuqq.backoff.core.strategy;

import com.ryuqq.backoff.core.algorithm.BackoffAlgorithm;
import com.ryuqq.backoff.core.exception.BackoffRuntimeException;
import com.ryuqq.backoff.core.jitter.CallbackJitter;
import com.ryuqq.backoff.core.jitter.EqualJitter;
import com.ryuqq.backoff.core.jitter.FullJitter;
import com.ryuqq.backoff.core.jitter.Jitter;
import com.ryuqq.backoff.core.jitter.RangeJitter;
import com.ryuqq.backoff.core.unit.TimeSpans;
import com.ryuqq.backoff.core.unit.UnitType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Backoff 전략 (지연 계산 상태 머신).
 *
 * <p>알고리즘, jitter, 범위 제한, 단위, 루프 위치 설정을 바탕으로 시도별 지연을 계산하고,
 * 시도마다 {@link AttemptLog}를 남깁니다.</p>
 *
 * <p><strong>상태 전이:</strong> {@link StrategyState} 참고.</p>
 *
 * <p><strong>루프 끝에서 실행 (기본):</strong></p>
 * <pre>
 * BackoffStrategy strategy = new BackoffStrategy(new LinearBackoffAlgorithm(1)).maxAttempts(5);
 * do {
 *     strategy.startOfAttempt();
 *     boolean done = tryOnce();
 *     strategy.endOfAttempt();
 *     if (done) break;
 * } while (strategy.step());   // 지연: 1, 2, 3, 4
 * </pre>
 *
 * <p><strong>루프 시작에서 실행:</strong></p>
 * <pre>
 * strategy.runsAtStartOfLoop(true);
 * while (strategy.step()) {    // 첫 step()은 대기 없이 true
 *     ...
 * }
 * </pre>
 *
 * <p><strong>설정 고정:</strong></p>
 * <ul>
 *   <li>calculate, sleep, step, startOfAttempt, isLastAttempt, getDelay*, simulate* 호출 시 시작됨</li>
 *   <li>시작 이후 설정 메서드를 호출하면 {@link BackoffRuntimeException}</li>
 *   <li>{@link #reset()} 이후 다시 설정 가능</li>
 * </ul>
 *
 * <p><strong>로그 정리 시점:</strong> {@link #reset()}은 로그를 지우지 않습니다.
 * 리셋 이후 전략이 다시 시작될 때 비워집니다.</p>
 *
 * <p>스레드 안전하지 않습니다. 스레드마다 별도 인스턴스를 사용해야 합니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public class BackoffStrategy {

    private static final Logger log = LoggerFactory.getLogger(BackoffStrategy.class);

    private StrategyConfig config;
    private Clock clock = Clock.systemUTC();
    private Sleeper sleeper = DefaultSleeper.INSTANCE;
    private DelayTracker tracker;

    private boolean started;
    private boolean stopped;
    private Integer attemptNumber;
    private DelayCalculator calculator;
    private Double overallDelay;
    private Instant firstAttemptOccurredAt;
    private Long sleepAnchorNanos;
    private final List<AttemptLog> attemptLogs = new ArrayList<>();

    /**
     * 기본 설정으로 생성.
     *
     * @param algorithm 지연 계산 알고리즘
     * @throws IllegalArgumentException algorithm이 null인 경우
     */
    public BackoffStrategy(BackoffAlgorithm algorithm) {
        this(StrategyConfig.of(algorithm));
    }

    /**
     * 설정으로 생성.
     *
     * @param config 전략 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public BackoffStrategy(StrategyConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        reset();
    }

    // ============================================================
    // 설정 (시작 전에만 가능)
    // ============================================================

    public BackoffStrategy fullJitter() {
        return replaceConfig("fullJitter", config.withJitter(new FullJitter()));
    }

    public BackoffStrategy equalJitter() {
        return replaceConfig("equalJitter", config.withJitter(new EqualJitter()));
    }

    /**
     * 범위 jitter 설정.
     *
     * @param min 최소 비율
     * @param max 최대 비율
     * @return this
     * @throws com.ryuqq.backoff.core.exception.BackoffInitializationException min &gt; max 인 경우
     */
    public BackoffStrategy jitterRange(double min, double max) {
        ensureNotStarted("jitterRange");
        return replaceConfig("jitterRange", config.withJitter(new RangeJitter(min, max)));
    }

    public BackoffStrategy jitterCallback(CallbackJitter.JitterCallback callback) {
        ensureNotStarted("jitterCallback");
        return replaceConfig("jitterCallback", config.withJitter(new CallbackJitter(callback)));
    }

    public BackoffStrategy customJitter(Jitter jitter) {
        return replaceConfig("customJitter", config.withJitter(jitter));
    }

    public BackoffStrategy noJitter() {
        return replaceConfig("noJitter", config.withJitter(null));
    }

    /**
     * 최대 시도 횟수 설정.
     *
     * <p>0(또는 음수)이면 시작 전부터 중단 상태가 됩니다.</p>
     *
     * @param maxAttempts 최대 시도 횟수 (null이면 무제한)
     * @return this
     */
    public BackoffStrategy maxAttempts(Integer maxAttempts) {
        replaceConfig("maxAttempts", config.withMaxAttempts(maxAttempts));
        stopped = config.allowsNoAttempts();
        return this;
    }

    public BackoffStrategy noMaxAttempts() {
        replaceConfig("noMaxAttempts", config.withMaxAttempts(null));
        stopped = config.allowsNoAttempts();
        return this;
    }

    public BackoffStrategy noAttemptLimit() {
        replaceConfig("noAttemptLimit", config.withMaxAttempts(null));
        stopped = config.allowsNoAttempts();
        return this;
    }

    /**
     * 최대 지연 설정 (jitter 적용 후에도 적용).
     *
     * @param maxDelay 최대 지연 (설정 단위, null이면 무제한)
     * @return this
     */
    public BackoffStrategy maxDelay(Double maxDelay) {
        return replaceConfig("maxDelay", config.withMaxDelay(maxDelay));
    }

    public BackoffStrategy noMaxDelay() {
        return replaceConfig("noMaxDelay", config.withMaxDelay(null));
    }

    public BackoffStrategy noDelayLimit() {
        return replaceConfig("noDelayLimit", config.withMaxDelay(null));
    }

    /**
     * 단위 설정 (이름).
     *
     * @param unitType 단위 이름 ("seconds", "milliseconds", "microseconds")
     * @return this
     * @throws com.ryuqq.backoff.core.exception.BackoffInitializationException 알 수 없는 단위인 경우
     */
    public BackoffStrategy unit(String unitType) {
        ensureNotStarted("unit");
        return replaceConfig("unit", config.withUnit(UnitType.fromName(unitType)));
    }

    public BackoffStrategy unit(UnitType unitType) {
        return replaceConfig("unit", config.withUnit(unitType));
    }

    public BackoffStrategy unitSeconds() {
        return replaceConfig("unitSeconds", config.withUnit(UnitType.SECONDS));
    }

    public BackoffStrategy unitMs() {
        return replaceConfig("unitMs", config.withUnit(UnitType.MILLISECONDS));
    }

    public BackoffStrategy unitUs() {
        return replaceConfig("unitUs", config.withUnit(UnitType.MICROSECONDS));
    }

    public BackoffStrategy runsAtStartOfLoop(boolean runsAtStartOfLoop) {
        return replaceConfig("runsAtStartOfLoop", config.withRunsAtStartOfLoop(runsAtStartOfLoop));
    }

    public BackoffStrategy runsAtEndOfLoop() {
        return replaceConfig("runsAtEndOfLoop", config.withRunsAtStartOfLoop(false));
    }

    /**
     * 첫 재시도를 지연 없이 실행.
     *
     * <p>지연 0인 재시도가 추가되고, 알고리즘의 지연은 그 다음 재시도부터 적용됩니다.</p>
     *
     * @param immediateFirstRetry 활성화 여부
     * @return this
     */
    public BackoffStrategy immediateFirstRetry(boolean immediateFirstRetry) {
        return replaceConfig("immediateFirstRetry", config.withImmediateFirstRetry(immediateFirstRetry));
    }

    public BackoffStrategy noImmediateFirstRetry() {
        return replaceConfig("noImmediateFirstRetry", config.withImmediateFirstRetry(false));
    }

    /**
     * false이면 모든 지연을 0으로 만듭니다 (중단 조건은 유지).
     */
    public BackoffStrategy onlyDelayWhen(boolean condition) {
        return replaceConfig("onlyDelayWhen", config.withDelaysEnabled(condition));
    }

    /**
     * false이면 재시도하지 않습니다 (첫 시도만 실행).
     */
    public BackoffStrategy onlyRetryWhen(boolean condition) {
        return replaceConfig("onlyRetryWhen", config.withRetriesEnabled(condition));
    }

    /**
     * 시도 시각 측정에 사용할 시계 설정.
     *
     * @param clock 시계
     * @return this
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public BackoffStrategy clock(Clock clock) {
        ensureNotStarted("clock");
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
        return this;
    }

    /**
     * 대기 구현 설정.
     *
     * @param sleeper 대기 구현
     * @return this
     * @throws IllegalArgumentException sleeper가 null인 경우
     */
    public BackoffStrategy sleeper(Sleeper sleeper) {
        ensureNotStarted("sleeper");
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.sleeper = sleeper;
        return this;
    }

    // ============================================================
    // 진행
    // ============================================================

    /**
     * 다음 지연을 계산하고 대기.
     *
     * @return 다음 시도를 진행해야 하면 true
     */
    public boolean step() {
        sleepAnchorNanos = System.nanoTime();
        calculate();
        return sleep();
    }

    /**
     * 다음 시도 번호와 지연을 계산 (대기하지 않음).
     *
     * @return 다음 시도를 진행해야 하면 true
     */
    public boolean calculate() {
        start();
        if (stopped) {
            return false;
        }

        // 루프 시작 모드의 첫 호출은 첫 시도 전 슬롯 (지연 없음)
        if (config.runsAtStartOfLoop() && attemptNumber == null) {
            attemptNumber = 1;
            return true;
        }

        attemptNumber = (attemptNumber != null ? attemptNumber : 1) + 1;

        if (!config.retriesEnabled() || calculator.shouldStop(attemptNumber)) {
            stopped = true;
            log.debug("Backoff stopped before attempt {} (maxAttempts: {})", attemptNumber, config.maxAttempts());
            return false;
        }
        log.debug("Delay before attempt {}: {} {}", attemptNumber, calculator.jitteredDelay(attemptNumber), config.unit());
        return true;
    }

    /**
     * 계산된 지연만큼 대기.
     *
     * @return 다음 시도를 진행해야 하면 true
     * @throws BackoffRuntimeException 대기 중 인터럽트된 경우
     */
    public boolean sleep() {
        long anchor = sleepAnchorNanos != null ? sleepAnchorNanos : System.nanoTime();
        sleepAnchorNanos = null;

        start();
        if (tracker != null) {
            tracker.recordSleepCall();
        }
        if (stopped) {
            return false;
        }

        Double delay = getDelay();
        if (tracker != null) {
            tracker.recordDelay(delay, getDelayInSeconds(), getDelayInMs(), getDelayInUs());
        }
        if (delay == null) {
            return true;
        }

        overallDelay = (overallDelay != null ? overallDelay : 0) + delay;

        long nanos = TimeSpans.toNanos(delay, config.unit());
        if (tracker != null) {
            tracker.recordSleep(nanos);
        } else {
            sleeper.sleep(nanos - (System.nanoTime() - anchor));
        }
        return true;
    }

    /**
     * 초기 상태로 되돌림.
     *
     * <p>로그는 지우지 않으며, 다음 시작 시점에 비워집니다. 설치된 tracker는 제거됩니다.</p>
     *
     * @return this
     */
    public BackoffStrategy reset() {
        started = false;
        stopped = config.allowsNoAttempts();
        attemptNumber = null;
        calculator = null;
        overallDelay = null;
        firstAttemptOccurredAt = null;
        sleepAnchorNanos = null;
        tracker = null;
        return this;
    }

    // ============================================================
    // 시도 기록
    // ============================================================

    /**
     * 시도 시작 기록.
     *
     * <p>첫 시도이면 기존 로그를 비웁니다. 직전 시도가 아직 종료 기록되지 않았다면 지금 시각으로 종료합니다.</p>
     *
     * @return 새 시도 로그
     * @throws BackoffRuntimeException 전략이 중단된 경우
     */
    public AttemptLog startOfAttempt() {
        start();
        if (stopped) {
            throw BackoffRuntimeException.startOfAttemptNotAllowed();
        }

        Instant now = clock.instant();
        int currentAttempt = currentAttemptNumber();

        if (currentAttempt <= 1) {
            attemptLogs.clear();
            firstAttemptOccurredAt = now;
        } else {
            finishLastAttempt(now);
            if (firstAttemptOccurredAt == null) {
                firstAttemptOccurredAt = now;
            }
        }

        AttemptLog attemptLog = new AttemptLog(
            currentAttempt,
            config.maxAttempts(),
            firstAttemptOccurredAt,
            now,
            calculator.jitteredDelay(currentAttempt),
            calculator.jitteredDelay(currentAttempt + 1),
            overallDelay,
            config.unit()
        );

        // 같은 시도 번호로 다시 호출되면 교체
        if (!attemptLogs.isEmpty() && lastLog().attemptNumber() == currentAttempt) {
            attemptLogs.set(attemptLogs.size() - 1, attemptLog);
        } else {
            attemptLogs.add(attemptLog);
        }
        return attemptLog;
    }

    /**
     * 시도 종료 기록.
     *
     * <p>작업 시간은 첫 호출에서만 확정됩니다.</p>
     *
     * @return 현재 시도 로그
     * @throws BackoffRuntimeException startOfAttempt()가 먼저 호출되지 않은 경우
     */
    public AttemptLog endOfAttempt() {
        Instant now = clock.instant();
        if (!started || attemptLogs.isEmpty() || lastLog().attemptNumber() != currentAttemptNumber()) {
            throw BackoffRuntimeException.attemptLogHasNotStarted();
        }
        finishLastAttempt(now);
        return lastLog();
    }

    /**
     * 시도 로그 목록 (시도 순서).
     *
     * @return 불변 복사본
     */
    public List<AttemptLog> logs() {
        return Collections.unmodifiableList(new ArrayList<>(attemptLogs));
    }

    /**
     * 현재 시도 로그.
     *
     * @return 현재 로그 (시작 전, 중단 후, 기록 없음이면 null)
     */
    public AttemptLog currentLog() {
        if (!started || stopped || attemptLogs.isEmpty()) {
            return null;
        }
        return lastLog();
    }

    // ============================================================
    // 조회
    // ============================================================

    public boolean hasStopped() {
        return stopped;
    }

    /**
     * 현재 시도 번호.
     *
     * @return 시도 번호 (아직 계산 전이면 1)
     */
    public int currentAttemptNumber() {
        return attemptNumber != null ? attemptNumber : 1;
    }

    public boolean isFirstAttempt() {
        return currentAttemptNumber() == 1;
    }

    /**
     * 현재 시도가 마지막인지 확인.
     *
     * @return 중단되었거나 다음 시도가 없으면 true
     */
    public boolean isLastAttempt() {
        start();
        if (stopped || !config.retriesEnabled()) {
            return true;
        }
        return calculator.shouldStop(currentAttemptNumber() + 1);
    }

    /**
     * 현재 시도 직전의 지연.
     *
     * @return 지연 (설정 단위, 중단되었거나 지연이 없으면 null)
     */
    public Double getDelay() {
        start();
        if (stopped) {
            return null;
        }
        return calculator.jitteredDelay(currentAttemptNumber());
    }

    public Double getDelayInSeconds() {
        return TimeSpans.convert(getDelay(), config.unit(), UnitType.SECONDS);
    }

    public Double getDelayInMs() {
        return TimeSpans.convert(getDelay(), config.unit(), UnitType.MILLISECONDS);
    }

    public Double getDelayInUs() {
        return TimeSpans.convert(getDelay(), config.unit(), UnitType.MICROSECONDS);
    }

    /**
     * 재시도 번호의 지연 미리보기.
     *
     * <p>시도 번호와 로그는 바꾸지 않지만, 전략은 시작 상태가 되어 설정이 고정됩니다.
     * 같은 재시도 번호는 이후 실제 진행에서도 같은 지연을 사용합니다.</p>
     *
     * @param retryNumber 재시도 번호 (1부터 시작)
     * @return 지연 (설정 단위, 범위 밖이면 null)
     */
    public Double simulate(int retryNumber) {
        start();
        if (retryNumber < 1) {
            return null;
        }
        return calculator.jitteredDelay(retryNumber + 1);
    }

    /**
     * 재시도 번호 범위의 지연 미리보기.
     *
     * @param fromRetryNumber 시작 재시도 번호 (포함)
     * @param toRetryNumber 끝 재시도 번호 (포함)
     * @return 재시도 번호 → 지연 (유효하지 않은 범위면 빈 맵)
     */
    public SortedMap<Integer, Double> simulate(int fromRetryNumber, int toRetryNumber) {
        return simulateIn(fromRetryNumber, toRetryNumber, config.unit());
    }

    public Double simulateInSeconds(int retryNumber) {
        return TimeSpans.convert(simulate(retryNumber), config.unit(), UnitType.SECONDS);
    }

    public Double simulateInMs(int retryNumber) {
        return TimeSpans.convert(simulate(retryNumber), config.unit(), UnitType.MILLISECONDS);
    }

    public Double simulateInUs(int retryNumber) {
        return TimeSpans.convert(simulate(retryNumber), config.unit(), UnitType.MICROSECONDS);
    }

    public SortedMap<Integer, Double> simulateInSeconds(int fromRetryNumber, int toRetryNumber) {
        return simulateIn(fromRetryNumber, toRetryNumber, UnitType.SECONDS);
    }

    public SortedMap<Integer, Double> simulateInMs(int fromRetryNumber, int toRetryNumber) {
        return simulateIn(fromRetryNumber, toRetryNumber, UnitType.MILLISECONDS);
    }

    public SortedMap<Integer, Double> simulateInUs(int fromRetryNumber, int toRetryNumber) {
        return simulateIn(fromRetryNumber, toRetryNumber, UnitType.MICROSECONDS);
    }

    public UnitType getUnitType() {
        return config.unit();
    }

    public StrategyState state() {
        return StrategyState.of(started, stopped);
    }

    /**
     * 현재 설정 스냅샷.
     */
    public StrategyConfig config() {
        return config;
    }

    // ============================================================
    // 측정
    // ============================================================

    /**
     * 실제로 대기하지 않고 지연을 기록하는 tracker 설치.
     *
     * <p>{@link #reset()} 시 제거됩니다.</p>
     *
     * @return 설치된 tracker
     */
    public DelayTracker useTracker() {
        tracker = new DelayTracker();
        return tracker;
    }

    /**
     * tracker를 설치하고 최대 maxSteps번 step()을 실행.
     *
     * @param maxSteps 최대 step 수
     * @return 기록된 tracker
     */
    public DelayTracker generateTestSequence(int maxSteps) {
        DelayTracker sequence = useTracker();
        for (int count = 0; count < maxSteps; count++) {
            if (!step()) {
                break;
            }
        }
        return sequence;
    }

    // ============================================================
    // 내부
    // ============================================================

    private void start() {
        if (started) {
            return;
        }
        started = true;
        attemptLogs.clear();
        calculator = new DelayCalculator(config);
        log.debug("Backoff strategy started: {}", config);
    }

    private BackoffStrategy replaceConfig(String method, StrategyConfig newConfig) {
        ensureNotStarted(method);
        this.config = newConfig;
        return this;
    }

    private void ensureNotStarted(String method) {
        if (started) {
            throw BackoffRuntimeException.attemptToChangeAfterStart(method);
        }
    }

    private void finishLastAttempt(Instant endedAt) {
        if (attemptLogs.isEmpty()) {
            return;
        }
        int lastIndex = attemptLogs.size() - 1;
        Double previousOverall = lastIndex > 0 ? attemptLogs.get(lastIndex - 1).overallWorkingTime() : null;
        AttemptLog last = attemptLogs.get(lastIndex);
        if (last.finish(endedAt, previousOverall)) {
            log.debug("Attempt {} finished in {} {}", last.attemptNumber(), last.workingTime(), last.unitType());
        }
    }

    private AttemptLog lastLog() {
        return attemptLogs.get(attemptLogs.size() - 1);
    }

    private SortedMap<Integer, Double> simulateIn(int fromRetryNumber, int toRetryNumber, UnitType unitType) {
        start();
        SortedMap<Integer, Double> delays = new TreeMap<>();
        if (fromRetryNumber < 1 || toRetryNumber < fromRetryNumber) {
            return Collections.unmodifiableSortedMap(delays);
        }
        for (int retryNumber = fromRetryNumber; retryNumber <= toRetryNumber; retryNumber++) {
            delays.put(retryNumber, TimeSpans.convert(calculator.jitteredDelay(retryNumber + 1), config.unit(), unitType));
        }
        return Collections.unmodifiableSortedMap(delays);
    }
}
