package com.ryuqq.backoff.runner;

import com.ryuqq.backoff.core.algorithm.BackoffAlgorithm;
import com.ryuqq.backoff.core.algorithm.CallbackBackoffAlgorithm;
import com.ryuqq.backoff.core.algorithm.DecorrelatedBackoffAlgorithm;
import com.ryuqq.backoff.core.algorithm.ExponentialBackoffAlgorithm;
import com.ryuqq.backoff.core.algorithm.FibonacciBackoffAlgorithm;
import com.ryuqq.backoff.core.algorithm.FixedBackoffAlgorithm;
import com.ryuqq.backoff.core.algorithm.LinearBackoffAlgorithm;
import com.ryuqq.backoff.core.algorithm.NoBackoffAlgorithm;
import com.ryuqq.backoff.core.algorithm.NoopBackoffAlgorithm;
import com.ryuqq.backoff.core.algorithm.PolynomialBackoffAlgorithm;
import com.ryuqq.backoff.core.algorithm.RandomBackoffAlgorithm;
import com.ryuqq.backoff.core.algorithm.SequenceBackoffAlgorithm;
import com.ryuqq.backoff.core.jitter.CallbackJitter;
import com.ryuqq.backoff.core.jitter.Jitter;
import com.ryuqq.backoff.core.strategy.AttemptLog;
import com.ryuqq.backoff.core.strategy.BackoffStrategy;
import com.ryuqq.backoff.core.strategy.Sleeper;
import com.ryuqq.backoff.core.unit.UnitType;
import com.ryuqq.backoff.runner.callback.ExceptionCallback;
import com.ryuqq.backoff.runner.callback.FailureCallback;
import com.ryuqq.backoff.runner.callback.FinallyCallback;
import com.ryuqq.backoff.runner.callback.InvalidResultCallback;
import com.ryuqq.backoff.runner.callback.SuccessCallback;
import com.ryuqq.backoff.runner.matcher.ExceptionMatch;
import com.ryuqq.backoff.runner.matcher.ExceptionMatcher;
import com.ryuqq.backoff.runner.matcher.ExceptionMatchers;
import com.ryuqq.backoff.runner.matcher.ExceptionPredicate;
import com.ryuqq.backoff.runner.matcher.ResultCheck;
import com.ryuqq.backoff.runner.matcher.ResultMatcher;
import com.ryuqq.backoff.runner.matcher.ResultMatchers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 재시도 실행기.
 *
 * <p>{@link BackoffStrategy} 하나를 감싸 작업을 반복 실행하고, 예외/결과 matcher로 재시도 여부를 판단하며,
 * 이벤트마다 콜백을 호출합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * String body = Backoff.exponentialMs(100)
 *     .maxAttempts(5)
 *     .retryExceptions(IOException.class)
 *     .retryWhen(null)
 *     .exceptionCallback((e, willRetry, log, logs) -&gt; audit(e, log))
 *     .attempt(() -&gt; client.fetch(url), "fallback");
 * </pre>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <ol>
 *   <li>전략 리셋 후 루프 시작 모드로 실행 (실행이 끝나면 원래 모드로 복원)</li>
 *   <li>시도마다 startOfAttempt / endOfAttempt 기록</li>
 *   <li>예외는 예외 matcher, 결과는 결과 matcher로 평가</li>
 *   <li>재시도 대상이고 마지막 시도가 아니면 대기 후 다시 시도</li>
 *   <li>성공 시 success 콜백, 아니면 failure 콜백</li>
 *   <li>기본값 결정: 일치한 matcher의 기본값 → attempt() 기본값 → 예외 재전파 또는 마지막 결과 반환</li>
 *   <li>finally 콜백은 항상 한 번 호출 (콜백 예외가 진행 중인 예외를 대체)</li>
 * </ol>
 *
 * <p>{@link Exception}만 처리하며 {@link Error}는 그대로 전파됩니다.
 * 같은 인스턴스로 attempt()를 여러 번 호출할 수 있지만 스레드 안전하지 않습니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class Backoff {

    private static final Logger log = LoggerFactory.getLogger(Backoff.class);

    private final BackoffStrategy strategy;
    private final ExceptionMatchers exceptionMatchers = new ExceptionMatchers();
    private final ResultMatchers resultMatchers = new ResultMatchers();

    private final List<ExceptionCallback> exceptionCallbacks = new ArrayList<>();
    private final List<InvalidResultCallback> invalidResultCallbacks = new ArrayList<>();
    private final List<SuccessCallback> successCallbacks = new ArrayList<>();
    private final List<FailureCallback> failureCallbacks = new ArrayList<>();
    private final List<FinallyCallback> finallyCallbacks = new ArrayList<>();

    private RunnerState runnerState = RunnerState.IDLE;

    private Backoff(BackoffStrategy strategy) {
        this.strategy = strategy;
    }

    /**
     * 기존 전략으로 생성.
     *
     * @param strategy 전략
     * @return Backoff
     * @throws IllegalArgumentException strategy가 null인 경우
     */
    public static Backoff of(BackoffStrategy strategy) {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        return new Backoff(strategy);
    }

    // ============================================================
    // 팩토리 (jitter 적용)
    // ============================================================

    public static Backoff fixed(double delay) {
        return jittered(new FixedBackoffAlgorithm(delay), UnitType.SECONDS);
    }

    public static Backoff fixedMs(double delay) {
        return jittered(new FixedBackoffAlgorithm(delay), UnitType.MILLISECONDS);
    }

    public static Backoff fixedUs(double delay) {
        return jittered(new FixedBackoffAlgorithm(delay), UnitType.MICROSECONDS);
    }

    public static Backoff linear(double initialDelay) {
        return jittered(new LinearBackoffAlgorithm(initialDelay), UnitType.SECONDS);
    }

    public static Backoff linear(double initialDelay, Double delayIncrease) {
        return jittered(new LinearBackoffAlgorithm(initialDelay, delayIncrease), UnitType.SECONDS);
    }

    public static Backoff linearMs(double initialDelay) {
        return jittered(new LinearBackoffAlgorithm(initialDelay), UnitType.MILLISECONDS);
    }

    public static Backoff linearMs(double initialDelay, Double delayIncrease) {
        return jittered(new LinearBackoffAlgorithm(initialDelay, delayIncrease), UnitType.MILLISECONDS);
    }

    public static Backoff linearUs(double initialDelay) {
        return jittered(new LinearBackoffAlgorithm(initialDelay), UnitType.MICROSECONDS);
    }

    public static Backoff linearUs(double initialDelay, Double delayIncrease) {
        return jittered(new LinearBackoffAlgorithm(initialDelay, delayIncrease), UnitType.MICROSECONDS);
    }

    public static Backoff exponential(double initialDelay) {
        return jittered(new ExponentialBackoffAlgorithm(initialDelay), UnitType.SECONDS);
    }

    public static Backoff exponential(double initialDelay, double factor) {
        return jittered(new ExponentialBackoffAlgorithm(initialDelay, factor), UnitType.SECONDS);
    }

    public static Backoff exponentialMs(double initialDelay) {
        return jittered(new ExponentialBackoffAlgorithm(initialDelay), UnitType.MILLISECONDS);
    }

    public static Backoff exponentialMs(double initialDelay, double factor) {
        return jittered(new ExponentialBackoffAlgorithm(initialDelay, factor), UnitType.MILLISECONDS);
    }

    public static Backoff exponentialUs(double initialDelay) {
        return jittered(new ExponentialBackoffAlgorithm(initialDelay), UnitType.MICROSECONDS);
    }

    public static Backoff exponentialUs(double initialDelay, double factor) {
        return jittered(new ExponentialBackoffAlgorithm(initialDelay, factor), UnitType.MICROSECONDS);
    }

    public static Backoff polynomial(double initialDelay) {
        return jittered(new PolynomialBackoffAlgorithm(initialDelay), UnitType.SECONDS);
    }

    public static Backoff polynomial(double initialDelay, double power) {
        return jittered(new PolynomialBackoffAlgorithm(initialDelay, power), UnitType.SECONDS);
    }

    public static Backoff polynomialMs(double initialDelay) {
        return jittered(new PolynomialBackoffAlgorithm(initialDelay), UnitType.MILLISECONDS);
    }

    public static Backoff polynomialMs(double initialDelay, double power) {
        return jittered(new PolynomialBackoffAlgorithm(initialDelay, power), UnitType.MILLISECONDS);
    }

    public static Backoff polynomialUs(double initialDelay) {
        return jittered(new PolynomialBackoffAlgorithm(initialDelay), UnitType.MICROSECONDS);
    }

    public static Backoff polynomialUs(double initialDelay, double power) {
        return jittered(new PolynomialBackoffAlgorithm(initialDelay, power), UnitType.MICROSECONDS);
    }

    public static Backoff fibonacci(double initialDelay) {
        return jittered(new FibonacciBackoffAlgorithm(initialDelay), UnitType.SECONDS);
    }

    public static Backoff fibonacci(double initialDelay, boolean includeFirst) {
        return jittered(new FibonacciBackoffAlgorithm(initialDelay, includeFirst), UnitType.SECONDS);
    }

    public static Backoff fibonacciMs(double initialDelay) {
        return jittered(new FibonacciBackoffAlgorithm(initialDelay), UnitType.MILLISECONDS);
    }

    public static Backoff fibonacciMs(double initialDelay, boolean includeFirst) {
        return jittered(new FibonacciBackoffAlgorithm(initialDelay, includeFirst), UnitType.MILLISECONDS);
    }

    public static Backoff fibonacciUs(double initialDelay) {
        return jittered(new FibonacciBackoffAlgorithm(initialDelay), UnitType.MICROSECONDS);
    }

    public static Backoff fibonacciUs(double initialDelay, boolean includeFirst) {
        return jittered(new FibonacciBackoffAlgorithm(initialDelay, includeFirst), UnitType.MICROSECONDS);
    }

    public static Backoff sequence(List<Double> delays) {
        return jittered(new SequenceBackoffAlgorithm(delays), UnitType.SECONDS);
    }

    public static Backoff sequence(List<Double> delays, Double fallbackDelay) {
        return jittered(new SequenceBackoffAlgorithm(delays, fallbackDelay), UnitType.SECONDS);
    }

    public static Backoff sequence(List<Double> delays, boolean repeatLast) {
        return jittered(sequenceAlgorithm(delays, repeatLast), UnitType.SECONDS);
    }

    public static Backoff sequenceMs(List<Double> delays) {
        return jittered(new SequenceBackoffAlgorithm(delays), UnitType.MILLISECONDS);
    }

    public static Backoff sequenceMs(List<Double> delays, Double fallbackDelay) {
        return jittered(new SequenceBackoffAlgorithm(delays, fallbackDelay), UnitType.MILLISECONDS);
    }

    public static Backoff sequenceMs(List<Double> delays, boolean repeatLast) {
        return jittered(sequenceAlgorithm(delays, repeatLast), UnitType.MILLISECONDS);
    }

    public static Backoff sequenceUs(List<Double> delays) {
        return jittered(new SequenceBackoffAlgorithm(delays), UnitType.MICROSECONDS);
    }

    public static Backoff sequenceUs(List<Double> delays, Double fallbackDelay) {
        return jittered(new SequenceBackoffAlgorithm(delays, fallbackDelay), UnitType.MICROSECONDS);
    }

    public static Backoff sequenceUs(List<Double> delays, boolean repeatLast) {
        return jittered(sequenceAlgorithm(delays, repeatLast), UnitType.MICROSECONDS);
    }

    public static Backoff callback(CallbackBackoffAlgorithm.DelayCallback callback) {
        return jittered(new CallbackBackoffAlgorithm(callback), UnitType.SECONDS);
    }

    public static Backoff callbackMs(CallbackBackoffAlgorithm.DelayCallback callback) {
        return jittered(new CallbackBackoffAlgorithm(callback), UnitType.MILLISECONDS);
    }

    public static Backoff callbackUs(CallbackBackoffAlgorithm.DelayCallback callback) {
        return jittered(new CallbackBackoffAlgorithm(callback), UnitType.MICROSECONDS);
    }

    public static Backoff custom(BackoffAlgorithm algorithm) {
        return jittered(algorithm, UnitType.SECONDS);
    }

    public static Backoff customMs(BackoffAlgorithm algorithm) {
        return jittered(algorithm, UnitType.MILLISECONDS);
    }

    public static Backoff customUs(BackoffAlgorithm algorithm) {
        return jittered(algorithm, UnitType.MICROSECONDS);
    }

    // ============================================================
    // 팩토리 (jitter 미적용)
    // ============================================================

    public static Backoff decorrelated(double baseDelay) {
        return plain(new DecorrelatedBackoffAlgorithm(baseDelay), UnitType.SECONDS);
    }

    public static Backoff decorrelated(double baseDelay, double multiplier) {
        return plain(new DecorrelatedBackoffAlgorithm(baseDelay, multiplier), UnitType.SECONDS);
    }

    public static Backoff decorrelatedMs(double baseDelay) {
        return plain(new DecorrelatedBackoffAlgorithm(baseDelay), UnitType.MILLISECONDS);
    }

    public static Backoff decorrelatedMs(double baseDelay, double multiplier) {
        return plain(new DecorrelatedBackoffAlgorithm(baseDelay, multiplier), UnitType.MILLISECONDS);
    }

    public static Backoff decorrelatedUs(double baseDelay) {
        return plain(new DecorrelatedBackoffAlgorithm(baseDelay), UnitType.MICROSECONDS);
    }

    public static Backoff decorrelatedUs(double baseDelay, double multiplier) {
        return plain(new DecorrelatedBackoffAlgorithm(baseDelay, multiplier), UnitType.MICROSECONDS);
    }

    public static Backoff random(double min, double max) {
        return plain(new RandomBackoffAlgorithm(min, max), UnitType.SECONDS);
    }

    public static Backoff randomMs(double min, double max) {
        return plain(new RandomBackoffAlgorithm(min, max), UnitType.MILLISECONDS);
    }

    public static Backoff randomUs(double min, double max) {
        return plain(new RandomBackoffAlgorithm(min, max), UnitType.MICROSECONDS);
    }

    /**
     * 지연 0으로 재시도.
     */
    public static Backoff noop() {
        return plain(new NoopBackoffAlgorithm(), UnitType.SECONDS);
    }

    /**
     * 재시도 없음 (첫 시도만 실행).
     */
    public static Backoff none() {
        return plain(new NoBackoffAlgorithm(), UnitType.SECONDS);
    }

    private static Backoff jittered(BackoffAlgorithm algorithm, UnitType unit) {
        return new Backoff(new BackoffStrategy(algorithm).fullJitter().unit(unit));
    }

    private static Backoff plain(BackoffAlgorithm algorithm, UnitType unit) {
        return new Backoff(new BackoffStrategy(algorithm).noJitter().unit(unit));
    }

    private static SequenceBackoffAlgorithm sequenceAlgorithm(List<Double> delays, boolean repeatLast) {
        return repeatLast ? SequenceBackoffAlgorithm.repeatingLast(delays) : new SequenceBackoffAlgorithm(delays);
    }

    // ============================================================
    // 전략 설정 위임
    // ============================================================

    public Backoff fullJitter() {
        strategy.fullJitter();
        return this;
    }

    public Backoff equalJitter() {
        strategy.equalJitter();
        return this;
    }

    public Backoff jitterRange(double min, double max) {
        strategy.jitterRange(min, max);
        return this;
    }

    public Backoff jitterCallback(CallbackJitter.JitterCallback callback) {
        strategy.jitterCallback(callback);
        return this;
    }

    public Backoff customJitter(Jitter jitter) {
        strategy.customJitter(jitter);
        return this;
    }

    public Backoff noJitter() {
        strategy.noJitter();
        return this;
    }

    public Backoff maxAttempts(Integer maxAttempts) {
        strategy.maxAttempts(maxAttempts);
        return this;
    }

    public Backoff noMaxAttempts() {
        strategy.noMaxAttempts();
        return this;
    }

    public Backoff noAttemptLimit() {
        strategy.noAttemptLimit();
        return this;
    }

    public Backoff maxDelay(Double maxDelay) {
        strategy.maxDelay(maxDelay);
        return this;
    }

    public Backoff noMaxDelay() {
        strategy.noMaxDelay();
        return this;
    }

    public Backoff noDelayLimit() {
        strategy.noDelayLimit();
        return this;
    }

    public Backoff unit(String unitType) {
        strategy.unit(unitType);
        return this;
    }

    public Backoff unit(UnitType unitType) {
        strategy.unit(unitType);
        return this;
    }

    public Backoff unitSeconds() {
        strategy.unitSeconds();
        return this;
    }

    public Backoff unitMs() {
        strategy.unitMs();
        return this;
    }

    public Backoff unitUs() {
        strategy.unitUs();
        return this;
    }

    public Backoff immediateFirstRetry(boolean immediateFirstRetry) {
        strategy.immediateFirstRetry(immediateFirstRetry);
        return this;
    }

    public Backoff noImmediateFirstRetry() {
        strategy.noImmediateFirstRetry();
        return this;
    }

    public Backoff onlyDelayWhen(boolean condition) {
        strategy.onlyDelayWhen(condition);
        return this;
    }

    public Backoff onlyRetryWhen(boolean condition) {
        strategy.onlyRetryWhen(condition);
        return this;
    }

    public Backoff clock(Clock clock) {
        strategy.clock(clock);
        return this;
    }

    public Backoff sleeper(Sleeper sleeper) {
        strategy.sleeper(sleeper);
        return this;
    }

    // ============================================================
    // 예외 matcher
    // ============================================================

    /**
     * 주어진 타입의 예외를 재시도 (누적).
     *
     * <p>타입 없이 호출하면 모든 예외를 재시도합니다.</p>
     *
     * @param types 재시도할 예외 타입
     * @return this
     */
    @SafeVarargs
    public final Backoff retryExceptions(Class<? extends Exception>... types) {
        if (types == null || types.length == 0) {
            exceptionMatchers.add(ExceptionMatcher.all(null));
            return this;
        }
        for (Class<? extends Exception> type : types) {
            exceptionMatchers.add(ExceptionMatcher.ofType(type, null));
        }
        return this;
    }

    /**
     * 주어진 타입의 예외를 재시도하고, 재시도가 모두 실패하면 기본값 반환.
     */
    public Backoff retryExceptions(Class<? extends Exception> type, DefaultValue<?> defaultValue) {
        exceptionMatchers.add(ExceptionMatcher.ofType(type, defaultValue));
        return this;
    }

    public Backoff retryExceptionsWhen(ExceptionPredicate predicate) {
        return retryExceptionsWhen(predicate, null);
    }

    public Backoff retryExceptionsWhen(ExceptionPredicate predicate, DefaultValue<?> defaultValue) {
        exceptionMatchers.add(ExceptionMatcher.when(predicate, defaultValue));
        return this;
    }

    public Backoff retryAllExceptions() {
        return retryAllExceptions(null);
    }

    public Backoff retryAllExceptions(DefaultValue<?> defaultValue) {
        exceptionMatchers.add(ExceptionMatcher.all(defaultValue));
        return this;
    }

    /**
     * 예외를 재시도하지 않음 (기존 예외 matcher 제거).
     */
    public Backoff dontRetryExceptions() {
        return dontRetryExceptions(null);
    }

    /**
     * 예외를 재시도하지 않고, 예외 발생 시 기본값 반환.
     *
     * @param defaultValue 기본값 (nullable)
     * @return this
     */
    public Backoff dontRetryExceptions(DefaultValue<?> defaultValue) {
        exceptionMatchers.disable(defaultValue);
        return this;
    }

    // ============================================================
    // 결과 matcher
    // ============================================================

    /**
     * 결과가 값과 일치하면 재시도 (loose 비교).
     */
    public Backoff retryWhen(Object value) {
        return retryWhen(value, false, null);
    }

    public Backoff retryWhen(Object value, boolean strict) {
        return retryWhen(value, strict, null);
    }

    /**
     * 결과가 값과 일치하면 재시도하고, 재시도가 모두 실패하면 기본값 반환.
     *
     * <p>retryUntil 설정은 제거됩니다.</p>
     *
     * @param value 비교 값
     * @param strict strict 비교 여부
     * @param defaultValue 기본값 (nullable)
     * @return this
     */
    public Backoff retryWhen(Object value, boolean strict, DefaultValue<?> defaultValue) {
        resultMatchers.retryWhen(ResultMatcher.value(value, strict, defaultValue));
        return this;
    }

    public Backoff retryWhenMatches(Predicate<Object> predicate) {
        return retryWhenMatches(predicate, null);
    }

    public Backoff retryWhenMatches(Predicate<Object> predicate, DefaultValue<?> defaultValue) {
        resultMatchers.retryWhen(ResultMatcher.when(predicate, defaultValue));
        return this;
    }

    /**
     * 결과가 값과 일치할 때까지 재시도 (loose 비교).
     *
     * <p>retryWhen 설정은 제거됩니다.</p>
     */
    public Backoff retryUntil(Object value) {
        return retryUntil(value, false);
    }

    public Backoff retryUntil(Object value, boolean strict) {
        resultMatchers.retryUntil(ResultMatcher.value(value, strict, null));
        return this;
    }

    public Backoff retryUntilMatches(Predicate<Object> predicate) {
        resultMatchers.retryUntil(ResultMatcher.when(predicate, null));
        return this;
    }

    // ============================================================
    // 콜백
    // ============================================================

    public Backoff exceptionCallback(ExceptionCallback... callbacks) {
        addAll(exceptionCallbacks, callbacks);
        return this;
    }

    public Backoff invalidResultCallback(InvalidResultCallback... callbacks) {
        addAll(invalidResultCallbacks, callbacks);
        return this;
    }

    public Backoff successCallback(SuccessCallback... callbacks) {
        addAll(successCallbacks, callbacks);
        return this;
    }

    public Backoff failureCallback(FailureCallback... callbacks) {
        addAll(failureCallbacks, callbacks);
        return this;
    }

    /**
     * {@link #failureCallback(FailureCallback...)}와 동일.
     */
    public Backoff fallbackCallback(FailureCallback... callbacks) {
        return failureCallback(callbacks);
    }

    public Backoff finallyCallback(FinallyCallback... callbacks) {
        addAll(finallyCallbacks, callbacks);
        return this;
    }

    // ============================================================
    // 실행
    // ============================================================

    /**
     * 작업 실행.
     *
     * @param operation 작업
     * @param <T> 결과 타입
     * @param <E> 작업 예외 타입
     * @return 결과 또는 matcher 기본값
     * @throws E 재시도가 모두 실패하고 기본값이 없는 경우 마지막 예외 (같은 인스턴스)
     */
    public <T, E extends Exception> T attempt(Attemptable<T, E> operation) throws E {
        return run(operation, null);
    }

    /**
     * 작업 실행 (기본값 지정).
     *
     * @param operation 작업
     * @param defaultValue 실패 시 반환할 값 (matcher 기본값이 우선)
     * @param <T> 결과 타입
     * @param <E> 작업 예외 타입
     * @return 결과 또는 기본값 (예외는 전파되지 않음)
     * @throws E 선언상 예외 타입
     */
    public <T, E extends Exception> T attempt(Attemptable<T, E> operation, T defaultValue) throws E {
        return run(operation, DefaultValue.of(defaultValue));
    }

    /**
     * 작업 실행 (기본값은 실패 시에만 계산).
     */
    public <T, E extends Exception> T attemptOrElseGet(Attemptable<T, E> operation, Supplier<? extends T> defaultSupplier) throws E {
        return run(operation, DefaultValue.from(defaultSupplier));
    }

    // ============================================================
    // 조회
    // ============================================================

    public BackoffStrategy strategy() {
        return strategy;
    }

    /**
     * 마지막 실행의 시도 로그.
     */
    public List<AttemptLog> logs() {
        return strategy.logs();
    }

    public AttemptLog currentLog() {
        return strategy.currentLog();
    }

    public RunnerState runnerState() {
        return runnerState;
    }

    // ============================================================
    // 내부
    // ============================================================

    private <T, E extends Exception> T run(Attemptable<T, E> operation, DefaultValue<? extends T> attemptDefault) throws E {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }

        boolean originalRunsAtStartOfLoop = strategy.config().runsAtStartOfLoop();
        strategy.reset();
        strategy.runsAtStartOfLoop(true);
        runnerState = RunnerState.IDLE;

        try {
            return loop(operation, attemptDefault);
        } finally {
            runnerState = RunnerState.TERMINATED;
            strategy.reset();
            strategy.runsAtStartOfLoop(originalRunsAtStartOfLoop);
        }
    }

    private <T, E extends Exception> T loop(Attemptable<T, E> operation, DefaultValue<? extends T> attemptDefault) throws E {
        AttemptOutcome outcome = null;
        AttemptLog lastLog = null;

        try {
            while (strategy.step()) {
                runnerState = RunnerState.ATTEMPTING;
                lastLog = strategy.startOfAttempt();
                outcome = attemptOnce(operation, lastLog);
                strategy.endOfAttempt();

                boolean willRetry = isRetryWorthy(outcome) && !strategy.isLastAttempt();
                notifyAttemptFailure(outcome, willRetry, lastLog);
                if (!willRetry) {
                    break;
                }
                runnerState = RunnerState.RETRYING;
                log.debug("Retrying after attempt {}", lastLog.attemptNumber());
            }
            return conclude(outcome, lastLog, attemptDefault);
        } finally {
            List<AttemptLog> logs = strategy.logs();
            for (FinallyCallback callback : finallyCallbacks) {
                callback.onFinally(lastLog, logs);
            }
        }
    }

    private AttemptOutcome attemptOnce(Attemptable<?, ?> operation, AttemptLog attemptLog) {
        try {
            Object result = operation.attempt();
            ResultCheck check = resultMatchers.check(result);
            return check.valid()
                ? new AttemptOutcome.Succeeded(result)
                : new AttemptOutcome.Rejected(result, check.defaultValue());
        } catch (Exception e) {
            ExceptionMatch match = exceptionMatchers.match(e, attemptLog);
            log.debug("Attempt {} threw {} (retryable: {})",
                attemptLog.attemptNumber(), e.getClass().getName(), match.retryable());
            return new AttemptOutcome.Threw(e, match.retryable(), match.defaultValue());
        }
    }

    private static boolean isRetryWorthy(AttemptOutcome outcome) {
        if (outcome instanceof AttemptOutcome.Threw) {
            return ((AttemptOutcome.Threw) outcome).retryable();
        }
        return outcome instanceof AttemptOutcome.Rejected;
    }

    private void notifyAttemptFailure(AttemptOutcome outcome, boolean willRetry, AttemptLog attemptLog) {
        if (outcome instanceof AttemptOutcome.Threw) {
            Exception exception = ((AttemptOutcome.Threw) outcome).exception();
            List<AttemptLog> logs = strategy.logs();
            for (ExceptionCallback callback : exceptionCallbacks) {
                callback.onException(exception, willRetry, attemptLog, logs);
            }
        } else if (outcome instanceof AttemptOutcome.Rejected) {
            Object result = ((AttemptOutcome.Rejected) outcome).result();
            List<AttemptLog> logs = strategy.logs();
            for (InvalidResultCallback callback : invalidResultCallbacks) {
                callback.onInvalidResult(result, willRetry, attemptLog, logs);
            }
        }
    }

    private <T, E extends Exception> T conclude(
            AttemptOutcome outcome,
            AttemptLog lastLog,
            DefaultValue<? extends T> attemptDefault) throws E {

        List<AttemptLog> logs = strategy.logs();

        if (outcome != null && outcome.isSuccess()) {
            Object result = ((AttemptOutcome.Succeeded) outcome).result();
            for (SuccessCallback callback : successCallbacks) {
                callback.onSuccess(result, lastLog, logs);
            }
            @SuppressWarnings("unchecked")
            T succeeded = (T) result;
            return succeeded;
        }

        for (FailureCallback callback : failureCallbacks) {
            callback.onFailure(lastLog, logs);
        }

        Optional<DefaultValue<?>> defaultValue = DefaultValueCascade.of(
            () -> outcome != null ? outcome.matchedDefault() : null,
            () -> attemptDefault
        ).resolve();
        if (defaultValue.isPresent()) {
            DefaultValue<?> resolved = defaultValue.get();
            if (resolved == attemptDefault) {
                return attemptDefault.get();
            }
            // matcher 기본값은 결과 타입을 알 수 없음
            @SuppressWarnings("unchecked")
            T matched = (T) resolved.get();
            return matched;
        }

        if (outcome instanceof AttemptOutcome.Threw) {
            Exception exception = ((AttemptOutcome.Threw) outcome).exception();
            log.warn("Giving up after {} attempt(s): {}", logs.size(), exception.toString());
            @SuppressWarnings("unchecked")
            E thrown = (E) exception;
            throw thrown;
        }
        if (outcome instanceof AttemptOutcome.Rejected) {
            log.debug("Giving up after {} attempt(s) with an invalid result", logs.size());
            @SuppressWarnings("unchecked")
            T rejected = (T) ((AttemptOutcome.Rejected) outcome).result();
            return rejected;
        }
        log.debug("No attempts were made");
        return null;
    }

    @SafeVarargs
    private static <C> void addAll(List<C> target, C... callbacks) {
        if (callbacks == null) {
            throw new IllegalArgumentException("callbacks cannot be null");
        }
        for (C callback : callbacks) {
            if (callback == null) {
                throw new IllegalArgumentException("callback cannot be null");
            }
            target.add(callback);
        }
    }
}
