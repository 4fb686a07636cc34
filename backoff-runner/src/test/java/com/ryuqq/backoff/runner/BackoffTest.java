package com.ryuqq.backoff.runner;

import com.ryuqq.backoff.core.algorithm.FixedBackoffAlgorithm;
import com.ryuqq.backoff.core.strategy.AttemptLog;
import com.ryuqq.backoff.core.strategy.BackoffStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Backoff 실행기 테스트.
 *
 * <p>실제 대기 없이 요청된 대기 시간만 기록하는 sleeper를 주입합니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
class BackoffTest {

    private List<Long> sleeps;
    private AtomicInteger calls;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        calls = new AtomicInteger();
    }

    private Backoff linear(int maxAttempts) {
        return Backoff.linear(1).noJitter().maxAttempts(maxAttempts).sleeper(sleeps::add);
    }

    private String failUntil(int succeedOn) {
        int call = calls.incrementAndGet();
        if (call < succeedOn) {
            throw new IllegalStateException("attempt " + call);
        }
        return "ok-" + call;
    }

    // ============================================================
    // 성공
    // ============================================================

    @Test
    void attempt_SucceedsFirstTime_DoesNotSleep() {
        // When
        String result = linear(5).attempt(() -> failUntil(1));

        // Then
        assertThat(result).isEqualTo("ok-1");
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void attempt_SucceedsAfterRetries_ReturnsResult() {
        Backoff backoff = linear(5);

        String result = backoff.attempt(() -> failUntil(3));

        assertThat(result).isEqualTo("ok-3");
        assertThat(sleeps).hasSize(2);
        assertThat(backoff.logs()).extracting(AttemptLog::attemptNumber).containsExactly(1, 2, 3);
    }

    // ============================================================
    // 재시도 소진
    // ============================================================

    @Test
    void attempt_AlwaysFailing_StopsAtMaxAttemptsAndRethrowsSameInstance() {
        // Given
        Backoff backoff = linear(8);
        IllegalStateException failure = new IllegalStateException("down");

        // When & Then
        assertThatThrownBy(() -> backoff.attempt(() -> {
            calls.incrementAndGet();
            throw failure;
        })).isSameAs(failure);

        assertThat(calls).hasValue(8);
        assertThat(sleeps).hasSize(7);
        assertThat(backoff.logs()).extracting(AttemptLog::nextDelay)
            .containsExactly(1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, null);
    }

    @Test
    void attempt_RequestsDelayInNanoseconds() {
        Backoff backoff = Backoff.fixedMs(500).noJitter().maxAttempts(2).sleeper(sleeps::add);

        backoff.attempt(() -> failUntil(2));

        assertThat(sleeps).hasSize(1);
        assertThat(sleeps.get(0)).isBetween(400_000_000L, 500_000_000L);
    }

    @Test
    void attempt_CheckedException_IsRethrownAsIs() {
        IOException failure = new IOException("io");

        assertThatThrownBy(() -> linear(2).attempt(() -> {
            throw failure;
        })).isSameAs(failure);
    }

    @Test
    void attempt_Error_PropagatesWithoutRetryButFinallyFires() {
        // Given
        List<String> events = new ArrayList<>();
        Backoff backoff = linear(5).finallyCallback((log, logs) -> events.add("finally"));

        // When & Then
        assertThatThrownBy(() -> backoff.attempt(() -> {
            calls.incrementAndGet();
            throw new AssertionError("boom");
        })).isInstanceOf(AssertionError.class);

        assertThat(calls).hasValue(1);
        assertThat(events).containsExactly("finally");
    }

    // ============================================================
    // 예외 matcher
    // ============================================================

    @Test
    void retryExceptions_NonMatchingException_StopsImmediately() {
        // Given
        List<Boolean> willRetry = new ArrayList<>();
        Backoff backoff = linear(5)
            .retryExceptions(IOException.class)
            .exceptionCallback((e, retry, log, logs) -> willRetry.add(retry));
        IllegalArgumentException failure = new IllegalArgumentException("bad input");

        // When & Then
        assertThatThrownBy(() -> backoff.attempt(() -> {
            calls.incrementAndGet();
            throw failure;
        })).isSameAs(failure);

        assertThat(calls).hasValue(1);
        assertThat(willRetry).containsExactly(false);
    }

    @Test
    void retryExceptions_MatchingWithDefault_ReturnsDefaultAfterExhaustion() {
        Backoff backoff = linear(3).retryExceptions(IllegalStateException.class, DefaultValue.of("cached"));

        String result = backoff.attempt(() -> failUntil(10));

        assertThat(result).isEqualTo("cached");
        assertThat(calls).hasValue(3);
    }

    @Test
    void retryExceptions_MatcherDefaultWinsOverAttemptDefault() {
        Backoff backoff = linear(2).retryAllExceptions(DefaultValue.of("matcher"));

        String result = backoff.attempt(() -> failUntil(10), "attempt");

        assertThat(result).isEqualTo("matcher");
    }

    @Test
    void retryExceptions_WithoutMatcherDefault_ReturnsAttemptDefault() {
        Backoff backoff = linear(3).retryAllExceptions();

        Integer result = backoff.attempt(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("down");
        }, -1);

        assertThat(result).isEqualTo(-1);
        assertThat(calls).hasValue(3);
    }

    @Test
    void retryExceptionsWhen_PredicateSeesAttemptLog() {
        // Given
        List<Integer> seen = new ArrayList<>();
        Backoff backoff = linear(3).retryExceptionsWhen((e, log) -> seen.add(log.attemptNumber()), DefaultValue.of("gave up"));

        // When
        String result = backoff.attempt(() -> failUntil(10));

        // Then
        assertThat(seen).containsExactly(1, 2, 3);
        assertThat(result).isEqualTo("gave up");
    }

    @Test
    void retryExceptionsWhen_PredicateRejects_RethrowsWithoutDefault() {
        Backoff backoff = linear(5).retryExceptionsWhen((e, log) -> log.attemptNumber() < 2, DefaultValue.of("unused"));

        assertThatThrownBy(() -> backoff.attempt(() -> failUntil(10)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("attempt 2");
        assertThat(calls).hasValue(2);
    }

    @Test
    void dontRetryExceptions_ReturnsItsDefaultAfterOneAttempt() {
        Backoff backoff = linear(5).retryAllExceptions().dontRetryExceptions(DefaultValue.of("fallback"));

        String result = backoff.attempt(() -> failUntil(10));

        assertThat(result).isEqualTo("fallback");
        assertThat(calls).hasValue(1);
    }

    @Test
    void attemptOrElseGet_SupplierOnlyCalledOnFailure() {
        AtomicInteger supplied = new AtomicInteger();

        String success = linear(2).attemptOrElseGet(() -> "ok", () -> "fallback-" + supplied.incrementAndGet());
        String failure = linear(2).attemptOrElseGet(() -> failUntil(10), () -> "fallback-" + supplied.incrementAndGet());

        assertThat(success).isEqualTo("ok");
        assertThat(failure).isEqualTo("fallback-1");
        assertThat(supplied).hasValue(1);
    }

    // ============================================================
    // 결과 matcher
    // ============================================================

    @Test
    void retryWhen_RetriesWhileResultMatches() {
        Backoff backoff = linear(5).retryWhen(false);

        Boolean result = backoff.attempt(() -> calls.incrementAndGet() >= 3);

        assertThat(result).isTrue();
        assertThat(calls).hasValue(3);
    }

    @Test
    void retryWhen_False_AlsoRetriesNullResult() {
        Backoff backoff = linear(5).retryWhen(false);

        String result = backoff.attempt(() -> calls.incrementAndGet() >= 3 ? "ready" : null);

        assertThat(result).isEqualTo("ready");
        assertThat(calls).hasValue(3);
    }

    @Test
    void retryWhen_LooseComparisonAcrossNumberTypes() {
        Backoff backoff = linear(3).retryWhen(0);

        Long result = backoff.attempt(() -> (long) (calls.incrementAndGet() - 1));

        assertThat(result).isEqualTo(1L);
    }

    @Test
    void retryWhen_Strict_DoesNotMatchOtherNumberType() {
        Backoff backoff = linear(3).retryWhen(0, true);

        Long result = backoff.attempt(() -> {
            calls.incrementAndGet();
            return 0L;
        });

        assertThat(result).isZero();
        assertThat(calls).hasValue(1);
    }

    @Test
    void retryWhen_Exhausted_ReturnsLastInvalidResult() {
        List<Object> invalid = new ArrayList<>();
        Backoff backoff = linear(3)
            .retryWhen(null)
            .invalidResultCallback((result, retry, log, logs) -> invalid.add(retry));

        Object result = backoff.attempt(() -> {
            calls.incrementAndGet();
            return null;
        });

        assertThat(result).isNull();
        assertThat(calls).hasValue(3);
        assertThat(invalid).containsExactly(true, true, false);
    }

    @Test
    void retryWhen_WithDefault_ReturnsDefault() {
        Backoff backoff = linear(2).retryWhen("", false, DefaultValue.of("empty"));

        String result = backoff.attempt(() -> "");

        assertThat(result).isEqualTo("empty");
    }

    @Test
    void retryUntil_RetriesUntilResultMatches() {
        Backoff backoff = linear(10).retryUntilMatches(result -> ((Integer) result) >= 4);

        Integer result = backoff.attempt(calls::incrementAndGet);

        assertThat(result).isEqualTo(4);
    }

    @Test
    void retryUntil_ReplacesRetryWhen() {
        Backoff backoff = linear(5).retryWhen("done").retryUntil("done");

        String result = backoff.attempt(() -> calls.incrementAndGet() == 2 ? "done" : "pending");

        assertThat(result).isEqualTo("done");
        assertThat(calls).hasValue(2);
    }

    // ============================================================
    // 콜백
    // ============================================================

    @Test
    void callbacks_FireInOrder() {
        // Given
        List<String> events = new ArrayList<>();
        Backoff backoff = linear(5)
            .exceptionCallback(
                (e, retry, log, logs) -> events.add("exception-" + log.attemptNumber()),
                (e, retry, log, logs) -> events.add("exception2-" + log.attemptNumber()))
            .successCallback((result, log, logs) -> events.add("success-" + result))
            .failureCallback((log, logs) -> events.add("failure"))
            .finallyCallback((log, logs) -> events.add("finally-" + logs.size()));

        // When
        backoff.attempt(() -> failUntil(2));

        // Then
        assertThat(events).containsExactly("exception-1", "exception2-1", "success-ok-2", "finally-2");
    }

    @Test
    void callbacks_FailureAndFinallyFireOnceWhenRethrowing() {
        List<String> events = new ArrayList<>();
        Backoff backoff = linear(3)
            .fallbackCallback((log, logs) -> events.add("failure-" + log.attemptNumber()))
            .finallyCallback((log, logs) -> events.add("finally-" + log.attemptNumber()));

        assertThatThrownBy(() -> backoff.attempt(() -> failUntil(10)))
            .isInstanceOf(IllegalStateException.class);

        assertThat(events).containsExactly("failure-3", "finally-3");
    }

    @Test
    void finallyCallback_ExceptionReplacesInFlightException() {
        IllegalStateException fromFinally = new IllegalStateException("finally");
        Backoff backoff = linear(2).finallyCallback((log, logs) -> {
            throw fromFinally;
        });

        assertThatThrownBy(() -> backoff.attempt(() -> failUntil(10))).isSameAs(fromFinally);
    }

    @Test
    void finallyCallback_FiresWhenAnotherCallbackThrows() {
        List<String> events = new ArrayList<>();
        Backoff backoff = linear(2)
            .successCallback((result, log, logs) -> {
                throw new IllegalArgumentException("success callback");
            })
            .finallyCallback((log, logs) -> events.add("finally"));

        assertThatThrownBy(() -> backoff.attempt(() -> "ok"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("success callback");
        assertThat(events).containsExactly("finally");
    }

    // ============================================================
    // 시도 없음 / 재시도 비활성화
    // ============================================================

    @Test
    void maxAttemptsZero_RunsNothingAndReturnsDefault() {
        // Given
        List<String> events = new ArrayList<>();
        Backoff backoff = linear(0)
            .failureCallback((log, logs) -> events.add("failure-" + log + "-" + logs.size()))
            .finallyCallback((log, logs) -> events.add("finally"));

        // When
        String result = backoff.attempt(() -> failUntil(1), "default");

        // Then
        assertThat(result).isEqualTo("default");
        assertThat(calls).hasValue(0);
        assertThat(events).containsExactly("failure-null-0", "finally");
    }

    @Test
    void maxAttemptsZero_WithoutDefault_ReturnsNull() {
        Object result = linear(0).attempt(() -> failUntil(1));

        assertThat(result).isNull();
    }

    @Test
    void onlyRetryWhenFalse_RunsOnce() {
        Backoff backoff = linear(5).onlyRetryWhen(false);

        assertThatThrownBy(() -> backoff.attempt(() -> failUntil(10))).isInstanceOf(IllegalStateException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void none_RunsOnce() {
        String result = Backoff.none().attempt(() -> failUntil(2), "none");

        assertThat(result).isEqualTo("none");
        assertThat(calls).hasValue(1);
    }

    // ============================================================
    // 상태 / 재사용
    // ============================================================

    @Test
    void runnerState_MovesFromIdleToTerminated() {
        // Given
        Backoff backoff = linear(3);
        List<RunnerState> during = new ArrayList<>();
        assertThat(backoff.runnerState()).isEqualTo(RunnerState.IDLE);

        // When
        backoff.attempt(() -> {
            during.add(backoff.runnerState());
            return failUntil(2);
        });

        // Then
        assertThat(during).containsExactly(RunnerState.ATTEMPTING, RunnerState.ATTEMPTING);
        assertThat(backoff.runnerState()).isEqualTo(RunnerState.TERMINATED);
        assertThat(backoff.runnerState().isTerminal()).isTrue();
    }

    @Test
    void attempt_CanBeRunAgain() {
        Backoff backoff = linear(3);

        backoff.attempt(() -> failUntil(3));
        calls.set(0);
        String second = backoff.attempt(() -> failUntil(2));

        assertThat(second).isEqualTo("ok-2");
        assertThat(backoff.logs()).hasSize(2);
    }

    @Test
    void attempt_RestoresLoopModeAndAllowsReconfiguration() {
        // Given
        BackoffStrategy strategy = new BackoffStrategy(new FixedBackoffAlgorithm(1)).maxAttempts(2).sleeper(sleeps::add);
        Backoff backoff = Backoff.of(strategy);

        // When
        backoff.attempt(() -> "ok");

        // Then
        assertThat(strategy.config().runsAtStartOfLoop()).isFalse();
        assertThat(backoff.maxAttempts(4).strategy().config().maxAttempts()).isEqualTo(4);
    }

    @Test
    void finallyCallback_ReceivesSameLogsAsBackoff() {
        List<List<AttemptLog>> received = new ArrayList<>();
        Backoff backoff = linear(4).finallyCallback((log, logs) -> received.add(logs));

        backoff.attempt(() -> failUntil(3));

        assertThat(received).hasSize(1);
        assertThat(received.get(0)).containsExactlyElementsOf(backoff.logs());
    }

    // ============================================================
    // 인자 검증
    // ============================================================

    @Test
    void attempt_WithNullOperation_ThrowsException() {
        assertThatThrownBy(() -> linear(1).attempt(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("operation cannot be null");
    }

    @Test
    void of_WithNullStrategy_ThrowsException() {
        assertThatThrownBy(() -> Backoff.of(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("strategy cannot be null");
    }
}
