package com.ryuqq.backoff.core.strategy;

import com.ryuqq.backoff.core.algorithm.LinearBackoffAlgorithm;
import com.ryuqq.backoff.core.algorithm.NoBackoffAlgorithm;
import com.ryuqq.backoff.core.exception.BackoffRuntimeException;
import com.ryuqq.backoff.core.unit.UnitType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * 시도 로그 기록 테스트.
 *
 * <p>startOfAttempt / endOfAttempt가 만드는 {@link AttemptLog}의 지연, 작업 시간, 시각을 검증합니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
class AttemptLogTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    private ManualClock clock;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(START);
    }

    private List<AttemptLog> runThreeAttempts(BackoffStrategy strategy) {
        strategy.useTracker();
        do {
            strategy.startOfAttempt();
            clock.advance(Duration.ofMillis(5));
            strategy.endOfAttempt();
        } while (strategy.step());
        return strategy.logs();
    }

    // ============================================================
    // 지연 기록
    // ============================================================

    @Test
    void logs_RecordPrevNextAndOverallDelay() {
        // Given
        BackoffStrategy strategy = new BackoffStrategy(new LinearBackoffAlgorithm(1000))
            .unitUs()
            .maxAttempts(3)
            .clock(clock);

        // When
        List<AttemptLog> logs = runThreeAttempts(strategy);

        // Then
        assertThat(logs)
            .extracting(AttemptLog::attemptNumber, AttemptLog::retryNumber, AttemptLog::maxAttempts)
            .containsExactly(tuple(1, 0, 3), tuple(2, 1, 3), tuple(3, 2, 3));
        assertThat(logs).extracting(AttemptLog::prevDelay).containsExactly(null, 1000.0, 2000.0);
        assertThat(logs).extracting(AttemptLog::nextDelay).containsExactly(1000.0, 2000.0, null);
        assertThat(logs).extracting(AttemptLog::overallDelay).containsExactly(null, 1000.0, 3000.0);
        assertThat(logs).extracting(AttemptLog::willRetry).containsExactly(true, true, false);
        assertThat(logs).extracting(AttemptLog::unitType).containsOnly(UnitType.MICROSECONDS);
    }

    @Test
    void logs_ConvertDelaysToOtherUnits() {
        BackoffStrategy strategy = new BackoffStrategy(new LinearBackoffAlgorithm(1000))
            .unitUs()
            .maxAttempts(3)
            .clock(clock);

        AttemptLog second = runThreeAttempts(strategy).get(1);

        assertThat(second.prevDelayInMs()).isEqualTo(1.0);
        assertThat(second.prevDelayInSeconds()).isEqualTo(0.001);
        assertThat(second.nextDelayInUs()).isEqualTo(2000.0);
        assertThat(second.overallDelayInMs()).isEqualTo(1.0);
    }

    // ============================================================
    // 작업 시간
    // ============================================================

    @Test
    void logs_RecordWorkingTimeInConfiguredUnit() {
        BackoffStrategy strategy = new BackoffStrategy(new LinearBackoffAlgorithm(1))
            .unitMs()
            .maxAttempts(3)
            .clock(clock);

        List<AttemptLog> logs = runThreeAttempts(strategy);

        assertThat(logs).extracting(AttemptLog::workingTime).containsExactly(5.0, 5.0, 5.0);
        assertThat(logs).extracting(AttemptLog::overallWorkingTime).containsExactly(5.0, 10.0, 15.0);
        assertThat(logs.get(2).overallWorkingTimeInUs()).isEqualTo(15_000.0);
        assertThat(logs.get(2).workingTimeInSeconds()).isEqualTo(0.005);
        assertThat(logs.get(0).overallWorkingTimeAsNumber()).isEqualTo(5.0);
    }

    @Test
    void logs_RecordTimestamps() {
        BackoffStrategy strategy = new BackoffStrategy(new LinearBackoffAlgorithm(1))
            .maxAttempts(3)
            .clock(clock);

        List<AttemptLog> logs = runThreeAttempts(strategy);

        assertThat(logs).extracting(AttemptLog::firstAttemptOccurredAt).containsOnly(START);
        assertThat(logs).extracting(AttemptLog::thisAttemptOccurredAt)
            .containsExactly(START, START.plusMillis(5), START.plusMillis(10));
    }

    @Test
    void endOfAttempt_CalledTwice_KeepsFirstWorkingTime() {
        // Given
        BackoffStrategy strategy = new BackoffStrategy(new LinearBackoffAlgorithm(1)).unitMs().clock(clock);
        strategy.startOfAttempt();
        clock.advance(Duration.ofMillis(3));
        strategy.endOfAttempt();

        // When
        clock.advance(Duration.ofMillis(50));
        AttemptLog log = strategy.endOfAttempt();

        // Then
        assertThat(log.workingTime()).isEqualTo(3.0);
    }

    @Test
    void startOfAttempt_WithoutEnding_FinishesPreviousAttempt() {
        // Given
        BackoffStrategy strategy = new BackoffStrategy(new LinearBackoffAlgorithm(1)).unitMs().clock(clock);
        strategy.useTracker();
        AttemptLog first = strategy.startOfAttempt();
        clock.advance(Duration.ofMillis(7));
        strategy.step();

        // When
        AttemptLog second = strategy.startOfAttempt();

        // Then
        assertThat(first.workingTime()).isEqualTo(7.0);
        assertThat(second.workingTime()).isNull();
        assertThat(strategy.currentLog()).isSameAs(second);
    }

    // ============================================================
    // 오용
    // ============================================================

    @Test
    void endOfAttempt_BeforeStartOfAttempt_ThrowsRuntimeException() {
        BackoffStrategy strategy = new BackoffStrategy(new LinearBackoffAlgorithm(1));

        assertThatThrownBy(strategy::endOfAttempt)
            .isInstanceOf(BackoffRuntimeException.class)
            .hasMessageContaining("endOfAttempt()");
    }

    @Test
    void startOfAttempt_AfterStop_ThrowsRuntimeException() {
        BackoffStrategy strategy = new BackoffStrategy(new NoBackoffAlgorithm());
        strategy.useTracker();
        strategy.step();

        assertThatThrownBy(strategy::startOfAttempt)
            .isInstanceOf(BackoffRuntimeException.class)
            .hasMessageContaining("startOfAttempt()");
    }

    @Test
    void currentLog_AfterStop_IsNull() {
        BackoffStrategy strategy = new BackoffStrategy(new LinearBackoffAlgorithm(1)).maxAttempts(1).clock(clock);
        strategy.useTracker();
        strategy.startOfAttempt();
        strategy.endOfAttempt();
        assertThat(strategy.currentLog()).isNotNull();

        strategy.step();

        assertThat(strategy.currentLog()).isNull();
        assertThat(strategy.logs()).hasSize(1);
    }

    @Test
    void logs_ReturnsUnmodifiableCopy() {
        BackoffStrategy strategy = new BackoffStrategy(new LinearBackoffAlgorithm(1)).clock(clock);
        strategy.startOfAttempt();

        List<AttemptLog> logs = strategy.logs();

        assertThatThrownBy(logs::clear).isInstanceOf(UnsupportedOperationException.class);
    }
}
