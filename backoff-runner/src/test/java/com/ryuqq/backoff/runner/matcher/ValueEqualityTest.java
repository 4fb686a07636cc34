package com.ryuqq.backoff.runner.matcher;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 결과 값 비교 규칙 테스트.
 *
 * @author Backoff Team
 * @since 1.0.0
 */
class ValueEqualityTest {

    // ============================================================
    // strict
    // ============================================================

    @Test
    void strict_SameClassAndValue_Matches() {
        assertThat(ValueEquality.matches(1, 1, true)).isTrue();
        assertThat(ValueEquality.matches("a", "a", true)).isTrue();
        assertThat(ValueEquality.matches(null, null, true)).isTrue();
    }

    @Test
    void strict_DifferentNumberTypes_DoesNotMatch() {
        assertThat(ValueEquality.matches(1, 1L, true)).isFalse();
        assertThat(ValueEquality.matches(1, 1.0, true)).isFalse();
        assertThat(ValueEquality.matches("1", 1, true)).isFalse();
        assertThat(ValueEquality.matches(null, 0, true)).isFalse();
    }

    // ============================================================
    // loose
    // ============================================================

    @Test
    void loose_NumbersOfDifferentTypes_CompareByValue() {
        assertThat(ValueEquality.matches(1, 1L, false)).isTrue();
        assertThat(ValueEquality.matches(1, 1.0, false)).isTrue();
        assertThat(ValueEquality.matches(new BigDecimal("2.50"), 2.5f, false)).isTrue();
        assertThat(ValueEquality.matches(1, 2L, false)).isFalse();
    }

    @Test
    void loose_StringAndNumber_ParsesString() {
        assertThat(ValueEquality.matches("1", 1, false)).isTrue();
        assertThat(ValueEquality.matches(1.5, "1.5", false)).isTrue();
        assertThat(ValueEquality.matches("abc", 1, false)).isFalse();
    }

    @Test
    void loose_StringAndBooleanOrCharacter_ComparesStringForm() {
        assertThat(ValueEquality.matches("true", true, false)).isTrue();
        assertThat(ValueEquality.matches('x', "x", false)).isTrue();
        assertThat(ValueEquality.matches("false", true, false)).isFalse();
    }

    @Test
    void loose_NullMatchesFalseZeroAndEmptyString() {
        assertThat(ValueEquality.matches(null, null, false)).isTrue();
        assertThat(ValueEquality.matches(false, null, false)).isTrue();
        assertThat(ValueEquality.matches(null, 0, false)).isTrue();
        assertThat(ValueEquality.matches(0.0, null, false)).isTrue();
        assertThat(ValueEquality.matches("", null, false)).isTrue();
    }

    @Test
    void loose_NullDoesNotMatchNonEmptyValues() {
        assertThat(ValueEquality.matches(null, true, false)).isFalse();
        assertThat(ValueEquality.matches(null, 1, false)).isFalse();
        assertThat(ValueEquality.matches("0", null, false)).isFalse();
        assertThat(ValueEquality.matches(null, Double.NaN, false)).isFalse();
        assertThat(ValueEquality.matches(null, new Object(), false)).isFalse();
    }

    @Test
    void loose_BooleanAndNumber_ComparesByZero() {
        assertThat(ValueEquality.matches(true, 1, false)).isTrue();
        assertThat(ValueEquality.matches(2L, true, false)).isTrue();
        assertThat(ValueEquality.matches(false, 0, false)).isTrue();
        assertThat(ValueEquality.matches(new BigDecimal("0.00"), false, false)).isTrue();
        assertThat(ValueEquality.matches(true, 0, false)).isFalse();
        assertThat(ValueEquality.matches(false, 1.5, false)).isFalse();
    }

    @Test
    void strict_NullAndBoolean_DoNotCoerce() {
        assertThat(ValueEquality.matches(false, null, true)).isFalse();
        assertThat(ValueEquality.matches(true, 1, true)).isFalse();
    }

    @Test
    void loose_NaN_MatchesOnlyNaN() {
        assertThat(ValueEquality.matches(Double.NaN, Double.NaN, false)).isTrue();
        assertThat(ValueEquality.matches(Double.NaN, 1, false)).isFalse();
    }
}
