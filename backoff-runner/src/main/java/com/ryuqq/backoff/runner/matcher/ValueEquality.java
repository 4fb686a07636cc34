package com.ryuqq.backoff.runner.matcher;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 결과 값 비교 규칙.
 *
 * <p><strong>strict:</strong> equals 이면서 런타임 클래스가 같아야 함.</p>
 *
 * <p><strong>loose:</strong></p>
 * <ul>
 *   <li>equals</li>
 *   <li>숫자끼리는 타입과 무관하게 값 비교 (1 == 1L == 1.0)</li>
 *   <li>문자열과 숫자는 문자열을 숫자로 해석해 비교 ("1" == 1)</li>
 *   <li>문자열과 Boolean/Character는 문자열 표현 비교 ("true" == true)</li>
 *   <li>Boolean과 숫자는 0 여부로 비교 (true == 1, false == 0)</li>
 *   <li>null은 false, 0, 빈 문자열과 같음</li>
 * </ul>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class ValueEquality {

    // Utility class - prevent instantiation
    private ValueEquality() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 값 비교.
     *
     * @param expected 기대 값
     * @param actual 실제 값
     * @param strict strict 비교 여부
     * @return 일치하면 true
     */
    public static boolean matches(Object expected, Object actual, boolean strict) {
        return strict ? strictlyEquals(expected, actual) : looselyEquals(expected, actual);
    }

    public static boolean strictlyEquals(Object expected, Object actual) {
        if (expected == null || actual == null) {
            return expected == actual;
        }
        return expected.getClass() == actual.getClass() && expected.equals(actual);
    }

    public static boolean looselyEquals(Object expected, Object actual) {
        if (Objects.equals(expected, actual)) {
            return true;
        }
        if (expected == null) {
            return isEmptyValue(actual);
        }
        if (actual == null) {
            return isEmptyValue(expected);
        }
        if (expected instanceof Boolean && actual instanceof Number) {
            return (Boolean) expected != isZero((Number) actual);
        }
        if (actual instanceof Boolean && expected instanceof Number) {
            return (Boolean) actual != isZero((Number) expected);
        }
        if (expected instanceof Number && actual instanceof Number) {
            return numericEquals((Number) expected, (Number) actual);
        }
        if (expected instanceof String) {
            return stringEquals((String) expected, actual);
        }
        if (actual instanceof String) {
            return stringEquals((String) actual, expected);
        }
        return false;
    }

    private static boolean isEmptyValue(Object value) {
        if (value instanceof Boolean) {
            return !(Boolean) value;
        }
        if (value instanceof Number) {
            return isZero((Number) value);
        }
        if (value instanceof String) {
            return ((String) value).isEmpty();
        }
        return false;
    }

    private static boolean isZero(Number number) {
        BigDecimal value = toBigDecimal(number);
        if (value == null) {
            // NaN, Infinity
            return false;
        }
        return value.signum() == 0;
    }

    private static boolean stringEquals(String text, Object other) {
        if (other instanceof Number) {
            BigDecimal parsed = parse(text.trim());
            BigDecimal number = toBigDecimal((Number) other);
            return parsed != null && number != null && parsed.compareTo(number) == 0;
        }
        if (other instanceof Boolean || other instanceof Character) {
            return text.equals(String.valueOf(other));
        }
        return false;
    }

    private static boolean numericEquals(Number left, Number right) {
        BigDecimal a = toBigDecimal(left);
        BigDecimal b = toBigDecimal(right);
        if (a == null || b == null) {
            // NaN, Infinity
            return left.doubleValue() == right.doubleValue();
        }
        return a.compareTo(b) == 0;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        return parse(number.toString());
    }

    private static BigDecimal parse(String text) {
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
