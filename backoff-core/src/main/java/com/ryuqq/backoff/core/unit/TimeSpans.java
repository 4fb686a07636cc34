package com.ryuqq.backoff.core.unit;

import java.time.Duration;
import java.time.Instant;

/**
 * 시간 간격 단위 변환 유틸리티.
 *
 * <p>모든 지연 계산은 설정된 단위에서 수행되고, 변환은 경계(로그, 조회 메서드, sleep)에서만 일어납니다.
 * null 입력은 null로 전파됩니다 ("지연 없음"과 "0 지연"을 구분하기 위함).</p>
 *
 * <p><strong>변환 예시:</strong></p>
 * <pre>
 * TimeSpans.convert(1.5, UnitType.SECONDS, UnitType.MILLISECONDS)   // 1500.0
 * TimeSpans.convert(250.0, UnitType.MICROSECONDS, UnitType.MILLISECONDS) // 0.25
 * TimeSpans.convertTimespan(1.0, "seconds", "minutes")              // null (알 수 없는 단위)
 * </pre>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class TimeSpans {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    // Utility class - prevent instantiation
    private TimeSpans() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단위 변환.
     *
     * @param value 변환할 값 (nullable)
     * @param from 현재 단위
     * @param to 변환할 단위
     * @return 변환된 값 (value가 null이면 null)
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static Double convert(Double value, UnitType from, UnitType to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Units cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (value == null) {
            return null;
        }
        if (from == to) {
            return value;
        }
        // 큰 단위 → 작은 단위는 곱셈, 반대는 나눗셈 (반복 변환 시 오차 최소화)
        if (from.microsPerUnit() > to.microsPerUnit()) {
            return value * (double) (from.microsPerUnit() / to.microsPerUnit());
        }
        return value / (double) (to.microsPerUnit() / from.microsPerUnit());
    }

    /**
     * 단위 이름 기반 변환.
     *
     * <p>알 수 없는 단위 이름이 주어지면 예외 대신 null을 반환합니다.</p>
     *
     * @param value 변환할 값 (nullable)
     * @param fromUnit 현재 단위 이름
     * @param toUnit 변환할 단위 이름
     * @return 변환된 값 (value가 null이거나 단위를 알 수 없으면 null)
     */
    public static Double convertTimespan(Double value, String fromUnit, String toUnit) {
        UnitType from = UnitType.find(fromUnit).orElse(null);
        UnitType to = UnitType.find(toUnit).orElse(null);
        if (from == null || to == null) {
            return null;
        }
        return convert(value, from, to);
    }

    /**
     * 단위 변환 (null 대신 0 반환).
     *
     * @param value 변환할 값 (nullable)
     * @param from 현재 단위
     * @param to 변환할 단위
     * @return 변환된 값 (value가 null이면 0.0)
     */
    public static double convertAsNumber(Double value, UnitType from, UnitType to) {
        Double converted = convert(value, from, to);
        return converted != null ? converted : 0.0;
    }

    /**
     * 지연 값을 나노초로 변환.
     *
     * @param value 지연 값 (nullable)
     * @param unit 지연 값의 단위
     * @return 나노초 (null, 음수, NaN은 0)
     */
    public static long toNanos(Double value, UnitType unit) {
        if (value == null || value.isNaN() || value <= 0) {
            return 0L;
        }
        double micros = convert(value, unit, UnitType.MICROSECONDS);
        double nanos = micros * 1_000.0;
        return nanos >= Long.MAX_VALUE ? Long.MAX_VALUE : (long) nanos;
    }

    /**
     * 두 시각 사이의 간격 (초, 소수점 포함).
     *
     * @param start 시작 시각
     * @param end 종료 시각
     * @return 초 단위 간격 (end가 앞서면 음수)
     */
    public static double between(Instant start, Instant end) {
        return Duration.between(start, end).toNanos() / NANOS_PER_SECOND;
    }
}
