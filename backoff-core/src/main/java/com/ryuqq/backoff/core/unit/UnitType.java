package com.ryuqq.backoff.core.unit;

import com.ryuqq.backoff.core.exception.BackoffInitializationException;

import java.util.Optional;

/**
 * 지연 시간 단위.
 *
 * <p>알고리즘이 계산한 지연 값은 항상 설정된 단위로 해석됩니다.
 * 다른 단위로의 변환은 {@link TimeSpans}가 담당합니다.</p>
 *
 * <p><strong>지원 단위:</strong></p>
 * <ul>
 *   <li>SECONDS ("seconds")</li>
 *   <li>MILLISECONDS ("milliseconds")</li>
 *   <li>MICROSECONDS ("microseconds")</li>
 * </ul>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public enum UnitType {

    /**
     * 초.
     */
    SECONDS("seconds", 1_000_000L),

    /**
     * 밀리초.
     */
    MILLISECONDS("milliseconds", 1_000L),

    /**
     * 마이크로초.
     */
    MICROSECONDS("microseconds", 1L);

    private final String unitName;
    private final long microsPerUnit;

    UnitType(String unitName, long microsPerUnit) {
        this.unitName = unitName;
        this.microsPerUnit = microsPerUnit;
    }

    /**
     * 단위 이름 조회.
     *
     * @return 단위 이름 (예: "milliseconds")
     */
    public String unitName() {
        return unitName;
    }

    long microsPerUnit() {
        return microsPerUnit;
    }

    /**
     * 이름으로 단위 검색.
     *
     * @param unitName 단위 이름
     * @return 일치하는 단위 (없으면 empty)
     */
    public static Optional<UnitType> find(String unitName) {
        if (unitName == null) {
            return Optional.empty();
        }
        for (UnitType unitType : values()) {
            if (unitType.unitName.equals(unitName)) {
                return Optional.of(unitType);
            }
        }
        return Optional.empty();
    }

    /**
     * 이름으로 단위 조회.
     *
     * @param unitName 단위 이름
     * @return 일치하는 단위
     * @throws BackoffInitializationException 알 수 없는 단위 이름인 경우
     */
    public static UnitType fromName(String unitName) {
        return find(unitName)
            .orElseThrow(() -> BackoffInitializationException.invalidUnitType(unitName));
    }

    @Override
    public String toString() {
        return unitName;
    }
}
