package com.ryuqq.backoff.core.exception;

/**
 * 초기화 오류.
 *
 * <p>잘못된 설정으로 객체를 생성하려 할 때 발생합니다. 내부에서 복구하지 않습니다.</p>
 *
 * <p><strong>발생 조건:</strong></p>
 * <ul>
 *   <li>알 수 없는 단위 이름</li>
 *   <li>min &gt; max 인 범위 (random 알고리즘, range jitter)</li>
 * </ul>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public class BackoffInitializationException extends BackoffException {

    private BackoffInitializationException(String message) {
        super(message);
    }

    /**
     * min 값이 max 값보다 큰 경우.
     *
     * @param min 주어진 min 값
     * @param max 주어진 max 값
     * @return 예외 인스턴스
     */
    public static BackoffInitializationException minIsGreaterThanMax(double min, double max) {
        return new BackoffInitializationException(
            "A min value (" + min + ") was given that is greater than the max value (" + max + ")"
        );
    }

    /**
     * 알 수 없는 단위 이름이 주어진 경우.
     *
     * @param unitType 주어진 단위 이름
     * @return 예외 인스턴스
     */
    public static BackoffInitializationException invalidUnitType(String unitType) {
        return new BackoffInitializationException("Invalid unit type \"" + unitType + "\" was given");
    }
}
