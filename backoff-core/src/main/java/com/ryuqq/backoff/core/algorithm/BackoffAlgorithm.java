package com.ryuqq.backoff.core.algorithm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Backoff 알고리즘 계약.
 *
 * <p>재시도 번호(1부터 시작)에 대한 기본 지연 값을 계산합니다.
 * 반환 값은 전략에 설정된 단위로 해석됩니다.</p>
 *
 * <p><strong>반환 규칙:</strong></p>
 * <ul>
 *   <li>숫자: 해당 재시도 전 대기할 지연 값</li>
 *   <li>null: 더 이상 재시도하지 않음 (중단 신호)</li>
 * </ul>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>전략은 재시도 번호별 결과를 캐시하므로, 구현체는 같은 인스턴스로 여러 번 호출되어도 됩니다</li>
 *   <li>jitter 적용을 원하지 않으면 {@link #jitterMayBeApplied()}를 false로 재정의합니다</li>
 * </ul>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BackoffAlgorithm {

    /**
     * 기본 지연 값 계산.
     *
     * @param retryNumber 재시도 번호 (1부터 시작)
     * @param prevBaseDelay 직전 재시도의 기본 지연 값 (첫 재시도면 null)
     * @return 지연 값, 중단하려면 null
     */
    Double calculateBaseDelay(int retryNumber, Double prevBaseDelay);

    /**
     * jitter 적용 허용 여부.
     *
     * @return 허용하면 true (기본값)
     */
    default boolean jitterMayBeApplied() {
        return true;
    }

    /**
     * 알고리즘 단독 지연 시퀀스 생성.
     *
     * <p>전략(최대 지연, jitter, 단위)을 거치지 않은 원시 값입니다.
     * 알고리즘이 중단 신호를 보내면 그 지점에서 끝납니다.</p>
     *
     * @param maxSteps 최대 재시도 수
     * @return 재시도 1..maxSteps 의 지연 값 (불변 리스트)
     */
    default List<Double> generateTestSequence(int maxSteps) {
        List<Double> delays = new ArrayList<>();
        Double prevBaseDelay = null;
        for (int retryNumber = 1; retryNumber <= maxSteps; retryNumber++) {
            Double delay = calculateBaseDelay(retryNumber, prevBaseDelay);
            if (delay == null) {
                break;
            }
            delays.add(delay);
            prevBaseDelay = delay;
        }
        return Collections.unmodifiableList(delays);
    }
}
