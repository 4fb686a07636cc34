package com.ryuqq.backoff.core.algorithm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 지정된 지연 값 목록을 순서대로 사용하는 알고리즘.
 *
 * <p>목록이 끝나면 fallbackDelay를 계속 사용하고, fallbackDelay가 없으면 중단합니다.
 * 목록 안의 null은 목록의 끝으로 취급합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * new SequenceBackoffAlgorithm(List.of(9.0, 8.0, 7.0), 4.0)  // 9, 8, 7, 4, 4, 4, ...
 * new SequenceBackoffAlgorithm(List.of(9.0, 8.0, 7.0))       // 9, 8, 7 (중단)
 * SequenceBackoffAlgorithm.repeatingLast(List.of(1.0, 2.0)) // 1, 2, 2, 2, ...
 * </pre>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class SequenceBackoffAlgorithm implements BackoffAlgorithm {

    private final List<Double> delays;
    private final Double fallbackDelay;

    /**
     * 목록이 끝나면 중단하는 알고리즘 생성.
     *
     * @param delays 지연 값 목록
     */
    public SequenceBackoffAlgorithm(List<Double> delays) {
        this(delays, null);
    }

    /**
     * 생성자.
     *
     * @param delays 지연 값 목록
     * @param fallbackDelay 목록이 끝난 뒤 사용할 값 (null이면 중단)
     * @throws IllegalArgumentException delays가 null인 경우
     */
    public SequenceBackoffAlgorithm(List<Double> delays, Double fallbackDelay) {
        if (delays == null) {
            throw new IllegalArgumentException("delays cannot be null");
        }
        List<Double> truncated = new ArrayList<>();
        for (Double delay : delays) {
            if (delay == null) {
                break;
            }
            truncated.add(delay);
        }
        this.delays = Collections.unmodifiableList(truncated);
        this.fallbackDelay = fallbackDelay;
    }

    /**
     * 목록의 마지막 값을 계속 반복하는 알고리즘 생성.
     *
     * @param delays 지연 값 목록
     * @return 알고리즘
     */
    public static SequenceBackoffAlgorithm repeatingLast(List<Double> delays) {
        SequenceBackoffAlgorithm truncated = new SequenceBackoffAlgorithm(delays);
        Double last = truncated.delays.isEmpty() ? null : truncated.delays.get(truncated.delays.size() - 1);
        return new SequenceBackoffAlgorithm(truncated.delays, last);
    }

    @Override
    public Double calculateBaseDelay(int retryNumber, Double prevBaseDelay) {
        int index = retryNumber - 1;
        if (index >= 0 && index < delays.size()) {
            return delays.get(index);
        }
        return fallbackDelay;
    }
}
