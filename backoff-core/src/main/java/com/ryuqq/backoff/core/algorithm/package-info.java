/**
 * Backoff 알고리즘 카탈로그.
 *
 * <p>각 알고리즘은 {@link com.ryuqq.backoff.core.algorithm.BackoffAlgorithm} 하나만 구현합니다.
 * 새 알고리즘은 전략 코드를 수정하지 않고 추가할 수 있습니다.</p>
 *
 * <p><strong>알고리즘 목록:</strong></p>
 * <ul>
 *   <li>Fixed, Linear, Exponential, Polynomial, Fibonacci - 결정적 수식</li>
 *   <li>Decorrelated, Random - 무작위 (jitter 미적용)</li>
 *   <li>Sequence, Callback - 사용자 지정</li>
 *   <li>Noop (항상 0), No (재시도 없음)</li>
 * </ul>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
package com.ryuqq.backoff.core.algorithm;
