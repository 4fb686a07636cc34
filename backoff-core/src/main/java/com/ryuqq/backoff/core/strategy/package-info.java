/**
 * Backoff 전략 상태 머신.
 *
 * <p><strong>주요 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.backoff.core.strategy.BackoffStrategy} - 시도 진행, 지연 계산, 대기</li>
 *   <li>{@link com.ryuqq.backoff.core.strategy.StrategyConfig} - 시작 시점에 고정되는 설정 스냅샷</li>
 *   <li>{@link com.ryuqq.backoff.core.strategy.AttemptLog} - 시도별 시간/지연 기록</li>
 *   <li>{@link com.ryuqq.backoff.core.strategy.Sleeper} - 대기 SPI</li>
 *   <li>{@link com.ryuqq.backoff.core.strategy.DelayTracker} - 대기 대신 기록 (측정/테스트)</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 이 패키지의 클래스는 스레드 안전하지 않습니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
package com.ryuqq.backoff.core.strategy;
