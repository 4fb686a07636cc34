/**
 * 재시도 실행기.
 *
 * <p>{@link com.ryuqq.backoff.runner.Backoff}가 전략, matcher, 콜백, 기본값을 묶어 작업을 재시도합니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
package com.ryuqq.backoff.runner;
