/**
 * 재시도 판단 matcher.
 *
 * <p>예외 matcher({@link com.ryuqq.backoff.runner.matcher.ExceptionMatchers})와
 * 결과 matcher({@link com.ryuqq.backoff.runner.matcher.ResultMatchers})를 제공합니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
package com.ryuqq.backoff.runner.matcher;
