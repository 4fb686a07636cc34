/**
 * Backoff 실행 이벤트 콜백.
 *
 * @author Backoff Team
 * @since 1.0.0
 */
package com.ryuqq.backoff.runner.callback;
