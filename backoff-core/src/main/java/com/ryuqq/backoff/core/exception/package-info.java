/**
 * 예외 계층.
 *
 * <ul>
 *   <li>{@link com.ryuqq.backoff.core.exception.BackoffInitializationException} - 생성 시점 설정 오류</li>
 *   <li>{@link com.ryuqq.backoff.core.exception.BackoffRuntimeException} - 실행 중 오용 오류</li>
 * </ul>
 *
 * <p>사용자 작업이 던진 예외는 이 계층에 속하지 않으며, 동일한 인스턴스 그대로 호출자에게 전달됩니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
package com.ryuqq.backoff.core.exception;
