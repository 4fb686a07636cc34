package com.ryuqq.backoff.runner;

/**
 * 한 번의 시도 결과.
 *
 * <ul>
 *   <li>{@link Succeeded}: 유효한 결과</li>
 *   <li>{@link Threw}: 작업이 예외를 던짐</li>
 *   <li>{@link Rejected}: 결과 matcher가 유효하지 않다고 판단</li>
 * </ul>
 *
 * <p>마지막 시도의 결과가 실행의 최종 결과가 됩니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
sealed interface AttemptOutcome permits AttemptOutcome.Succeeded, AttemptOutcome.Threw, AttemptOutcome.Rejected {

    /**
     * 결과에 연결된 matcher 기본값.
     *
     * @return 기본값 (없으면 null)
     */
    DefaultValue<?> matchedDefault();

    default boolean isSuccess() {
        return this instanceof Succeeded;
    }

    /**
     * @param result 결과
     */
    record Succeeded(Object result) implements AttemptOutcome {

        @Override
        public DefaultValue<?> matchedDefault() {
            return null;
        }
    }

    /**
     * @param exception 작업이 던진 예외 (null이 아니어야 함)
     * @param retryable 예외 matcher와 일치했는지 여부
     * @param matchedDefault 일치한 예외 matcher의 기본값 (nullable)
     */
    record Threw(Exception exception, boolean retryable, DefaultValue<?> matchedDefault) implements AttemptOutcome {

        public Threw {
            if (exception == null) {
                throw new IllegalArgumentException("exception cannot be null");
            }
        }
    }

    /**
     * @param result 유효하지 않은 결과
     * @param matchedDefault 일치한 결과 matcher의 기본값 (nullable)
     */
    record Rejected(Object result, DefaultValue<?> matchedDefault) implements AttemptOutcome {
    }
}
