package com.ryuqq.backoff.runner;

/**
 * 재시도 대상 작업.
 *
 * <p>작업이 던진 예외는 감싸지 않고 같은 인스턴스 그대로 호출자에게 전달됩니다.</p>
 *
 * @param <T> 결과 타입
 * @param <E> 작업이 던질 수 있는 checked 예외 타입
 * @author Backoff Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Attemptable<T, E extends Exception> {

    /**
     * 작업 1회 실행.
     *
     * @return 결과
     * @throws E 작업 실패
     */
    T attempt() throws E;
}
