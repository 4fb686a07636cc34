package com.ryuqq.backoff.core.strategy;

import com.ryuqq.backoff.core.exception.BackoffRuntimeException;

import java.util.concurrent.TimeUnit;

/**
 * 현재 스레드를 블로킹하는 기본 {@link Sleeper}.
 *
 * <p>조기 기상(spurious wakeup)을 고려해 {@link System#nanoTime()} 기준 마감 시각까지 반복 대기합니다.
 * 인터럽트되면 인터럽트 플래그를 복원하고 {@link BackoffRuntimeException}을 던집니다.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class DefaultSleeper implements Sleeper {

    /**
     * 공유 인스턴스 (상태 없음).
     */
    public static final DefaultSleeper INSTANCE = new DefaultSleeper();

    @Override
    public void sleep(long nanos) {
        if (nanos <= 0) {
            return;
        }
        long deadline = System.nanoTime() + nanos;
        long remaining = nanos;
        try {
            while (remaining > 0) {
                TimeUnit.NANOSECONDS.sleep(remaining);
                remaining = deadline - System.nanoTime();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw BackoffRuntimeException.sleepInterrupted(e);
        }
    }
}
