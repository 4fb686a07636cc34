package com.ryuqq.backoff.runner;

import java.util.function.Supplier;

/**
 * 기본값 (재시도가 모두 실패했을 때 반환할 값).
 *
 * <p>{@link #from(Supplier)}로 만든 기본값은 실제로 사용될 때만 supplier를 호출합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * backoff.retryExceptions(TimeoutException.class, DefaultValue.of("cached"));
 * backoff.retryAllExceptions(DefaultValue.from(() -&gt; cache.load(key)));
 * </pre>
 *
 * @param <T> 값 타입
 * @author Backoff Team
 * @since 1.0.0
 */
public final class DefaultValue<T> {

    private final Supplier<? extends T> supplier;

    private DefaultValue(Supplier<? extends T> supplier) {
        this.supplier = supplier;
    }

    /**
     * 고정 값으로 생성.
     *
     * @param value 기본값 (null 허용)
     * @param <T> 값 타입
     * @return 기본값
     */
    public static <T> DefaultValue<T> of(T value) {
        return new DefaultValue<>(() -> value);
    }

    /**
     * 사용 시점에 계산되는 값으로 생성.
     *
     * @param supplier 값 공급자
     * @param <T> 값 타입
     * @return 기본값
     * @throws IllegalArgumentException supplier가 null인 경우
     */
    public static <T> DefaultValue<T> from(Supplier<? extends T> supplier) {
        if (supplier == null) {
            throw new IllegalArgumentException("supplier cannot be null");
        }
        return new DefaultValue<>(supplier);
    }

    /**
     * 값 조회 (supplier 기반이면 이 시점에 호출).
     *
     * @return 기본값
     */
    public T get() {
        return supplier.get();
    }
}
