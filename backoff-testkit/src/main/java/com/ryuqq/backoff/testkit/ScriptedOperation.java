package com.ryuqq.backoff.testkit;

import com.ryuqq.backoff.runner.Attemptable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Operation that fails until a given call, then succeeds.
 *
 * <p>Each failing call throws a fresh exception from the supplied factory, so tests can check
 * that the exact instance thrown by the last attempt reaches the caller.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedOperation&lt;String&gt; operation =
 *     ScriptedOperation.succeedingOn(3, "done", () -&gt; new IllegalStateException("down"));
 *
 * backoff.attempt(operation);
 * assertEquals(3, operation.callCount());
 * </pre>
 *
 * @param <T> result type
 * @author Backoff Team
 * @since 1.0.0
 */
public final class ScriptedOperation<T> implements Attemptable<T, Exception> {

    private final int succeedOn;
    private final T result;
    private final Supplier<? extends Exception> failure;
    private final List<Exception> thrown = new ArrayList<>();
    private int callCount;

    private ScriptedOperation(int succeedOn, T result, Supplier<? extends Exception> failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        this.succeedOn = succeedOn;
        this.result = result;
        this.failure = failure;
    }

    /**
     * Creates an operation that succeeds on the given call.
     *
     * @param succeedOn 1-based call that returns the result (1 means it never fails)
     * @param result the result returned from that call onwards
     * @param failure factory for the exception thrown by earlier calls
     * @param <T> result type
     * @return a new operation
     * @throws IllegalArgumentException if succeedOn is not positive
     */
    public static <T> ScriptedOperation<T> succeedingOn(int succeedOn, T result, Supplier<? extends Exception> failure) {
        if (succeedOn <= 0) {
            throw new IllegalArgumentException("succeedOn must be positive (current: " + succeedOn + ")");
        }
        return new ScriptedOperation<>(succeedOn, result, failure);
    }

    /**
     * Creates an operation that never succeeds.
     *
     * @param failure factory for the exception thrown by every call
     * @param <T> result type
     * @return a new operation
     */
    public static <T> ScriptedOperation<T> alwaysFailing(Supplier<? extends Exception> failure) {
        return new ScriptedOperation<>(Integer.MAX_VALUE, null, failure);
    }

    @Override
    public T attempt() throws Exception {
        callCount++;
        if (callCount >= succeedOn) {
            return result;
        }
        Exception exception = failure.get();
        thrown.add(exception);
        throw exception;
    }

    public int callCount() {
        return callCount;
    }

    /**
     * Exceptions thrown so far, in call order.
     */
    public List<Exception> thrown() {
        return Collections.unmodifiableList(thrown);
    }

    /**
     * The most recently thrown exception, or null if none was thrown.
     */
    public Exception lastThrown() {
        return thrown.isEmpty() ? null : thrown.get(thrown.size() - 1);
    }
}
