package com.ryuqq.backoff.testkit;

import com.ryuqq.backoff.runner.Attemptable;

import java.util.ArrayList;
import java.util.List;

/**
 * Operation that replays queued results and exceptions in order.
 *
 * <p>Once the queue is exhausted the last step is repeated.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * SequenceOperation&lt;String&gt; operation = SequenceOperation.&lt;String&gt;create()
 *     .thenThrow(new IOException("reset"))
 *     .thenReturn("")
 *     .thenReturn("body");
 * </pre>
 *
 * @param <T> result type
 * @author Backoff Team
 * @since 1.0.0
 */
public final class SequenceOperation<T> implements Attemptable<T, Exception> {

    private final List<Step<T>> steps = new ArrayList<>();
    private int callCount;

    private SequenceOperation() {
    }

    public static <T> SequenceOperation<T> create() {
        return new SequenceOperation<>();
    }

    /**
     * Queues a result.
     *
     * @param result the value to return (may be null)
     * @return this
     */
    public SequenceOperation<T> thenReturn(T result) {
        steps.add(new Step<>(result, null));
        return this;
    }

    /**
     * Queues an exception. The same instance is thrown every time this step is replayed.
     *
     * @param exception the exception to throw
     * @return this
     * @throws IllegalArgumentException if exception is null
     */
    public SequenceOperation<T> thenThrow(Exception exception) {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
        steps.add(new Step<>(null, exception));
        return this;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException if no step was queued
     */
    @Override
    public T attempt() throws Exception {
        if (steps.isEmpty()) {
            throw new IllegalStateException("No steps were queued");
        }
        Step<T> step = steps.get(Math.min(callCount, steps.size() - 1));
        callCount++;
        if (step.exception() != null) {
            throw step.exception();
        }
        return step.result();
    }

    public int callCount() {
        return callCount;
    }

    private record Step<T>(T result, Exception exception) {
    }
}
