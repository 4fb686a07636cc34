package com.ryuqq.backoff.testkit;

import com.ryuqq.backoff.core.strategy.AttemptLog;
import com.ryuqq.backoff.runner.Backoff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records every callback a {@link Backoff} fires.
 *
 * <p>{@link #attachTo(Backoff)} registers one callback of each kind and returns the recorder.
 * Events are kept in firing order; use {@link #clear()} between runs.</p>
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class RecordingCallbacks {

    /**
     * Callback kinds.
     */
    public enum Type {
        EXCEPTION,
        INVALID_RESULT,
        SUCCESS,
        FAILURE,
        FINALLY
    }

    /**
     * One recorded callback invocation.
     *
     * @param type callback kind
     * @param attemptNumber attempt number of the log passed in (null when no attempt was made)
     * @param willRetry retry flag (null for success, failure and finally)
     * @param payload the exception or result passed in (null for failure and finally)
     * @param log the attempt log passed in
     * @param logs the log list passed in
     */
    public record Event(Type type, Integer attemptNumber, Boolean willRetry, Object payload,
                        AttemptLog log, List<AttemptLog> logs) {
    }

    private final List<Event> events = new ArrayList<>();

    private RecordingCallbacks() {
    }

    /**
     * Registers recording callbacks on the given backoff.
     *
     * @param backoff the backoff to observe
     * @return the recorder
     * @throws IllegalArgumentException if backoff is null
     */
    public static RecordingCallbacks attachTo(Backoff backoff) {
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        RecordingCallbacks recorder = new RecordingCallbacks();
        backoff
            .exceptionCallback((e, willRetry, log, logs) -> recorder.record(Type.EXCEPTION, willRetry, e, log, logs))
            .invalidResultCallback((result, willRetry, log, logs) -> recorder.record(Type.INVALID_RESULT, willRetry, result, log, logs))
            .successCallback((result, log, logs) -> recorder.record(Type.SUCCESS, null, result, log, logs))
            .failureCallback((log, logs) -> recorder.record(Type.FAILURE, null, null, log, logs))
            .finallyCallback((log, logs) -> recorder.record(Type.FINALLY, null, null, log, logs));
        return recorder;
    }

    public List<Event> events() {
        return Collections.unmodifiableList(events);
    }

    /**
     * Callback kinds in firing order.
     */
    public List<Type> types() {
        List<Type> types = new ArrayList<>(events.size());
        for (Event event : events) {
            types.add(event.type());
        }
        return types;
    }

    public int count(Type type) {
        int count = 0;
        for (Event event : events) {
            if (event.type() == type) {
                count++;
            }
        }
        return count;
    }

    /**
     * The most recent event of the given kind, or null if it never fired.
     */
    public Event last(Type type) {
        for (int i = events.size() - 1; i >= 0; i--) {
            if (events.get(i).type() == type) {
                return events.get(i);
            }
        }
        return null;
    }

    public void clear() {
        events.clear();
    }

    private void record(Type type, Boolean willRetry, Object payload, AttemptLog log, List<AttemptLog> logs) {
        Integer attemptNumber = log != null ? log.attemptNumber() : null;
        events.add(new Event(type, attemptNumber, willRetry, payload, log, logs));
    }
}
