package com.ryuqq.backoff.core.jitter;

/**
 * Full jitter: [0, delay] 범위.
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class FullJitter extends RangeJitter {

    public FullJitter() {
        super(0, 1);
    }
}
