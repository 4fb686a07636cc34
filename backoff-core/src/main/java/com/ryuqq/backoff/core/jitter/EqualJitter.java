package com.ryuqq.backoff.core.jitter;

/**
 * Equal jitter: [delay / 2, delay] 범위.
 *
 * @author Backoff Team
 * @since 1.0.0
 */
public final class EqualJitter extends RangeJitter {

    public EqualJitter() {
        super(0.5, 1);
    }
}
