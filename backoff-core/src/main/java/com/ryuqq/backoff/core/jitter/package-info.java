/**
 * Jitter catalogue.
 *
 * <p>{@link com.ryuqq.backoff.core.jitter.FullJitter} and
 * {@link com.ryuqq.backoff.core.jitter.EqualJitter} are fixed ranges of
 * {@link com.ryuqq.backoff.core.jitter.RangeJitter}. "No jitter" is expressed by not configuring one.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.backoff.core.jitter;
