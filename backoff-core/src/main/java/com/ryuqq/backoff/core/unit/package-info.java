/**
 * Time unit package.
 *
 * <p>Delays are plain numbers interpreted in a {@link com.ryuqq.backoff.core.unit.UnitType}.
 * {@link com.ryuqq.backoff.core.unit.TimeSpans} converts between units at the edges
 * (attempt logs, delay getters, sleeping).</p>
 *
 * @since 1.0.0
 * @author Backoff Team
 */
package com.ryuqq.backoff.core.unit;
