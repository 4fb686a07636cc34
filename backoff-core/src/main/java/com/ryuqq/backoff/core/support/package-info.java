/**
 * Shared helpers for the algorithm and jitter catalogues.
 *
 * @since 1.0.0
 */
package com.ryuqq.backoff.core.support;
