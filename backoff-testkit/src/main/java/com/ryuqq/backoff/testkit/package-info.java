/**
 * Test doubles for code that retries through {@link com.ryuqq.backoff.runner.Backoff}.
 *
 * @author Backoff Team
 * @since 1.0.0
 */
package com.ryuqq.backoff.testkit;
