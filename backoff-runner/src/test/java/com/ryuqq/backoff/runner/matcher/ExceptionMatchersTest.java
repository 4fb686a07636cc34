package com.ryuqq.backoff.runner.matcher;

import com.ryuqq.backoff.runner.DefaultValue;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 예외 matcher 집합 테스트.
 *
 * @author Backoff Team
 * @since 1.0.0
 */
class ExceptionMatchersTest {

    private final ExceptionMatchers matchers = new ExceptionMatchers();

    @Test
    void match_NotConfigured_RetriesEverything() {
        ExceptionMatch match = matchers.match(new IllegalStateException(), null);

        assertThat(match.retryable()).isTrue();
        assertThat(match.defaultValue()).isNull();
    }

    @Test
    void match_ByType_IncludesSubtypes() {
        matchers.add(ExceptionMatcher.ofType(RuntimeException.class, null));

        assertThat(matchers.match(new IllegalArgumentException(), null).retryable()).isTrue();
        assertThat(matchers.match(new IOException(), null).retryable()).isFalse();
    }

    @Test
    void match_PrefersMatchersWithDefault() {
        // Given
        DefaultValue<String> specific = DefaultValue.of("specific");
        DefaultValue<String> all = DefaultValue.of("all");
        matchers.add(ExceptionMatcher.ofType(IllegalStateException.class, null));
        matchers.add(ExceptionMatcher.all(all));
        matchers.add(ExceptionMatcher.ofType(IllegalStateException.class, specific));

        // When
        ExceptionMatch match = matchers.match(new IllegalStateException(), null);

        // Then
        assertThat(match.retryable()).isTrue();
        assertThat(match.defaultValue()).isSameAs(specific);
    }

    @Test
    void match_CatchAllDefaultBeatsSpecificWithoutDefault() {
        DefaultValue<String> all = DefaultValue.of("all");
        matchers.add(ExceptionMatcher.ofType(IllegalStateException.class, null));
        matchers.add(ExceptionMatcher.all(all));

        assertThat(matchers.match(new IllegalStateException(), null).defaultValue()).isSameAs(all);
    }

    @Test
    void match_Predicate_ReceivesException() {
        matchers.add(ExceptionMatcher.when((e, log) -> e.getMessage().startsWith("temp"), null));

        assertThat(matchers.match(new UncheckedIOException("temporary", new IOException()), null).retryable()).isTrue();
        assertThat(matchers.match(new IllegalStateException("fatal"), null).retryable()).isFalse();
    }

    @Test
    void disable_ClearsMatchersAndUsesItsDefault() {
        // Given
        DefaultValue<String> fallback = DefaultValue.of("fallback");
        matchers.add(ExceptionMatcher.all(null));

        // When
        matchers.disable(fallback);
        ExceptionMatch match = matchers.match(new IllegalStateException(), null);

        // Then
        assertThat(matchers.isDisabled()).isTrue();
        assertThat(match.retryable()).isFalse();
        assertThat(match.defaultValue()).isSameAs(fallback);
    }

    @Test
    void add_AfterDisable_ReEnablesMatching() {
        matchers.disable(null);

        matchers.add(ExceptionMatcher.ofType(IllegalStateException.class, null));

        assertThat(matchers.isDisabled()).isFalse();
        assertThat(matchers.match(new IllegalStateException(), null).retryable()).isTrue();
    }

    @Test
    void ofType_WithNullType_ThrowsException() {
        assertThatThrownBy(() -> ExceptionMatcher.ofType(null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("type cannot be null");
    }
}
