package org.retryhelper.internal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.retryhelper.AsyncTryCallback;
import org.retryhelper.MaxTryCount;
import org.retryhelper.TimeLimit;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayName("Retry configuration")
@DisplayNameGeneration(ReplaceUnderscores.class)
class RetryConfigurationTest {

    private final RetryConfiguration<String> configuration = RetryConfiguration.of(() -> Mono.just("value"), Duration.ofMillis(500),
            MaxTryCount.infinite(), TimeLimit.infinite(), LoggerFactory.getLogger(RetryConfigurationTest.class));

    @Test
    void defaults() {
        assertAll(
                () -> assertThat(configuration.tryInterval()).isEqualTo(Duration.ofMillis(500)),
                () -> assertThat(configuration.maxTryCount()).isEqualTo(MaxTryCount.infinite()),
                () -> assertThat(configuration.timeLimit()).isEqualTo(TimeLimit.infinite()),
                () -> assertThat(configuration.exceptionPolicy()).isEqualTo(ExceptionPolicy.propagate()),
                () -> assertThat(configuration.onSuccess()).isEmpty(),
                () -> assertThat(configuration.onFailure()).isEmpty(),
                () -> assertThat(configuration.onTimeout()).isEmpty(),
                () -> assertThat(configuration.endCondition.apply("anything").block()).isTrue()
        );
    }

    @Test
    void with_methods_return_a_new_configuration_and_leave_the_original_untouched() {
        // When
        RetryConfiguration<String> changed = configuration
                .withMaxTryCount(MaxTryCount.limit(2))
                .withTimeLimit(TimeLimit.ofMillis(100))
                .withTryInterval(Duration.ofMillis(10))
                .withExceptionPolicy(ExceptionPolicy.retryOn(IllegalStateException.class));

        // Then
        assertAll(
                () -> assertThat(changed.maxTryCount()).isEqualTo(MaxTryCount.limit(2)),
                () -> assertThat(changed.timeLimit()).isEqualTo(TimeLimit.ofMillis(100)),
                () -> assertThat(changed.tryInterval()).isEqualTo(Duration.ofMillis(10)),
                () -> assertThat(changed.exceptionPolicy()).isEqualTo(ExceptionPolicy.retryOn(IllegalStateException.class)),
                () -> assertThat(configuration.maxTryCount()).isEqualTo(MaxTryCount.infinite()),
                () -> assertThat(configuration.timeLimit()).isEqualTo(TimeLimit.infinite()),
                () -> assertThat(configuration.tryInterval()).isEqualTo(Duration.ofMillis(500)),
                () -> assertThat(configuration.exceptionPolicy()).isEqualTo(ExceptionPolicy.propagate())
        );
    }

    @Test
    void configurations_derived_from_the_same_configuration_do_not_share_callbacks() {
        // Given
        AsyncTryCallback<String> first = (result, tryCount) -> Mono.empty();
        AsyncTryCallback<String> second = (result, tryCount) -> Mono.empty();
        AsyncTryCallback<String> third = (result, tryCount) -> Mono.empty();
        RetryConfiguration<String> base = configuration.addOnFailure(first);

        // When
        RetryConfiguration<String> left = base.addOnFailure(second);
        RetryConfiguration<String> right = base.addOnFailure(third);

        // Then
        assertAll(
                () -> assertThat(base.onFailure()).containsExactly(first),
                () -> assertThat(left.onFailure()).containsExactly(first, second),
                () -> assertThat(right.onFailure()).containsExactly(first, third),
                () -> assertThat(configuration.onFailure()).isEmpty()
        );
    }

    @Test
    void callbacks_of_each_kind_are_kept_apart() {
        // Given
        AsyncTryCallback<String> success = (result, tryCount) -> Mono.empty();
        AsyncTryCallback<String> timeout = (result, tryCount) -> Mono.empty();

        // When
        RetryConfiguration<String> changed = configuration.addOnSuccess(success).addOnTimeout(timeout);

        // Then
        assertAll(
                () -> assertThat(changed.onSuccess()).containsExactly(success),
                () -> assertThat(changed.onFailure()).isEmpty(),
                () -> assertThat(changed.onTimeout()).containsExactly(timeout)
        );
    }

    @Test
    void callback_lists_cannot_be_modified() {
        RetryConfiguration<String> changed = configuration.addOnSuccess((result, tryCount) -> Mono.empty());

        assertThatThrownBy(() -> changed.onSuccess().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rejects_null_callbacks() {
        assertThatThrownBy(() -> configuration.addOnTimeout(null)).isInstanceOf(NullPointerException.class);
    }
}
