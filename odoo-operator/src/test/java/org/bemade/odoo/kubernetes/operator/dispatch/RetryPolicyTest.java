/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.dispatch;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import io.javaoperatorsdk.operator.processing.retry.GenericRetry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(Duration.ofSeconds(2), 2.0, Duration.ofSeconds(30), 4);

    @ParameterizedTest
    @CsvSource({ "1, 2", "2, 4", "3, 8", "4, 16", "5, 30", "20, 30" })
    void delayGrowsExponentiallyUpToTheCap(int attempt, long expectedSeconds) {
        assertThat(policy.delayAfter(attempt)).isEqualTo(Duration.ofSeconds(expectedSeconds));
    }

    @Test
    void shouldRejectNonPositiveAttempt() {
        assertThatThrownBy(() -> policy.delayAfter(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isExhaustedOnceMaxAttemptsReached() {
        assertThat(policy.isExhausted(3)).isFalse();
        assertThat(policy.isExhausted(4)).isTrue();
        assertThat(policy.isExhausted(5)).isTrue();
    }

    @Test
    void shouldRejectShrinkingMultiplier() {
        Duration second = Duration.ofSeconds(1);
        assertThatThrownBy(() -> new RetryPolicy(second, 0.5, second, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("multiplier");
    }

    @Test
    void shouldRejectZeroAttempts() {
        Duration second = Duration.ofSeconds(1);
        assertThatThrownBy(() -> new RetryPolicy(second, 1.0, second, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxAttempts");
    }

    @Test
    void convertsToGenericRetry() {
        // When
        GenericRetry retry = policy.toGenericRetry();

        // Then
        assertThat(retry.getInitialInterval()).isEqualTo(2000L);
        assertThat(retry.getIntervalMultiplier()).isEqualTo(2.0);
        assertThat(retry.getMaxInterval()).isEqualTo(30000L);
        assertThat(retry.getMaxAttempts()).isEqualTo(4);
    }
}
