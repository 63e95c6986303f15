/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.dispatch;

import java.time.Duration;
import java.util.Objects;

import io.javaoperatorsdk.operator.processing.retry.GenericRetry;

/**
 * Exponential backoff: the first retry waits {@code initialInterval}, each later one
 * {@code multiplier} times longer, capped at {@code maxInterval}.
 *
 * @param initialInterval delay before the first retry
 * @param multiplier growth factor between attempts
 * @param maxInterval upper bound on any delay
 * @param maxAttempts number of attempts after which retrying stops
 */
public record RetryPolicy(Duration initialInterval, double multiplier, Duration maxInterval, int maxAttempts) {

    public RetryPolicy {
        Objects.requireNonNull(initialInterval);
        Objects.requireNonNull(maxInterval);
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
    }

    /**
     * @param attempt the 1-based number of the attempt that failed
     * @return how long to wait before the next attempt
     */
    public Duration delayAfter(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive");
        }
        double millis = initialInterval.toMillis() * Math.pow(multiplier, attempt - 1.0);
        if (millis >= maxInterval.toMillis()) {
            return maxInterval;
        }
        return Duration.ofMillis((long) millis);
    }

    /**
     * @param attempts the number of consecutive failed attempts
     * @return true if no further attempt should be scheduled
     */
    public boolean isExhausted(int attempts) {
        return attempts >= maxAttempts;
    }

    public GenericRetry toGenericRetry() {
        return new GenericRetry()
                .setInitialInterval(initialInterval.toMillis())
                .setIntervalMultiplier(multiplier)
                .setMaxInterval(maxInterval.toMillis())
                .setMaxAttempts(maxAttempts);
    }
}
