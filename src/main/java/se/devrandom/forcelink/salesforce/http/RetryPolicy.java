/*
 * Forcelink - Salesforce API Integration Runtime
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.forcelink.salesforce.http;

import java.time.Duration;

/**
 * Bounds for transient failures (429, 5xx, transport errors).
 *
 * @param maxAttempts      attempts per call including the first one
 * @param initialBackoff   wait after the first failed attempt, doubled for each further one
 * @param rateLimitedDelay wait after a 429 that carries no {@code Retry-After}
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration rateLimitedDelay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
        if (rateLimitedDelay == null || rateLimitedDelay.isNegative()) {
            throw new IllegalArgumentException("rateLimitedDelay must not be negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(500), Duration.ofSeconds(1));
    }

    /**
     * Exponential backoff: 500ms, 1s, 2s, ... for the default initial backoff.
     */
    public Duration backoff(int failedAttempt) {
        return initialBackoff.multipliedBy(1L << (failedAttempt - 1));
    }
}
