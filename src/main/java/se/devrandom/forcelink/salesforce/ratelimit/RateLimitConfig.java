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
package se.devrandom.forcelink.salesforce.ratelimit;

/**
 * Token bucket settings of one org.
 *
 * @param requestsPerSecond continuous refill rate, must be positive
 * @param burstSize         bucket capacity, at least 1
 * @param waitOnLimit       block until a permit frees up instead of failing
 */
public record RateLimitConfig(double requestsPerSecond, int burstSize, boolean waitOnLimit) {

    public static final double DEFAULT_REQUESTS_PER_SECOND = 10.0;
    public static final int DEFAULT_BURST_SIZE = 20;

    public RateLimitConfig {
        if (!(requestsPerSecond > 0) || Double.isInfinite(requestsPerSecond)) {
            throw new IllegalArgumentException("requestsPerSecond must be positive, was " + requestsPerSecond);
        }
        if (burstSize < 1) {
            throw new IllegalArgumentException("burstSize must be at least 1, was " + burstSize);
        }
    }

    public static RateLimitConfig defaults() {
        return new RateLimitConfig(DEFAULT_REQUESTS_PER_SECOND, DEFAULT_BURST_SIZE, true);
    }
}
