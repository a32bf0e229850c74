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
package se.devrandom.forcelink.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Overall time budget for one logical operation. Every wait, backoff and HTTP exchange inside
 * the client runtime is bounded by the remaining time of the caller's deadline.
 */
public final class Deadline {

    // Stand-in for "no deadline"; large enough to never matter, small enough for timer arithmetic
    private static final Duration UNBOUNDED = Duration.ofDays(365);

    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static Deadline none() {
        return new Deadline(Clock.systemUTC(), null);
    }

    public static Deadline after(Duration timeout) {
        return after(timeout, Clock.systemUTC());
    }

    public static Deadline after(Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout");
        return new Deadline(clock, clock.instant().plus(timeout));
    }

    public boolean isBounded() {
        return expiresAt != null;
    }

    public boolean isExpired() {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    public Duration remaining() {
        if (expiresAt == null) {
            return UNBOUNDED;
        }
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * @return the shorter of {@code limit} and the time left
     */
    public Duration bound(Duration limit) {
        Duration left = remaining();
        return limit.compareTo(left) <= 0 ? limit : left;
    }

    /**
     * @return true if waiting {@code wait} would still leave the deadline unexpired
     */
    public boolean allows(Duration wait) {
        return expiresAt == null || wait.compareTo(remaining()) < 0;
    }

    @Override
    public String toString() {
        return expiresAt == null ? "Deadline[none]" : "Deadline[" + expiresAt + "]";
    }
}
