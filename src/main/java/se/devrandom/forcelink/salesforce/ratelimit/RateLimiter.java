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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.devrandom.forcelink.exception.OperationTimeoutException;
import se.devrandom.forcelink.exception.RateLimitException;
import se.devrandom.forcelink.util.Deadline;
import se.devrandom.forcelink.util.Sleeper;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Token bucket shared by every call to one org. The bucket starts full and refills continuously;
 * refill and take happen atomically under one lock, waiting happens outside it.
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final RateLimitConfig config;
    private final LongSupplier nanoTime;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock();

    private double permits;
    private long lastRefillNanos;

    public RateLimiter(RateLimitConfig config) {
        this(config, System::nanoTime, Sleeper.SYSTEM);
    }

    public RateLimiter(RateLimitConfig config, LongSupplier nanoTime, Sleeper sleeper) {
        this.config = config;
        this.nanoTime = nanoTime;
        this.sleeper = sleeper;
        if (config != null) {
            this.permits = config.burstSize();
            this.lastRefillNanos = nanoTime.getAsLong();
        }
    }

    /**
     * A limiter that admits every call, for orgs with rate limiting switched off.
     */
    public static RateLimiter unlimited() {
        return new RateLimiter(null, System::nanoTime, Sleeper.SYSTEM);
    }

    public boolean isEnabled() {
        return config != null;
    }

    /**
     * Takes one permit, waiting for it when configured to.
     *
     * @throws RateLimitException        the bucket is empty and waiting is off
     * @throws OperationTimeoutException the wait would overrun {@code deadline}
     */
    public void acquire(Deadline deadline) {
        if (config == null) {
            return;
        }
        while (true) {
            Duration wait = takeOrWaitTime();
            if (wait.isZero()) {
                return;
            }
            if (!config.waitOnLimit()) {
                throw new RateLimitException("Local rate limit of " + config.requestsPerSecond()
                        + " requests/s exceeded, retry in " + wait.toMillis() + "ms", wait, false);
            }
            if (!deadline.allows(wait)) {
                throw new OperationTimeoutException("rate-limit",
                        "Waiting " + wait.toMillis() + "ms for a rate limit permit would exceed the deadline");
            }
            log.debug("Rate limit reached, waiting {}ms for a permit", wait.toMillis());
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationTimeoutException("rate-limit", "Interrupted while waiting for a rate limit permit", e);
            }
        }
    }

    /**
     * Takes one permit if one is available right now.
     */
    public boolean tryAcquire() {
        if (config == null) {
            return true;
        }
        return takeOrWaitTime().isZero();
    }

    public double availablePermits() {
        if (config == null) {
            return Double.POSITIVE_INFINITY;
        }
        lock.lock();
        try {
            refill();
            return permits;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return zero if a permit was taken, otherwise the time until one will be available
     */
    private Duration takeOrWaitTime() {
        lock.lock();
        try {
            refill();
            if (permits >= 1.0) {
                permits -= 1.0;
                return Duration.ZERO;
            }
            double missing = 1.0 - permits;
            long waitNanos = (long) Math.ceil(missing / config.requestsPerSecond() * NANOS_PER_SECOND);
            return Duration.ofNanos(Math.max(1L, waitNanos));
        } finally {
            lock.unlock();
        }
    }

    private void refill() {
        long now = nanoTime.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            permits = Math.min(config.burstSize(), permits + elapsed / NANOS_PER_SECOND * config.requestsPerSecond());
            lastRefillNanos = now;
        }
    }
}
