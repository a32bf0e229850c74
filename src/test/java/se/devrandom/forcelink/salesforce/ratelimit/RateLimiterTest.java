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

import org.junit.jupiter.api.Test;
import se.devrandom.forcelink.exception.OperationTimeoutException;
import se.devrandom.forcelink.exception.RateLimitException;
import se.devrandom.forcelink.support.FakeNanoTime;
import se.devrandom.forcelink.support.MutableClock;
import se.devrandom.forcelink.support.RecordingSleeper;
import se.devrandom.forcelink.util.Deadline;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private final FakeNanoTime nanoTime = new FakeNanoTime();
    private final MutableClock clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
    private final RecordingSleeper sleeper = new RecordingSleeper(clock, nanoTime);

    @Test
    void burstIsAvailableImmediately() {
        RateLimiter limiter = new RateLimiter(new RateLimitConfig(2, 4, true), nanoTime, sleeper);

        for (int i = 0; i < 4; i++) {
            limiter.acquire(Deadline.none());
        }

        assertThat(sleeper.getSleeps()).isEmpty();
        assertThat(limiter.availablePermits()).isZero();
    }

    @Test
    void waitsForRefillOnceBurstIsSpent() {
        RateLimiter limiter = new RateLimiter(new RateLimitConfig(2, 2, true), nanoTime, sleeper);
        limiter.acquire(Deadline.none());
        limiter.acquire(Deadline.none());

        limiter.acquire(Deadline.none());
        limiter.acquire(Deadline.none());

        assertThat(sleeper.getSleeps()).containsExactly(Duration.ofMillis(500), Duration.ofMillis(500));
    }

    @Test
    void refillNeverExceedsBurst() {
        RateLimiter limiter = new RateLimiter(new RateLimitConfig(4, 3, true), nanoTime, sleeper);
        limiter.acquire(Deadline.none());

        nanoTime.advance(Duration.ofMinutes(5));

        assertThat(limiter.availablePermits()).isEqualTo(3.0);
    }

    @Test
    void failsFastWhenWaitingIsOff() {
        RateLimiter limiter = new RateLimiter(new RateLimitConfig(2, 1, false), nanoTime, sleeper);
        limiter.acquire(Deadline.none());

        assertThatThrownBy(() -> limiter.acquire(Deadline.none()))
                .isInstanceOfSatisfying(RateLimitException.class, e -> {
                    assertThat(e.isRemote()).isFalse();
                    assertThat(e.getRetryAfter()).isEqualTo(Duration.ofMillis(500));
                });
        assertThat(sleeper.getSleeps()).isEmpty();
    }

    @Test
    void refusesToWaitPastTheDeadline() {
        RateLimiter limiter = new RateLimiter(new RateLimitConfig(2, 1, true), nanoTime, sleeper);
        limiter.acquire(Deadline.none());

        assertThatThrownBy(() -> limiter.acquire(Deadline.after(Duration.ofMillis(200), clock)))
                .isInstanceOf(OperationTimeoutException.class);
        assertThat(sleeper.getSleeps()).isEmpty();
    }

    @Test
    void tryAcquireNeverBlocks() {
        RateLimiter limiter = new RateLimiter(new RateLimitConfig(2, 1, true), nanoTime, sleeper);

        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isFalse();
        nanoTime.advance(Duration.ofMillis(500));
        assertThat(limiter.tryAcquire()).isTrue();
    }

    @Test
    void unlimitedAdmitsEverything() {
        RateLimiter limiter = RateLimiter.unlimited();

        for (int i = 0; i < 1000; i++) {
            limiter.acquire(Deadline.after(Duration.ZERO));
        }

        assertThat(limiter.isEnabled()).isFalse();
        assertThat(limiter.tryAcquire()).isTrue();
    }

    @Test
    void concurrentCallersNeverOverdrawTheBurst() throws Exception {
        int burst = 5;
        int callers = 20;
        RateLimiter limiter = new RateLimiter(new RateLimitConfig(1, burst, false), nanoTime, sleeper);
        CountDownLatch ready = new CountDownLatch(callers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Double> observedPermits = Collections.synchronizedList(new ArrayList<>());

        ExecutorService executor = Executors.newFixedThreadPool(callers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(executor.submit(() -> {
                    ready.countDown();
                    start.await();
                    try {
                        limiter.acquire(Deadline.none());
                        admitted.incrementAndGet();
                    } catch (RateLimitException e) {
                        rejected.incrementAndGet();
                    }
                    observedPermits.add(limiter.availablePermits());
                    return null;
                }));
            }
            assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(admitted.get()).isEqualTo(burst);
        assertThat(rejected.get()).isEqualTo(callers - burst);
        assertThat(observedPermits).hasSize(callers).allSatisfy(p -> assertThat(p).isGreaterThanOrEqualTo(0.0));
        assertThat(limiter.availablePermits()).isZero();
        assertThat(sleeper.getSleeps()).isEmpty();
    }

    @Test
    void configRejectsNonsense() {
        assertThatThrownBy(() -> new RateLimitConfig(0, 10, true)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RateLimitConfig(Double.NaN, 10, true)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RateLimitConfig(5, 0, true)).isInstanceOf(IllegalArgumentException.class);
        assertThat(RateLimitConfig.defaults()).isEqualTo(new RateLimitConfig(10.0, 20, true));
    }
}
