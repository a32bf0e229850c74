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
package se.devrandom.forcelink.support;

import se.devrandom.forcelink.salesforce.auth.AuthProvider;
import se.devrandom.forcelink.salesforce.token.AccessToken;
import se.devrandom.forcelink.util.Deadline;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Issues numbered tokens ({@code token-1}, {@code token-2}, ...) without any network call.
 */
public class StubAuthProvider implements AuthProvider {

    public static final String INSTANCE_URL = "https://acme.my.salesforce.com";

    private final Clock clock;
    private final Duration lifetime;
    private final AtomicInteger issued = new AtomicInteger();
    private final AtomicInteger authentications = new AtomicInteger();
    private final AtomicInteger refreshes = new AtomicInteger();
    private volatile Duration latency = Duration.ZERO;

    public StubAuthProvider(Clock clock) {
        this(clock, Duration.ofHours(2));
    }

    public StubAuthProvider(Clock clock, Duration lifetime) {
        this.clock = clock;
        this.lifetime = lifetime;
    }

    /**
     * Makes every token request block for a while, to widen race windows.
     */
    public StubAuthProvider withLatency(Duration latency) {
        this.latency = latency;
        return this;
    }

    @Override
    public AccessToken authenticate(Deadline deadline) {
        authentications.incrementAndGet();
        return issue();
    }

    @Override
    public AccessToken refresh(AccessToken current, Deadline deadline) {
        refreshes.incrementAndGet();
        return issue();
    }

    @Override
    public String getAuthType() {
        return "stub";
    }

    public int getAuthentications() {
        return authentications.get();
    }

    public int getRefreshes() {
        return refreshes.get();
    }

    private AccessToken issue() {
        if (!latency.isZero()) {
            try {
                Thread.sleep(latency.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
        int n = issued.incrementAndGet();
        return new AccessToken("token-" + n, INSTANCE_URL, clock.instant(),
                lifetime == null ? null : clock.instant().plus(lifetime), null);
    }
}
