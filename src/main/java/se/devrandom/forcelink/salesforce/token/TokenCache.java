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
package se.devrandom.forcelink.salesforce.token;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.devrandom.forcelink.exception.NotAuthenticatedException;
import se.devrandom.forcelink.exception.OperationTimeoutException;
import se.devrandom.forcelink.salesforce.auth.AuthProvider;
import se.devrandom.forcelink.util.Deadline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the live token of exactly one org.
 *
 * <p>Reads are lock free. The check-then-refresh-then-store sequence runs under a lock owned by
 * this org only, so two callers that both see an expired token produce a single refresh: the
 * second one waits and reuses the first one's result.
 */
public class TokenCache {
    private static final Logger log = LoggerFactory.getLogger(TokenCache.class);

    public static final Duration DEFAULT_SKEW = Duration.ofSeconds(30);

    private final String orgAlias;
    private final Clock clock;
    private final Duration skew;
    private final AtomicReference<AccessToken> current = new AtomicReference<>();
    private final ReentrantLock refreshLock = new ReentrantLock();

    public TokenCache(String orgAlias, Clock clock) {
        this(orgAlias, clock, DEFAULT_SKEW);
    }

    public TokenCache(String orgAlias, Clock clock, Duration skew) {
        this.orgAlias = orgAlias;
        this.clock = clock;
        this.skew = skew;
    }

    public AccessToken get() {
        AccessToken token = current.get();
        if (token == null) {
            throw new NotAuthenticatedException(orgAlias);
        }
        return token;
    }

    public Optional<AccessToken> peek() {
        return Optional.ofNullable(current.get());
    }

    public void set(AccessToken token) {
        current.set(Objects.requireNonNull(token, "token"));
    }

    public void clear() {
        current.set(null);
    }

    /**
     * A token without a known expiry is assumed valid until the remote API says otherwise.
     */
    public boolean isExpired(AccessToken token, Instant now) {
        Instant expiresAt = token.expiresAt();
        return expiresAt != null && !now.isBefore(expiresAt.minus(skew));
    }

    public boolean isExpired(AccessToken token) {
        return isExpired(token, clock.instant());
    }

    /**
     * Returns a usable token, authenticating when none is cached and refreshing when the cached
     * one has expired.
     */
    public AccessToken validToken(AuthProvider provider, Deadline deadline) {
        AccessToken token = current.get();
        if (token != null && !isExpired(token)) {
            return token;
        }

        lock(deadline);
        try {
            token = current.get();
            if (token != null && !isExpired(token)) {
                // Another caller refreshed while we waited for the lock
                return token;
            }
            AccessToken fresh;
            if (token == null) {
                log.info("Authenticating org '{}' using {}", orgAlias, provider.getAuthType());
                fresh = provider.authenticate(deadline);
            } else {
                log.info("Access token for org '{}' expired at {}, refreshing", orgAlias, token.expiresAt());
                fresh = provider.refresh(token, deadline);
            }
            current.set(fresh);
            return fresh;
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Replaces a token the remote API rejected with 401. If another caller has already replaced
     * it, that replacement is returned without a second refresh.
     */
    public AccessToken refreshRejected(AuthProvider provider, AccessToken rejected, Deadline deadline) {
        lock(deadline);
        try {
            AccessToken token = current.get();
            if (token != null && token != rejected && !isExpired(token)) {
                log.debug("Token for org '{}' was already refreshed by another caller", orgAlias);
                return token;
            }
            log.info("Access token for org '{}' was rejected, refreshing", orgAlias);
            AccessToken fresh = provider.refresh(rejected, deadline);
            current.set(fresh);
            return fresh;
        } finally {
            refreshLock.unlock();
        }
    }

    public String getOrgAlias() {
        return orgAlias;
    }

    private void lock(Deadline deadline) {
        try {
            Duration wait = deadline.remaining();
            if (!refreshLock.tryLock(wait.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new OperationTimeoutException("token.refresh",
                        "Timed out waiting for token refresh of org '" + orgAlias + "'");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationTimeoutException("token.refresh",
                    "Interrupted while waiting for token refresh of org '" + orgAlias + "'", e);
        }
    }
}
