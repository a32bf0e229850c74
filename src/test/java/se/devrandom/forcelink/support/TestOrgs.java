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
import se.devrandom.forcelink.salesforce.auth.UsernamePasswordCredentials;
import se.devrandom.forcelink.salesforce.ratelimit.RateLimiter;
import se.devrandom.forcelink.salesforce.registry.ApiUsageTracker;
import se.devrandom.forcelink.salesforce.registry.OrgConfig;
import se.devrandom.forcelink.salesforce.registry.OrgContext;
import se.devrandom.forcelink.salesforce.token.TokenCache;

import java.time.Clock;

public final class TestOrgs {

    private TestOrgs() {
    }

    public static OrgContext context(String alias, Clock clock, AuthProvider provider) {
        return context(alias, clock, provider, RateLimiter.unlimited());
    }

    public static OrgContext context(String alias, Clock clock, AuthProvider provider, RateLimiter rateLimiter) {
        OrgConfig config = new OrgConfig(alias, "login",
                new UsernamePasswordCredentials(alias + "@acme.com", "pw", ""), "59.0", null);
        return new OrgContext(config, provider, new TokenCache(alias, clock), rateLimiter,
                new ApiUsageTracker(alias, clock));
    }
}
