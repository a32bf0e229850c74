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
package se.devrandom.forcelink.salesforce.registry;

import se.devrandom.forcelink.salesforce.auth.AuthProvider;
import se.devrandom.forcelink.salesforce.ratelimit.RateLimiter;
import se.devrandom.forcelink.salesforce.token.TokenCache;

/**
 * Everything the runtime holds for one org. The same instance is handed out for the lifetime
 * of the registry.
 */
public record OrgContext(OrgConfig config,
                         AuthProvider authProvider,
                         TokenCache tokenCache,
                         RateLimiter rateLimiter,
                         ApiUsageTracker usageTracker) {

    public String alias() {
        return config.alias();
    }
}
