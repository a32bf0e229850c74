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

import se.devrandom.forcelink.salesforce.auth.Credentials;
import se.devrandom.forcelink.salesforce.auth.LoginHosts;
import se.devrandom.forcelink.salesforce.ratelimit.RateLimitConfig;

import java.util.Objects;

/**
 * Static description of one org.
 *
 * @param domain     {@code login}, {@code test} or a custom host, see {@link LoginHosts}
 * @param apiVersion {@code 59.0} or {@code v59.0}
 * @param rateLimit  null switches local rate limiting off
 */
public record OrgConfig(String alias,
                        String domain,
                        Credentials credentials,
                        String apiVersion,
                        RateLimitConfig rateLimit) {

    public static final String DEFAULT_API_VERSION = "59.0";

    public OrgConfig {
        Objects.requireNonNull(alias, "alias");
        Objects.requireNonNull(credentials, "credentials");
        if (apiVersion == null || apiVersion.isBlank()) {
            apiVersion = DEFAULT_API_VERSION;
        }
    }

    public String loginUrl() {
        return LoginHosts.baseUrl(domain);
    }

    /**
     * @return the version segment used in URL paths, e.g. {@code v59.0}
     */
    public String versionSegment() {
        String version = apiVersion.trim();
        return version.startsWith("v") ? version : "v" + version;
    }

    /**
     * @param suffix path below the versioned data root, starting with {@code /}
     */
    public String apiPath(String suffix) {
        return "/services/data/" + versionSegment() + suffix;
    }
}
