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
package se.devrandom.forcelink.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import se.devrandom.forcelink.exception.AuthException;
import se.devrandom.forcelink.salesforce.auth.AuthProvider;
import se.devrandom.forcelink.salesforce.auth.AuthProviders;
import se.devrandom.forcelink.salesforce.auth.Credentials;
import se.devrandom.forcelink.salesforce.auth.TokenEndpointClient;
import se.devrandom.forcelink.salesforce.ratelimit.RateLimitConfig;
import se.devrandom.forcelink.salesforce.ratelimit.RateLimiter;
import se.devrandom.forcelink.salesforce.registry.ApiUsageTracker;
import se.devrandom.forcelink.salesforce.registry.MultiOrgRegistry;
import se.devrandom.forcelink.salesforce.registry.OrgConfig;
import se.devrandom.forcelink.salesforce.registry.OrgContext;
import se.devrandom.forcelink.salesforce.token.TokenCache;
import se.devrandom.forcelink.util.Sleeper;

import java.time.Clock;
import java.util.Map;

/**
 * Builds the org registry from {@code forcelink.orgs.*}. Orgs without credentials are skipped;
 * orgs with incomplete credentials are skipped and reported.
 */
public class OrgRegistryFactory {
    private static final Logger log = LoggerFactory.getLogger(OrgRegistryFactory.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Sleeper sleeper;

    public OrgRegistryFactory(WebClient webClient, ObjectMapper objectMapper, Clock clock, Sleeper sleeper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public MultiOrgRegistry create(ForcelinkProperties properties) {
        MultiOrgRegistry.Builder builder = MultiOrgRegistry.builder();
        for (Map.Entry<String, ForcelinkProperties.Org> entry : properties.getOrgs().entrySet()) {
            String alias = entry.getKey();
            Credentials credentials;
            try {
                credentials = CredentialsFactory.fromProperties(entry.getValue());
            } catch (AuthException | IllegalArgumentException e) {
                log.error("Skipping org '{}': {}", alias, e.getMessage());
                continue;
            }
            if (credentials == null) {
                log.warn("Skipping org '{}': no credentials configured", alias);
                continue;
            }
            builder.register(createContext(alias, entry.getValue(), credentials, properties));
        }
        return builder.defaultAlias(properties.getDefaultOrg()).build();
    }

    OrgContext createContext(String alias, ForcelinkProperties.Org org, Credentials credentials,
                             ForcelinkProperties properties) {
        ForcelinkProperties.RateLimit rateLimit = org.getRateLimit();
        RateLimitConfig rateLimitConfig = rateLimit.isEnabled()
                ? new RateLimitConfig(rateLimit.getRequestsPerSecond(), rateLimit.getBurstSize(), rateLimit.isWaitOnLimit())
                : null;
        OrgConfig config = new OrgConfig(alias, org.getDomain(), credentials, org.getApiVersion(), rateLimitConfig);

        TokenEndpointClient tokenEndpoint = new TokenEndpointClient(webClient, objectMapper, config.loginUrl(),
                properties.getHttp().getRequestTimeout(), clock);
        AuthProvider authProvider = AuthProviders.create(credentials, tokenEndpoint, clock);
        RateLimiter rateLimiter = rateLimitConfig != null
                ? new RateLimiter(rateLimitConfig, System::nanoTime, sleeper)
                : RateLimiter.unlimited();

        log.info("Org '{}': {} via {} (API {}, rate limit {})", alias, credentials.authType(), config.loginUrl(),
                config.versionSegment(), rateLimitConfig != null
                        ? rateLimitConfig.requestsPerSecond() + "/s burst " + rateLimitConfig.burstSize()
                        : "off");
        return new OrgContext(config, authProvider, new TokenCache(alias, clock), rateLimiter,
                new ApiUsageTracker(alias, clock));
    }
}
