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
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import se.devrandom.forcelink.exception.UnknownOrgException;
import se.devrandom.forcelink.salesforce.registry.MultiOrgRegistry;
import se.devrandom.forcelink.salesforce.registry.OrgContext;
import se.devrandom.forcelink.salesforce.token.AccessToken;
import se.devrandom.forcelink.support.MutableClock;
import se.devrandom.forcelink.support.RecordingSleeper;
import se.devrandom.forcelink.support.StubExchangeFunction;
import se.devrandom.forcelink.support.StubResponse;
import se.devrandom.forcelink.util.Deadline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrgRegistryFactoryTest {

    private final MutableClock clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
    private final StubExchangeFunction stub = new StubExchangeFunction();
    private final OrgRegistryFactory factory = new OrgRegistryFactory(stub.webClient(), new ObjectMapper(),
            clock, new RecordingSleeper(clock));

    private static ForcelinkProperties.Org passwordOrg(String username, String domain) {
        ForcelinkProperties.Org org = new ForcelinkProperties.Org();
        org.setUsername(username);
        org.setPassword("secret");
        org.setDomain(domain);
        return org;
    }

    @Test
    void registersEveryConfiguredOrg() {
        ForcelinkProperties properties = new ForcelinkProperties();
        properties.setDefaultOrg("prod");
        properties.getOrgs().put("prod", passwordOrg("admin@acme.com", "login"));
        properties.getOrgs().put("sandbox", passwordOrg("admin@acme.com.uat", "test"));

        MultiOrgRegistry registry = factory.create(properties);

        assertThat(registry.aliases()).containsExactly("prod", "sandbox");
        assertThat(registry.defaultAlias()).isEqualTo("prod");
        assertThat(registry.resolve("sandbox").config().loginUrl()).isEqualTo("https://test.salesforce.com");
        assertThat(registry.resolve(null).authProvider().getAuthType()).isEqualTo("username-password");
    }

    @Test
    void skipsOrgsWithoutOrWithBrokenCredentials() {
        ForcelinkProperties properties = new ForcelinkProperties();
        properties.getOrgs().put("default", new ForcelinkProperties.Org());
        ForcelinkProperties.Org broken = new ForcelinkProperties.Org();
        broken.setUsername("admin@acme.com");
        properties.getOrgs().put("broken", broken);
        ForcelinkProperties.Org unsupported = passwordOrg("admin@acme.com", "login");
        unsupported.setAuthType("saml");
        properties.getOrgs().put("unsupported", unsupported);
        properties.getOrgs().put("ok", passwordOrg("admin@acme.com", "login"));

        MultiOrgRegistry registry = factory.create(properties);

        assertThat(registry.aliases()).containsExactly("ok");
        assertThatThrownBy(() -> registry.resolve(null)).isInstanceOf(UnknownOrgException.class);
    }

    @Test
    void rateLimitFollowsOrgSettings() {
        ForcelinkProperties properties = new ForcelinkProperties();
        ForcelinkProperties.Org limited = passwordOrg("admin@acme.com", "login");
        limited.getRateLimit().setRequestsPerSecond(5);
        limited.getRateLimit().setBurstSize(7);
        ForcelinkProperties.Org unlimited = passwordOrg("admin@acme.com", "login");
        unlimited.getRateLimit().setEnabled(false);
        properties.getOrgs().put("limited", limited);
        properties.getOrgs().put("unlimited", unlimited);

        MultiOrgRegistry registry = factory.create(properties);

        OrgContext limitedOrg = registry.resolve("limited");
        assertThat(limitedOrg.config().rateLimit().burstSize()).isEqualTo(7);
        assertThat(limitedOrg.rateLimiter().isEnabled()).isTrue();
        assertThat(registry.resolve("unlimited").config().rateLimit()).isNull();
        assertThat(registry.resolve("unlimited").rateLimiter().isEnabled()).isFalse();
    }

    @Test
    void providersAuthenticateAgainstTheOrgLoginHost() {
        stub.on(HttpMethod.POST, "/services/oauth2/token", StubResponse.json(200,
                "{\"access_token\":\"sess\",\"instance_url\":\"https://acme--uat.sandbox.my.salesforce.com\"}"));
        ForcelinkProperties properties = new ForcelinkProperties();
        properties.getOrgs().put("sandbox", passwordOrg("admin@acme.com.uat", "test"));

        AccessToken token = factory.create(properties).resolve("sandbox").authProvider().authenticate(Deadline.none());

        assertThat(token.instanceUrl()).isEqualTo("https://acme--uat.sandbox.my.salesforce.com");
        assertThat(stub.getRequests().get(0).url().getHost()).isEqualTo("test.salesforce.com");
    }
}
