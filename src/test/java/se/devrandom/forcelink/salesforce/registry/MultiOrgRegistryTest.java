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

import org.junit.jupiter.api.Test;
import se.devrandom.forcelink.exception.UnknownOrgException;
import se.devrandom.forcelink.salesforce.auth.ClientCredentials;
import se.devrandom.forcelink.support.MutableClock;
import se.devrandom.forcelink.support.StubAuthProvider;
import se.devrandom.forcelink.support.TestOrgs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MultiOrgRegistryTest {

    private final MutableClock clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
    private final OrgContext prod = TestOrgs.context("prod", clock, new StubAuthProvider(clock));
    private final OrgContext sandbox = TestOrgs.context("sandbox", clock, new StubAuthProvider(clock));

    @Test
    void resolvesByAliasAndFallsBackToDefault() {
        MultiOrgRegistry registry = MultiOrgRegistry.builder()
                .register(prod)
                .register(sandbox)
                .defaultAlias("prod")
                .build();

        assertThat(registry.resolve("sandbox")).isSameAs(sandbox);
        assertThat(registry.resolve(null)).isSameAs(prod);
        assertThat(registry.resolve("  ")).isSameAs(prod);
        assertThat(registry.aliases()).containsExactly("prod", "sandbox");
    }

    @Test
    void sameContextForTheRegistryLifetime() {
        MultiOrgRegistry registry = MultiOrgRegistry.builder().register(prod).defaultAlias("prod").build();

        assertThat(registry.resolve("prod").tokenCache()).isSameAs(registry.resolve(null).tokenCache());
    }

    @Test
    void unknownAliasListsKnownOrgs() {
        MultiOrgRegistry registry = MultiOrgRegistry.builder().register(prod).register(sandbox).build();

        assertThatThrownBy(() -> registry.resolve("staging"))
                .isInstanceOfSatisfying(UnknownOrgException.class, e -> {
                    assertThat(e.getAlias()).isEqualTo("staging");
                    assertThat(e.getDetails()).containsEntry("known_orgs", java.util.List.of("prod", "sandbox"));
                });
    }

    @Test
    void missingDefaultFailsOnlyOnUse() {
        MultiOrgRegistry registry = MultiOrgRegistry.builder().register(sandbox).defaultAlias("default").build();

        assertThat(registry.resolve("sandbox")).isSameAs(sandbox);
        assertThatThrownBy(() -> registry.resolve(null)).isInstanceOf(UnknownOrgException.class);
    }

    @Test
    void duplicateAliasIsRejected() {
        MultiOrgRegistry.Builder builder = MultiOrgRegistry.builder().register(prod);

        assertThatThrownBy(() -> builder.register(TestOrgs.context("prod", clock, new StubAuthProvider(clock))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void orgConfigBuildsVersionedPaths() {
        OrgConfig config = new OrgConfig("uat", "test", new ClientCredentials("id", "secret"), null, null);

        assertThat(config.apiVersion()).isEqualTo("59.0");
        assertThat(config.apiPath("/query")).isEqualTo("/services/data/v59.0/query");
        assertThat(config.loginUrl()).isEqualTo("https://test.salesforce.com");
        assertThat(new OrgConfig("uat", "test", new ClientCredentials("id", "secret"), "v61.0", null).versionSegment())
                .isEqualTo("v61.0");
    }
}
