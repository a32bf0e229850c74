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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.devrandom.forcelink.exception.UnknownOrgException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps org aliases to their runtime context. Populated once through {@link Builder} and
 * read-only afterwards, so lookups need no locking.
 */
public class MultiOrgRegistry {
    private static final Logger log = LoggerFactory.getLogger(MultiOrgRegistry.class);

    private final Map<String, OrgContext> orgs;
    private final String defaultAlias;

    private MultiOrgRegistry(Map<String, OrgContext> orgs, String defaultAlias) {
        this.orgs = Collections.unmodifiableMap(new LinkedHashMap<>(orgs));
        this.defaultAlias = defaultAlias;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param alias null or blank selects the default org
     * @throws UnknownOrgException no org is registered under the alias
     */
    public OrgContext resolve(String alias) {
        String effective = alias == null || alias.isBlank() ? defaultAlias : alias.trim();
        OrgContext context = effective == null ? null : orgs.get(effective);
        if (context == null) {
            throw new UnknownOrgException(effective, orgs.keySet());
        }
        return context;
    }

    /**
     * Registered aliases in registration order.
     */
    public Set<String> aliases() {
        return orgs.keySet();
    }

    public String defaultAlias() {
        return defaultAlias;
    }

    public boolean isEmpty() {
        return orgs.isEmpty();
    }

    public static class Builder {
        private final Map<String, OrgContext> orgs = new LinkedHashMap<>();
        private String defaultAlias;

        public Builder register(OrgContext context) {
            if (orgs.putIfAbsent(context.alias(), context) != null) {
                throw new IllegalArgumentException("Org alias '" + context.alias() + "' is registered twice");
            }
            return this;
        }

        public Builder defaultAlias(String alias) {
            this.defaultAlias = alias;
            return this;
        }

        public MultiOrgRegistry build() {
            String effectiveDefault = defaultAlias;
            if (effectiveDefault != null && !orgs.containsKey(effectiveDefault)) {
                log.warn("Default org '{}' is not registered, calls without an org alias will fail", effectiveDefault);
            }
            log.info("Registered {} org(s): {} (default: {})", orgs.size(), orgs.keySet(), effectiveDefault);
            return new MultiOrgRegistry(orgs, effectiveDefault);
        }
    }
}
