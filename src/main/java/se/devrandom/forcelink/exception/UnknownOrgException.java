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
package se.devrandom.forcelink.exception;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public class UnknownOrgException extends ForcelinkException {

    private final String alias;
    private final List<String> knownAliases;

    public UnknownOrgException(String alias, Collection<String> knownAliases) {
        super(alias == null
                ? "No default org is configured"
                : "Unknown org '" + alias + "'");
        this.alias = alias;
        this.knownAliases = List.copyOf(knownAliases);
    }

    public String getAlias() {
        return alias;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.UNKNOWN_ORG_ERROR;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("known_orgs", knownAliases);
    }
}
