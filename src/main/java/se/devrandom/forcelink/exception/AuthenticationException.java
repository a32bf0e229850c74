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

import java.util.Map;

/**
 * The remote API kept rejecting the bearer token after one refresh and retry.
 */
public class AuthenticationException extends ForcelinkException {

    private final String orgAlias;

    public AuthenticationException(String orgAlias, String message) {
        super(message);
        this.orgAlias = orgAlias;
    }

    public String getOrgAlias() {
        return orgAlias;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.AUTHENTICATION_ERROR;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("org", orgAlias);
    }
}
