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
package se.devrandom.forcelink.salesforce.auth;

import se.devrandom.forcelink.exception.AuthException;

/**
 * One of the supported credential flows. Implementations are immutable value types whose
 * {@code toString()} never renders a secret; {@link AuthProviders} dispatches on the concrete type.
 */
public interface Credentials {

    String AUTH_USERNAME_PASSWORD = "username-password";
    String AUTH_OAUTH2_WEB_SERVER = "oauth2-web-server";
    String AUTH_JWT_BEARER = "jwt-bearer";
    String AUTH_CLIENT_CREDENTIALS = "client-credentials";

    String authType();

    static String require(String value, String field, String authType) {
        if (value == null || value.isBlank()) {
            throw new AuthException(AuthException.Reason.MALFORMED_CREDENTIALS, authType,
                    "Missing required credential field '" + field + "' for " + authType);
        }
        return value;
    }

    static String mask(String value) {
        return value == null || value.isEmpty() ? "<none>" : "****";
    }
}
