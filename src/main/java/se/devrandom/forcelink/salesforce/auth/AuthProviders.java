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

import java.time.Clock;

/**
 * Creates the provider matching a credential flow.
 */
public final class AuthProviders {

    private AuthProviders() {
    }

    public static AuthProvider create(Credentials credentials, TokenEndpointClient tokenEndpoint, Clock clock) {
        if (credentials instanceof UsernamePasswordCredentials usernamePassword) {
            return new UsernamePasswordAuthProvider(usernamePassword, tokenEndpoint);
        }
        if (credentials instanceof OAuth2WebServerCredentials webServer) {
            return new OAuth2WebServerAuthProvider(webServer, tokenEndpoint);
        }
        if (credentials instanceof JwtBearerCredentials jwtBearer) {
            return new JwtBearerAuthProvider(jwtBearer, tokenEndpoint, clock);
        }
        if (credentials instanceof ClientCredentials clientCredentials) {
            return new ClientCredentialsAuthProvider(clientCredentials, tokenEndpoint);
        }
        throw new IllegalArgumentException("Unsupported credentials: " + credentials.getClass().getName());
    }
}
