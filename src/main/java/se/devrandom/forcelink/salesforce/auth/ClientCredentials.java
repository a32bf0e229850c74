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

public record ClientCredentials(String clientId, String clientSecret) implements Credentials {

    public ClientCredentials {
        Credentials.require(clientId, "clientId", AUTH_CLIENT_CREDENTIALS);
        Credentials.require(clientSecret, "clientSecret", AUTH_CLIENT_CREDENTIALS);
    }

    @Override
    public String authType() {
        return AUTH_CLIENT_CREDENTIALS;
    }

    @Override
    public String toString() {
        return "ClientCredentials[clientId=" + clientId
                + ", clientSecret=" + Credentials.mask(clientSecret) + "]";
    }
}
