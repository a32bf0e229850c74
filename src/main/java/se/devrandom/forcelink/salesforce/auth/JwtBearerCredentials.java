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

/**
 * @param privateKeyPem PKCS#8 PEM text of the RSA key registered with the connected app
 */
public record JwtBearerCredentials(String clientId,
                                   String username,
                                   String privateKeyPem) implements Credentials {

    public JwtBearerCredentials {
        Credentials.require(clientId, "clientId", AUTH_JWT_BEARER);
        Credentials.require(username, "username", AUTH_JWT_BEARER);
        Credentials.require(privateKeyPem, "privateKey", AUTH_JWT_BEARER);
    }

    @Override
    public String authType() {
        return AUTH_JWT_BEARER;
    }

    @Override
    public String toString() {
        return "JwtBearerCredentials[clientId=" + clientId
                + ", username=" + username
                + ", privateKey=" + Credentials.mask(privateKeyPem) + "]";
    }
}
