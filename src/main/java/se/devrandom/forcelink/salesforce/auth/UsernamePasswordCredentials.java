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
 * @param securityToken appended to the password; may be empty for trusted IP ranges
 * @param clientId      optional connected app id sent along with the password grant
 * @param clientSecret  optional connected app secret
 */
public record UsernamePasswordCredentials(String username,
                                          String password,
                                          String securityToken,
                                          String clientId,
                                          String clientSecret) implements Credentials {

    public UsernamePasswordCredentials {
        Credentials.require(username, "username", AUTH_USERNAME_PASSWORD);
        Credentials.require(password, "password", AUTH_USERNAME_PASSWORD);
        securityToken = securityToken == null ? "" : securityToken;
    }

    public UsernamePasswordCredentials(String username, String password, String securityToken) {
        this(username, password, securityToken, null, null);
    }

    @Override
    public String authType() {
        return AUTH_USERNAME_PASSWORD;
    }

    @Override
    public String toString() {
        return "UsernamePasswordCredentials[username=" + username
                + ", password=" + Credentials.mask(password)
                + ", securityToken=" + Credentials.mask(securityToken)
                + ", clientId=" + clientId
                + ", clientSecret=" + Credentials.mask(clientSecret) + "]";
    }
}
