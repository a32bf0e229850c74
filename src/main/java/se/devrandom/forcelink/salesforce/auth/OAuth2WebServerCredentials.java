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
 * Web server flow. The authorization code is obtained out of band and can be exchanged once;
 * a refresh token, when already known, makes the code unnecessary.
 */
public record OAuth2WebServerCredentials(String clientId,
                                         String clientSecret,
                                         String redirectUri,
                                         String authorizationCode,
                                         String refreshToken) implements Credentials {

    public OAuth2WebServerCredentials {
        Credentials.require(clientId, "clientId", AUTH_OAUTH2_WEB_SERVER);
        Credentials.require(clientSecret, "clientSecret", AUTH_OAUTH2_WEB_SERVER);
        Credentials.require(redirectUri, "redirectUri", AUTH_OAUTH2_WEB_SERVER);
        if (isBlank(authorizationCode) && isBlank(refreshToken)) {
            throw new AuthException(AuthException.Reason.MALFORMED_CREDENTIALS, AUTH_OAUTH2_WEB_SERVER,
                    "Either an authorization code or a refresh token is required for " + AUTH_OAUTH2_WEB_SERVER);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public String authType() {
        return AUTH_OAUTH2_WEB_SERVER;
    }

    @Override
    public String toString() {
        return "OAuth2WebServerCredentials[clientId=" + clientId
                + ", clientSecret=" + Credentials.mask(clientSecret)
                + ", redirectUri=" + redirectUri
                + ", authorizationCode=" + Credentials.mask(authorizationCode)
                + ", refreshToken=" + Credentials.mask(refreshToken) + "]";
    }
}
