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
package se.devrandom.forcelink.config;

import se.devrandom.forcelink.salesforce.auth.ClientCredentials;
import se.devrandom.forcelink.salesforce.auth.Credentials;
import se.devrandom.forcelink.salesforce.auth.JwtBearerCredentials;
import se.devrandom.forcelink.salesforce.auth.OAuth2WebServerCredentials;
import se.devrandom.forcelink.salesforce.auth.PrivateKeyReader;
import se.devrandom.forcelink.salesforce.auth.UsernamePasswordCredentials;

import java.util.Locale;

/**
 * Turns the properties of one org into {@link Credentials}. When no auth type is configured it
 * is inferred: a private key means JWT bearer, an authorization code or refresh token means the
 * web server flow, a password means the password flow and a lone client secret means client
 * credentials.
 */
public final class CredentialsFactory {

    private CredentialsFactory() {
    }

    /**
     * @return null when the org has no credentials configured at all
     */
    public static Credentials fromProperties(ForcelinkProperties.Org org) {
        if (!hasAnyCredential(org)) {
            return null;
        }
        String authType = org.getAuthType() != null && !org.getAuthType().isBlank()
                ? normalize(org.getAuthType())
                : infer(org);

        switch (authType) {
            case Credentials.AUTH_USERNAME_PASSWORD:
                return new UsernamePasswordCredentials(org.getUsername(), org.getPassword(), org.getSecurityToken(),
                        blankToNull(org.getClientId()), blankToNull(org.getClientSecret()));
            case Credentials.AUTH_OAUTH2_WEB_SERVER:
                return new OAuth2WebServerCredentials(org.getClientId(), org.getClientSecret(), org.getRedirectUri(),
                        blankToNull(org.getAuthorizationCode()), blankToNull(org.getRefreshToken()));
            case Credentials.AUTH_JWT_BEARER:
                return new JwtBearerCredentials(org.getClientId(), org.getUsername(), privateKeyPem(org));
            case Credentials.AUTH_CLIENT_CREDENTIALS:
                return new ClientCredentials(org.getClientId(), org.getClientSecret());
            default:
                throw new IllegalArgumentException("Unsupported auth type '" + org.getAuthType() + "'");
        }
    }

    static String normalize(String authType) {
        String value = authType.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        switch (value) {
            case "password":
            case "username-password":
                return Credentials.AUTH_USERNAME_PASSWORD;
            case "oauth2":
            case "web-server":
            case "oauth2-web-server":
                return Credentials.AUTH_OAUTH2_WEB_SERVER;
            case "jwt":
            case "jwt-bearer":
                return Credentials.AUTH_JWT_BEARER;
            case "client-credentials":
                return Credentials.AUTH_CLIENT_CREDENTIALS;
            default:
                throw new IllegalArgumentException("Unsupported auth type '" + authType + "'");
        }
    }

    private static String infer(ForcelinkProperties.Org org) {
        if (isSet(org.getPrivateKey()) || isSet(org.getPrivateKeyFile())) {
            return Credentials.AUTH_JWT_BEARER;
        }
        if (isSet(org.getAuthorizationCode()) || isSet(org.getRefreshToken())) {
            return Credentials.AUTH_OAUTH2_WEB_SERVER;
        }
        if (isSet(org.getPassword()) || isSet(org.getUsername())) {
            return Credentials.AUTH_USERNAME_PASSWORD;
        }
        return Credentials.AUTH_CLIENT_CREDENTIALS;
    }

    private static String privateKeyPem(ForcelinkProperties.Org org) {
        if (isSet(org.getPrivateKey())) {
            return org.getPrivateKey();
        }
        if (isSet(org.getPrivateKeyFile())) {
            return PrivateKeyReader.readPem(org.getPrivateKeyFile());
        }
        return null;
    }

    private static boolean hasAnyCredential(ForcelinkProperties.Org org) {
        return isSet(org.getUsername())
                || isSet(org.getPassword())
                || isSet(org.getClientId())
                || isSet(org.getClientSecret())
                || isSet(org.getAuthorizationCode())
                || isSet(org.getRefreshToken())
                || isSet(org.getPrivateKey())
                || isSet(org.getPrivateKeyFile());
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    private static String blankToNull(String value) {
        return isSet(value) ? value : null;
    }
}
