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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.LinkedMultiValueMap;
import se.devrandom.forcelink.exception.AuthException;
import se.devrandom.forcelink.salesforce.token.AccessToken;
import se.devrandom.forcelink.util.Deadline;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Web server flow. The authorization code is exchanged at most once; afterwards tokens are
 * renewed with the refresh token Salesforce returned alongside.
 */
public class OAuth2WebServerAuthProvider implements AuthProvider {
    private static final Logger log = LoggerFactory.getLogger(OAuth2WebServerAuthProvider.class);

    static final String DEFAULT_SCOPE = "full refresh_token";

    private final OAuth2WebServerCredentials credentials;
    private final TokenEndpointClient tokenEndpoint;
    private final AtomicReference<String> authorizationCode;
    private final AtomicReference<String> refreshToken;

    public OAuth2WebServerAuthProvider(OAuth2WebServerCredentials credentials, TokenEndpointClient tokenEndpoint) {
        this.credentials = credentials;
        this.tokenEndpoint = tokenEndpoint;
        this.authorizationCode = new AtomicReference<>(blankToNull(credentials.authorizationCode()));
        this.refreshToken = new AtomicReference<>(blankToNull(credentials.refreshToken()));
    }

    /**
     * URL the user visits to grant access; Salesforce redirects back with the code.
     */
    public String authorizationUrl() {
        return tokenEndpoint.getLoginUrl() + "/services/oauth2/authorize"
                + "?response_type=code"
                + "&client_id=" + encode(credentials.clientId())
                + "&redirect_uri=" + encode(credentials.redirectUri())
                + "&scope=" + encode(DEFAULT_SCOPE);
    }

    @Override
    public AccessToken authenticate(Deadline deadline) {
        String code = authorizationCode.getAndSet(null);
        if (code == null) {
            String stored = refreshToken.get();
            if (stored == null) {
                throw new AuthException(AuthException.Reason.MALFORMED_CREDENTIALS, getAuthType(),
                        "Authorization code already used and no refresh token available; "
                                + "authorize again at " + authorizationUrl());
            }
            return refreshWith(stored, deadline);
        }

        LinkedMultiValueMap<String, String> formData = new LinkedMultiValueMap<>();
        formData.add("grant_type", "authorization_code");
        formData.add("code", code);
        formData.add("client_id", credentials.clientId());
        formData.add("client_secret", credentials.clientSecret());
        formData.add("redirect_uri", credentials.redirectUri());

        AccessToken token = tokenEndpoint.requestToken(formData, getAuthType(), deadline);
        if (token.refreshToken() != null) {
            refreshToken.set(token.refreshToken());
        }
        log.info("Exchanged authorization code for access token (client: {})", credentials.clientId());
        return token;
    }

    @Override
    public AccessToken refresh(AccessToken current, Deadline deadline) {
        String token = current != null && current.refreshToken() != null ? current.refreshToken() : refreshToken.get();
        if (token == null) {
            return authenticate(deadline);
        }
        return refreshWith(token, deadline);
    }

    @Override
    public String getAuthType() {
        return Credentials.AUTH_OAUTH2_WEB_SERVER;
    }

    private AccessToken refreshWith(String token, Deadline deadline) {
        LinkedMultiValueMap<String, String> formData = new LinkedMultiValueMap<>();
        formData.add("grant_type", "refresh_token");
        formData.add("refresh_token", token);
        formData.add("client_id", credentials.clientId());
        formData.add("client_secret", credentials.clientSecret());

        AccessToken refreshed = tokenEndpoint.requestToken(formData, getAuthType(), deadline);
        // Salesforce only rotates the refresh token when the connected app asks for it
        if (refreshed.refreshToken() == null) {
            refreshed = refreshed.withRefreshToken(token);
        }
        refreshToken.set(refreshed.refreshToken());
        log.debug("Refreshed access token (client: {})", credentials.clientId());
        return refreshed;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
