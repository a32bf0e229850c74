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
import se.devrandom.forcelink.salesforce.token.AccessToken;
import se.devrandom.forcelink.util.Deadline;

/**
 * OAuth2 client credentials flow, run as the connected app's integration user.
 */
public class ClientCredentialsAuthProvider implements AuthProvider {
    private static final Logger log = LoggerFactory.getLogger(ClientCredentialsAuthProvider.class);

    private final ClientCredentials credentials;
    private final TokenEndpointClient tokenEndpoint;

    public ClientCredentialsAuthProvider(ClientCredentials credentials, TokenEndpointClient tokenEndpoint) {
        this.credentials = credentials;
        this.tokenEndpoint = tokenEndpoint;
    }

    @Override
    public AccessToken authenticate(Deadline deadline) {
        LinkedMultiValueMap<String, String> formData = new LinkedMultiValueMap<>();
        formData.add("grant_type", "client_credentials");
        formData.add("client_id", credentials.clientId());
        formData.add("client_secret", credentials.clientSecret());
        AccessToken token = tokenEndpoint.requestToken(formData, getAuthType(), deadline);
        log.info("Successfully authenticated with client credentials for client: {}", credentials.clientId());
        return token;
    }

    @Override
    public AccessToken refresh(AccessToken current, Deadline deadline) {
        return authenticate(deadline);
    }

    @Override
    public String getAuthType() {
        return Credentials.AUTH_CLIENT_CREDENTIALS;
    }
}
