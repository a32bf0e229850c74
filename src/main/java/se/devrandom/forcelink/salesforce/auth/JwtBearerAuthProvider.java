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

import io.jsonwebtoken.Jwts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.LinkedMultiValueMap;
import se.devrandom.forcelink.exception.AuthException;
import se.devrandom.forcelink.salesforce.token.AccessToken;
import se.devrandom.forcelink.util.Deadline;

import java.security.PrivateKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * JWT bearer flow: a short-lived assertion signed with the connected app's RSA key is exchanged
 * for an access token. Every refresh signs a new assertion.
 */
public class JwtBearerAuthProvider implements AuthProvider {
    private static final Logger log = LoggerFactory.getLogger(JwtBearerAuthProvider.class);

    static final String GRANT_TYPE = "urn:ietf:params:oauth:grant-type:jwt-bearer";
    static final Duration ASSERTION_LIFETIME = Duration.ofMinutes(3);

    private final JwtBearerCredentials credentials;
    private final TokenEndpointClient tokenEndpoint;
    private final Clock clock;
    private volatile PrivateKey privateKey;

    public JwtBearerAuthProvider(JwtBearerCredentials credentials, TokenEndpointClient tokenEndpoint, Clock clock) {
        this.credentials = credentials;
        this.tokenEndpoint = tokenEndpoint;
        this.clock = clock;
    }

    @Override
    public AccessToken authenticate(Deadline deadline) {
        String assertion = buildAssertion();
        log.debug("Created JWT assertion for user: {}", credentials.username());

        LinkedMultiValueMap<String, String> formData = new LinkedMultiValueMap<>();
        formData.add("grant_type", GRANT_TYPE);
        formData.add("assertion", assertion);

        AccessToken token = tokenEndpoint.requestToken(formData, getAuthType(), deadline);
        log.info("Successfully authenticated with JWT for user: {}", credentials.username());
        return token;
    }

    @Override
    public AccessToken refresh(AccessToken current, Deadline deadline) {
        return authenticate(deadline);
    }

    @Override
    public String getAuthType() {
        return Credentials.AUTH_JWT_BEARER;
    }

    String buildAssertion() {
        PrivateKey key = privateKey();
        Instant now = clock.instant();
        try {
            return Jwts.builder()
                    .issuer(credentials.clientId())
                    .subject(credentials.username())
                    .audience().add(tokenEndpoint.getLoginUrl()).and()
                    .issuedAt(Date.from(now))
                    .expiration(Date.from(now.plus(ASSERTION_LIFETIME)))
                    .signWith(key, Jwts.SIG.RS256)
                    .compact();
        } catch (RuntimeException e) {
            log.error("JWT signing failed for user {}: {}", credentials.username(), e.getMessage());
            throw new AuthException(AuthException.Reason.SIGNATURE_FAILURE, getAuthType(),
                    "Failed to sign JWT assertion: " + e.getMessage(), null, e);
        }
    }

    private PrivateKey privateKey() {
        PrivateKey key = privateKey;
        if (key == null) {
            key = PrivateKeyReader.parse(credentials.privateKeyPem());
            privateKey = key;
        }
        return key;
    }
}
