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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import se.devrandom.forcelink.exception.AuthException;
import se.devrandom.forcelink.exception.OperationTimeoutException;
import se.devrandom.forcelink.salesforce.objects.TokenErrorResponse;
import se.devrandom.forcelink.salesforce.objects.TokenResponse;
import se.devrandom.forcelink.salesforce.token.AccessToken;
import se.devrandom.forcelink.util.Deadline;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;

/**
 * Posts a grant to {@code /services/oauth2/token} of one login host and turns the answer into an
 * {@link AccessToken}. Performs exactly one request per call; retrying is the dispatcher's job.
 * The request waits for the configured timeout or the caller's deadline, whichever ends first.
 */
public class TokenEndpointClient {
    private static final Logger log = LoggerFactory.getLogger(TokenEndpointClient.class);

    private static final String TOKEN_PATH = "/services/oauth2/token";
    private static final String OPERATION = "token.request";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String loginUrl;
    private final Duration timeout;
    private final Clock clock;

    public TokenEndpointClient(WebClient webClient, ObjectMapper objectMapper, String loginUrl,
                               Duration timeout, Clock clock) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.loginUrl = loginUrl;
        this.timeout = timeout;
        this.clock = clock;
    }

    public AccessToken requestToken(MultiValueMap<String, String> formData, String authType, Deadline deadline) {
        if (deadline.isExpired()) {
            throw new OperationTimeoutException(OPERATION,
                    "Deadline expired before requesting a token from " + loginUrl);
        }
        Duration budget = deadline.bound(timeout);
        ResponseEntity<String> response;
        try {
            response = webClient
                    .post()
                    .uri(loginUrl + TOKEN_PATH)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_FORM_URLENCODED_VALUE)
                    .body(BodyInserters.fromFormData(formData))
                    .accept(MediaType.APPLICATION_JSON)
                    .acceptCharset(StandardCharsets.UTF_8)
                    .exchangeToMono(clientResponse -> clientResponse.toEntity(String.class))
                    .timeout(budget)
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (deadline.isExpired() || (cause instanceof TimeoutException && budget.compareTo(timeout) < 0)) {
                log.warn("Token request to {} ({}) abandoned, deadline expired", loginUrl, authType);
                throw new OperationTimeoutException(OPERATION,
                        "Deadline expired while waiting for token endpoint " + loginUrl, cause);
            }
            log.error("Token request to {} failed ({}): {}", loginUrl, authType, cause.toString());
            throw new AuthException(AuthException.Reason.TRANSPORT, authType,
                    "Token endpoint " + loginUrl + " unreachable: " + cause.getMessage(), null, cause);
        }

        if (response == null) {
            throw new AuthException(AuthException.Reason.TRANSPORT, authType,
                    "Empty answer from token endpoint " + loginUrl);
        }

        String body = response.getBody();
        if (!response.getStatusCode().is2xxSuccessful()) {
            TokenErrorResponse error = parseError(body);
            String remoteMessage = error.errorDescription != null ? error.errorDescription : body;
            log.error("Token endpoint rejected {} grant: HTTP {} {} - {}",
                    authType, response.getStatusCode().value(), error.error, remoteMessage);
            throw new AuthException(AuthException.reasonForOAuthError(error.error), authType,
                    "Authentication failed (" + authType + "): " + remoteMessage, remoteMessage, null);
        }

        TokenResponse token = parseToken(body, authType);
        if (token.accessToken == null || token.instanceUrl == null) {
            throw new AuthException(AuthException.Reason.REMOTE_REJECTED, authType,
                    "Token endpoint answer lacks access_token or instance_url");
        }

        Instant issuedAt = parseIssuedAt(token.issuedAt);
        Instant expiresAt = token.expiresIn != null ? issuedAt.plusSeconds(token.expiresIn) : null;
        log.debug("Obtained access token for {} (instance: {})", authType, token.instanceUrl);
        return new AccessToken(token.accessToken, token.instanceUrl, issuedAt, expiresAt, token.refreshToken);
    }

    public String getLoginUrl() {
        return loginUrl;
    }

    private TokenResponse parseToken(String body, String authType) {
        try {
            return objectMapper.readValue(body, TokenResponse.class);
        } catch (Exception e) {
            throw new AuthException(AuthException.Reason.REMOTE_REJECTED, authType,
                    "Unreadable token endpoint answer", null, e);
        }
    }

    private TokenErrorResponse parseError(String body) {
        if (body == null || body.isBlank()) {
            return new TokenErrorResponse();
        }
        try {
            return objectMapper.readValue(body, TokenErrorResponse.class);
        } catch (Exception e) {
            log.debug("Token error body is not JSON: {}", body);
            return new TokenErrorResponse();
        }
    }

    private Instant parseIssuedAt(String issuedAt) {
        if (issuedAt != null) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(issuedAt));
            } catch (NumberFormatException e) {
                log.debug("Unparseable issued_at '{}', using local time", issuedAt);
            }
        }
        return clock.instant();
    }
}
