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
package se.devrandom.forcelink.salesforce.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import se.devrandom.forcelink.exception.AuthenticationException;
import se.devrandom.forcelink.exception.ErrorKind;
import se.devrandom.forcelink.exception.ForcelinkException;
import se.devrandom.forcelink.exception.NotFoundException;
import se.devrandom.forcelink.exception.OperationTimeoutException;
import se.devrandom.forcelink.exception.RateLimitException;
import se.devrandom.forcelink.exception.SalesforceApiException;
import se.devrandom.forcelink.exception.ValidationException;
import se.devrandom.forcelink.salesforce.registry.ApiUsageTracker;
import se.devrandom.forcelink.salesforce.registry.MultiOrgRegistry;
import se.devrandom.forcelink.salesforce.registry.OrgContext;
import se.devrandom.forcelink.salesforce.token.AccessToken;
import se.devrandom.forcelink.util.Deadline;
import se.devrandom.forcelink.util.Sleeper;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.TimeoutException;

/**
 * Sends every remote call of the runtime. Per call it obtains a valid token, takes a rate limit
 * permit for each HTTP attempt, classifies the answer and retries what is transient:
 * <ul>
 *     <li>401: the token is refreshed once and the request repeated once</li>
 *     <li>429: waits {@code Retry-After} (or the configured delay) within the attempt budget</li>
 *     <li>5xx and transport failures: exponential backoff within the attempt budget</li>
 * </ul>
 * Everything else is raised as a typed exception carrying the remote error context. Each call
 * yields exactly one audit entry.
 */
public class SalesforceHttpDispatcher {
    private static final Logger log = LoggerFactory.getLogger(SalesforceHttpDispatcher.class);

    private final MultiOrgRegistry registry;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final Duration requestTimeout;
    private final AuditSink auditSink;
    private final Sleeper sleeper;
    private final Clock clock;

    public SalesforceHttpDispatcher(MultiOrgRegistry registry,
                                    WebClient webClient,
                                    ObjectMapper objectMapper,
                                    RetryPolicy retryPolicy,
                                    Duration requestTimeout,
                                    AuditSink auditSink,
                                    Sleeper sleeper,
                                    Clock clock) {
        this.registry = registry;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
        this.requestTimeout = requestTimeout;
        this.auditSink = auditSink;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * @param orgAlias null selects the default org
     */
    public SalesforceResponse send(String orgAlias, SalesforceRequest request, Deadline deadline) {
        OrgContext org = registry.resolve(orgAlias);
        Instant started = clock.instant();
        try {
            SalesforceResponse response = execute(org, request, deadline);
            audit(org, request, started, AuditLogEntry.SUCCESS);
            return response;
        } catch (ForcelinkException e) {
            audit(org, request, started, e.getKind().getWireName());
            throw e;
        } catch (RuntimeException e) {
            audit(org, request, started, ErrorKind.INTERNAL_ERROR.getWireName());
            throw e;
        }
    }

    public MultiOrgRegistry getRegistry() {
        return registry;
    }

    private SalesforceResponse execute(OrgContext org, SalesforceRequest request, Deadline deadline) {
        AccessToken token = org.tokenCache().validToken(org.authProvider(), deadline);
        boolean refreshed = false;
        int attempt = 1;

        while (true) {
            org.rateLimiter().acquire(deadline);

            ResponseEntity<String> response;
            try {
                response = exchange(token, request, deadline);
            } catch (RuntimeException e) {
                Throwable cause = Exceptions.unwrap(e);
                if (deadline.isExpired()) {
                    throw new OperationTimeoutException(request.operation(),
                            request.operation() + " did not finish before the deadline", cause);
                }
                if (!isTransportFailure(cause)) {
                    throw new SalesforceApiException(request.operation() + " failed: " + cause.getMessage(),
                            0, null, null, null, cause);
                }
                if (attempt >= retryPolicy.maxAttempts()) {
                    log.error("{} on org '{}' failed after {} attempts: {}",
                            request.operation(), org.alias(), attempt, cause.toString());
                    throw new SalesforceApiException(request.operation() + " failed after " + attempt
                            + " attempts: " + cause.getMessage(), 0, null, null, null, cause);
                }
                Duration delay = retryPolicy.backoff(attempt);
                log.warn("{} attempt {}/{} failed, retrying in {}ms: {}",
                        request.operation(), attempt, retryPolicy.maxAttempts(), delay.toMillis(), cause.toString());
                pause(delay, deadline, request);
                attempt++;
                continue;
            }

            int status = response.getStatusCode().value();
            String body = response.getBody();
            trackUsage(org.usageTracker(), response.getHeaders());

            if (status >= 200 && status < 300) {
                return new SalesforceResponse(status, response.getHeaders(), body, objectMapper);
            }

            if (status == 401) {
                if (refreshed) {
                    log.error("{} on org '{}' rejected with 401 after token refresh", request.operation(), org.alias());
                    throw new AuthenticationException(org.alias(),
                            "Org '" + org.alias() + "' rejected the refreshed access token: "
                                    + describe(RemoteError.parse(body, objectMapper), body));
                }
                log.info("{} on org '{}' got 401, refreshing token and retrying once", request.operation(), org.alias());
                token = org.tokenCache().refreshRejected(org.authProvider(), token, deadline);
                refreshed = true;
                continue;
            }

            if (status == 429) {
                Duration delay = retryAfter(response.getHeaders());
                if (attempt >= retryPolicy.maxAttempts()) {
                    log.error("{} on org '{}' still rate limited after {} attempts", request.operation(), org.alias(), attempt);
                    throw new RateLimitException("Org '" + org.alias() + "' kept answering 429 for "
                            + request.operation() + " after " + attempt + " attempts", delay, true);
                }
                log.warn("{} attempt {}/{} rate limited by org '{}', retrying in {}ms",
                        request.operation(), attempt, retryPolicy.maxAttempts(), org.alias(), delay.toMillis());
                pause(delay, deadline, request);
                attempt++;
                continue;
            }

            if (status >= 500) {
                if (attempt >= retryPolicy.maxAttempts()) {
                    log.error("{} on org '{}' failed with HTTP {} after {} attempts",
                            request.operation(), org.alias(), status, attempt);
                    throw toException(request, status, body);
                }
                Duration delay = retryPolicy.backoff(attempt);
                log.warn("{} attempt {}/{} failed with HTTP {}, retrying in {}ms",
                        request.operation(), attempt, retryPolicy.maxAttempts(), status, delay.toMillis());
                pause(delay, deadline, request);
                attempt++;
                continue;
            }

            throw toException(request, status, body);
        }
    }

    private ResponseEntity<String> exchange(AccessToken token, SalesforceRequest request, Deadline deadline) {
        URI uri = buildUri(token.instanceUrl(), request);
        log.debug("{} {} ({})", request.method(), uri, request.operation());

        WebClient.RequestBodySpec spec = webClient
                .method(request.method())
                .uri(uri)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token.accessToken())
                .accept(request.accept())
                .acceptCharset(StandardCharsets.UTF_8);
        WebClient.RequestHeadersSpec<?> headersSpec = request.hasBody()
                ? spec.contentType(request.contentType()).bodyValue(request.body())
                : spec;

        return headersSpec
                .exchangeToMono(clientResponse -> clientResponse.toEntity(String.class))
                .timeout(deadline.bound(requestTimeout))
                .block();
    }

    static URI buildUri(String instanceUrl, SalesforceRequest request) {
        String path = request.path();
        StringBuilder url = new StringBuilder();
        if (path.startsWith("http://") || path.startsWith("https://")) {
            url.append(path);
        } else {
            url.append(stripTrailingSlash(instanceUrl));
            if (!path.startsWith("/")) {
                url.append('/');
            }
            url.append(path);
        }
        if (!request.queryParams().isEmpty()) {
            StringJoiner query = new StringJoiner("&");
            for (Map.Entry<String, String> param : request.queryParams().entrySet()) {
                query.add(URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8));
            }
            url.append(url.indexOf("?") >= 0 ? '&' : '?').append(query);
        }
        return URI.create(url.toString());
    }

    private Duration retryAfter(HttpHeaders headers) {
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value != null) {
            try {
                long seconds = Long.parseLong(value.trim());
                if (seconds >= 0) {
                    return Duration.ofSeconds(seconds);
                }
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric Retry-After '{}'", value);
            }
        }
        return retryPolicy.rateLimitedDelay();
    }

    private void pause(Duration delay, Deadline deadline, SalesforceRequest request) {
        if (!deadline.allows(delay)) {
            throw new OperationTimeoutException(request.operation(),
                    "Retrying " + request.operation() + " in " + delay.toMillis() + "ms would exceed the deadline");
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationTimeoutException(request.operation(),
                    "Interrupted while waiting to retry " + request.operation(), e);
        }
    }

    private void trackUsage(ApiUsageTracker tracker, HttpHeaders headers) {
        tracker.updateFromHeader(headers.getFirst(ApiUsageTracker.HEADER));
    }

    private void audit(OrgContext org, SalesforceRequest request, Instant started, String outcome) {
        Instant finished = clock.instant();
        AuditLogEntry entry = new AuditLogEntry(finished, org.alias(), request.operation(), outcome,
                Duration.between(started, finished));
        try {
            auditSink.record(entry);
        } catch (RuntimeException e) {
            log.warn("Failed to write audit entry for {} on org '{}': {}",
                    request.operation(), org.alias(), e.toString());
        }
    }

    private SalesforceApiException toException(SalesforceRequest request, int status, String body) {
        RemoteError error = RemoteError.parse(body, objectMapper);
        String message = request.operation() + " failed with HTTP " + status + ": " + describe(error, body);
        if (status == 400) {
            return new ValidationException(message, error.errorCode(), error.fields(), body);
        }
        if (status == 404) {
            return new NotFoundException(message, error.errorCode(), error.fields(), body);
        }
        return new SalesforceApiException(message, status, error.errorCode(), error.fields(), body);
    }

    private static String describe(RemoteError error, String body) {
        if (error.message() != null) {
            return error.errorCode() != null ? error.errorCode() + " - " + error.message() : error.message();
        }
        return body == null || body.isBlank() ? "no details" : body;
    }

    private static boolean isTransportFailure(Throwable cause) {
        return cause instanceof IOException
                || cause instanceof TimeoutException
                || cause instanceof WebClientRequestException;
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
