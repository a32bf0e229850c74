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
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import se.devrandom.forcelink.exception.AuthException;
import se.devrandom.forcelink.salesforce.token.AccessToken;
import se.devrandom.forcelink.support.MutableClock;
import se.devrandom.forcelink.support.StubExchangeFunction;
import se.devrandom.forcelink.support.StubResponse;
import se.devrandom.forcelink.util.Deadline;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OAuth2WebServerAuthProviderTest {

    private static final String TOKEN_PATH = "/services/oauth2/token";
    private static final String REDIRECT = "https://app.example.com/oauth/callback";

    private final MutableClock clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
    private final StubExchangeFunction stub = new StubExchangeFunction();
    private final TokenEndpointClient tokenEndpoint = new TokenEndpointClient(stub.webClient(), new ObjectMapper(),
            LoginHosts.PRODUCTION, Duration.ofSeconds(5), clock);

    @Test
    void exchangesCodeOnceThenUsesRefreshToken() {
        stub.on(HttpMethod.POST, TOKEN_PATH,
                StubResponse.json(200, token("access-1", "refresh-1")),
                StubResponse.json(200, token("access-2", null)));
        OAuth2WebServerAuthProvider provider = provider("auth-code", null);

        AccessToken first = provider.authenticate(Deadline.none());
        AccessToken second = provider.authenticate(Deadline.none());

        assertThat(first.refreshToken()).isEqualTo("refresh-1");
        Map<String, String> exchange = stub.getRequests().get(0).formParams();
        assertThat(exchange).containsEntry("grant_type", "authorization_code")
                .containsEntry("code", "auth-code")
                .containsEntry("client_id", "3MVG9")
                .containsEntry("client_secret", "s3cr3t")
                .containsEntry("redirect_uri", REDIRECT);

        Map<String, String> renewal = stub.getRequests().get(1).formParams();
        assertThat(renewal).containsEntry("grant_type", "refresh_token")
                .containsEntry("refresh_token", "refresh-1")
                .doesNotContainKey("code");
        assertThat(second.accessToken()).isEqualTo("access-2");
        assertThat(second.refreshToken()).isEqualTo("refresh-1");
    }

    @Test
    void refreshUsesTheRefreshTokenOfTheCurrentToken() {
        stub.on(HttpMethod.POST, TOKEN_PATH, StubResponse.json(200, token("access-3", "refresh-rotated")));
        OAuth2WebServerAuthProvider provider = provider(null, "refresh-configured");
        AccessToken current = new AccessToken("access-2", "https://acme.my.salesforce.com",
                clock.instant(), null, "refresh-current");

        AccessToken refreshed = provider.refresh(current, Deadline.none());

        assertThat(stub.getRequests().get(0).formParams()).containsEntry("refresh_token", "refresh-current");
        assertThat(refreshed.refreshToken()).isEqualTo("refresh-rotated");
    }

    @Test
    void startsFromConfiguredRefreshTokenWithoutCode() {
        stub.on(HttpMethod.POST, TOKEN_PATH, StubResponse.json(200, token("access-1", null)));
        OAuth2WebServerAuthProvider provider = provider(null, "refresh-configured");

        AccessToken token = provider.authenticate(Deadline.none());

        assertThat(stub.getRequests().get(0).formParams())
                .containsEntry("grant_type", "refresh_token")
                .containsEntry("refresh_token", "refresh-configured");
        assertThat(token.refreshToken()).isEqualTo("refresh-configured");
    }

    @Test
    void failsWhenCodeIsSpentAndNoRefreshTokenWasIssued() {
        stub.on(HttpMethod.POST, TOKEN_PATH, StubResponse.json(200, token("access-1", null)));
        OAuth2WebServerAuthProvider provider = provider("auth-code", null);
        provider.authenticate(Deadline.none());

        assertThatThrownBy(() -> provider.authenticate(Deadline.none()))
                .isInstanceOfSatisfying(AuthException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(AuthException.Reason.MALFORMED_CREDENTIALS);
                    assertThat(e.getMessage()).contains("/services/oauth2/authorize");
                });
        assertThat(stub.getRequests()).hasSize(1);
    }

    @Test
    void buildsAuthorizationUrl() {
        OAuth2WebServerAuthProvider provider = provider("auth-code", null);

        assertThat(provider.authorizationUrl()).isEqualTo("https://login.salesforce.com/services/oauth2/authorize"
                + "?response_type=code&client_id=3MVG9"
                + "&redirect_uri=https%3A%2F%2Fapp.example.com%2Foauth%2Fcallback"
                + "&scope=full+refresh_token");
    }

    private OAuth2WebServerAuthProvider provider(String code, String refreshToken) {
        return new OAuth2WebServerAuthProvider(
                new OAuth2WebServerCredentials("3MVG9", "s3cr3t", REDIRECT, code, refreshToken), tokenEndpoint);
    }

    private static String token(String accessToken, String refreshToken) {
        return "{\"access_token\":\"" + accessToken + "\",\"instance_url\":\"https://acme.my.salesforce.com\""
                + (refreshToken != null ? ",\"refresh_token\":\"" + refreshToken + "\"" : "") + "}";
    }
}
