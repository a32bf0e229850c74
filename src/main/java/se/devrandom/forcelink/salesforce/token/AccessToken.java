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
package se.devrandom.forcelink.salesforce.token;

import java.time.Instant;
import java.util.Objects;

/**
 * An issued bearer token. Immutable: a refresh produces a new instance that replaces the old
 * one as a whole.
 *
 * @param accessToken  bearer secret, never rendered by {@link #toString()}
 * @param instanceUrl  base URL every API call for this org is sent to
 * @param issuedAt     when the token endpoint issued it
 * @param expiresAt    null when the flow reports no expiry; such tokens are trusted until a 401
 * @param refreshToken only set by the OAuth2 web server flow
 */
public record AccessToken(String accessToken,
                          String instanceUrl,
                          Instant issuedAt,
                          Instant expiresAt,
                          String refreshToken) {

    public AccessToken {
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(instanceUrl, "instanceUrl");
        Objects.requireNonNull(issuedAt, "issuedAt");
    }

    public AccessToken withRefreshToken(String newRefreshToken) {
        return new AccessToken(accessToken, instanceUrl, issuedAt, expiresAt, newRefreshToken);
    }

    @Override
    public String toString() {
        return "AccessToken[instanceUrl=" + instanceUrl
                + ", issuedAt=" + issuedAt
                + ", expiresAt=" + expiresAt
                + ", accessToken=****"
                + ", refreshToken=" + (refreshToken == null ? "none" : "****") + "]";
    }
}
