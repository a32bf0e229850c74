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

import se.devrandom.forcelink.salesforce.token.AccessToken;
import se.devrandom.forcelink.util.Deadline;

/**
 * Obtains access tokens for one org through one credential flow. Implementations are not
 * responsible for caching; {@link se.devrandom.forcelink.salesforce.token.TokenCache} calls them
 * at most once per expiry.
 */
public interface AuthProvider {

    /**
     * Runs the initial grant. The token request is abandoned once {@code deadline} expires.
     */
    AccessToken authenticate(Deadline deadline);

    /**
     * Produces a replacement for {@code current}. Flows without a refresh grant authenticate again.
     */
    AccessToken refresh(AccessToken current, Deadline deadline);

    String getAuthType();
}
