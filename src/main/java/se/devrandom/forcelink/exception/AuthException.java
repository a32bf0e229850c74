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
package se.devrandom.forcelink.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A credential flow could not produce a token: bad credentials, a signing problem, or the
 * token endpoint rejected the grant.
 */
public class AuthException extends ForcelinkException {

    public enum Reason {
        MALFORMED_CREDENTIALS,
        SIGNATURE_FAILURE,
        INVALID_GRANT,
        INVALID_CLIENT,
        REMOTE_REJECTED,
        TRANSPORT
    }

    private final Reason reason;
    private final String authType;
    private final String remoteMessage;

    public AuthException(Reason reason, String authType, String message) {
        this(reason, authType, message, null, null);
    }

    public AuthException(Reason reason, String authType, String message, String remoteMessage, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.authType = authType;
        this.remoteMessage = remoteMessage;
    }

    /**
     * Maps the OAuth {@code error} code returned by the token endpoint.
     */
    public static Reason reasonForOAuthError(String error) {
        if (error == null) {
            return Reason.REMOTE_REJECTED;
        }
        switch (error) {
            case "invalid_grant":
                return Reason.INVALID_GRANT;
            case "invalid_client":
            case "invalid_client_id":
            case "unauthorized_client":
                return Reason.INVALID_CLIENT;
            default:
                return Reason.REMOTE_REJECTED;
        }
    }

    public Reason getReason() {
        return reason;
    }

    public String getAuthType() {
        return authType;
    }

    public String getRemoteMessage() {
        return remoteMessage;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.AUTH_ERROR;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason.name());
        details.put("auth_type", authType);
        if (remoteMessage != null) {
            details.put("remote_message", remoteMessage);
        }
        return details;
    }
}
