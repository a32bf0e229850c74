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

/**
 * Error classes surfaced to callers. The wire name is what appears as {@code error_kind} in a
 * tool error envelope.
 */
public enum ErrorKind {
    AUTH_ERROR("AuthError"),
    AUTHENTICATION_ERROR("AuthenticationError"),
    NOT_AUTHENTICATED("NotAuthenticated"),
    RATE_LIMIT_ERROR("RateLimitError"),
    VALIDATION_ERROR("ValidationError"),
    NOT_FOUND_ERROR("NotFoundError"),
    SALESFORCE_ERROR("SalesforceError"),
    BULK_OPERATION_ERROR("BulkOperationError"),
    APEX_EXECUTION_ERROR("ApexExecutionError"),
    UNKNOWN_ORG_ERROR("UnknownOrgError"),
    TIMEOUT("Timeout"),
    INVALID_ARGUMENTS("InvalidArguments"),
    INTERNAL_ERROR("InternalError");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
