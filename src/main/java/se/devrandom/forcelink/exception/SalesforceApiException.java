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
import java.util.List;
import java.util.Map;

/**
 * A non-success answer from the remote API that is not handled by a more specific class.
 * Carries the HTTP status (0 for transport failures), the remote error code and the raw payload.
 */
public class SalesforceApiException extends ForcelinkException {

    private final int status;
    private final String errorCode;
    private final List<String> fields;
    private final String payload;

    public SalesforceApiException(String message, int status, String errorCode, List<String> fields, String payload) {
        this(message, status, errorCode, fields, payload, null);
    }

    public SalesforceApiException(String message, int status, String errorCode, List<String> fields,
                                  String payload, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
        this.fields = fields == null ? List.of() : List.copyOf(fields);
        this.payload = payload;
    }

    public int getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Fields the remote system reported as invalid or available, when it reported any.
     */
    public List<String> getFields() {
        return fields;
    }

    public String getPayload() {
        return payload;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.SALESFORCE_ERROR;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", status);
        if (errorCode != null) {
            details.put("error_code", errorCode);
        }
        if (!fields.isEmpty()) {
            details.put("fields", fields);
        }
        if (payload != null && !payload.isEmpty()) {
            details.put("payload", payload);
        }
        return details;
    }
}
