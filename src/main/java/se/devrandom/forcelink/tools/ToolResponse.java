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
package se.devrandom.forcelink.tools;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Outcome of a tool invocation: either {@code result} or the error fields are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolResponse {

    @JsonProperty("result")
    private final Object result;

    @JsonProperty("error_kind")
    private final String errorKind;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("details")
    private final Map<String, Object> details;

    private ToolResponse(Object result, String errorKind, String message, Map<String, Object> details) {
        this.result = result;
        this.errorKind = errorKind;
        this.message = message;
        this.details = details;
    }

    public static ToolResponse success(Object result) {
        return new ToolResponse(result, null, null, null);
    }

    public static ToolResponse error(String errorKind, String message, Map<String, Object> details) {
        return new ToolResponse(null, errorKind, message, details == null ? Map.of() : details);
    }

    @JsonIgnore
    public boolean isError() {
        return errorKind != null;
    }

    public Object getResult() {
        return result;
    }

    public String getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
