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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Catalogue entry of a tool as listed to callers.
 *
 * @param inputSchema JSON schema of the {@code arguments} object
 */
public record ToolDefinition(String name,
                             String description,
                             @JsonProperty("inputSchema") Map<String, Object> inputSchema) {
}
