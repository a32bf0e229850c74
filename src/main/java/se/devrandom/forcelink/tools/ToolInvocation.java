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

import java.util.Map;

/**
 * @param org       target org alias; falls back to an {@code org} argument, then to the default org
 * @param arguments tool arguments, may be null for tools without parameters
 */
public record ToolInvocation(String name, String org, Map<String, Object> arguments) {

    public ToolInvocation {
        arguments = arguments == null ? Map.of() : arguments;
    }
}
