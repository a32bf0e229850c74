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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typed access to the loosely typed argument map of an invocation. Missing required values and
 * values of the wrong type raise {@link IllegalArgumentException}.
 */
public class ToolArguments {

    private final Map<String, Object> values;

    public ToolArguments(Map<String, Object> values) {
        this.values = values == null ? Map.of() : values;
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public String requireString(String name) {
        String value = optionalString(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required argument '" + name + "'");
        }
        return value;
    }

    public String optionalString(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new IllegalArgumentException("Argument '" + name + "' must be a string");
        }
        return (String) value;
    }

    public boolean optionalBoolean(String name, boolean defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new IllegalArgumentException("Argument '" + name + "' must be a boolean");
    }

    public int optionalInt(String name, int defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            long number = ((Number) value).longValue();
            if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Argument '" + name + "' is out of range: " + number);
            }
            return (int) number;
        }
        throw new IllegalArgumentException("Argument '" + name + "' must be an integer");
    }

    public Map<String, Object> requireObject(String name) {
        Map<String, Object> value = optionalObject(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing required argument '" + name + "'");
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> optionalObject(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Argument '" + name + "' must be an object");
        }
        return (Map<String, Object>) value;
    }

    public List<String> optionalStringList(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("Argument '" + name + "' must be an array of strings");
        }
        List<String> strings = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (!(item instanceof String)) {
                throw new IllegalArgumentException("Argument '" + name + "' must be an array of strings");
            }
            strings.add((String) item);
        }
        return strings;
    }

    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> requireObjectList(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing required argument '" + name + "'");
        }
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("Argument '" + name + "' must be an array of objects");
        }
        List<Map<String, Object>> objects = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (!(item instanceof Map)) {
                throw new IllegalArgumentException("Argument '" + name + "' must be an array of objects");
            }
            objects.add((Map<String, Object>) item);
        }
        return objects;
    }
}
