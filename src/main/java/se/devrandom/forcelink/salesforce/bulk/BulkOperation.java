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
package se.devrandom.forcelink.salesforce.bulk;

/**
 * Ingest operations supported by Bulk API 2.0 jobs.
 */
public enum BulkOperation {
    INSERT("insert"),
    UPDATE("update"),
    UPSERT("upsert"),
    DELETE("delete");

    private final String wireName;

    BulkOperation(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static BulkOperation fromWireName(String name) {
        if (name != null) {
            for (BulkOperation operation : values()) {
                if (operation.wireName.equalsIgnoreCase(name.trim())) {
                    return operation;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported bulk operation '" + name
                + "', expected one of insert, update, upsert, delete");
    }
}
