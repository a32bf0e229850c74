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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A set of records to push through one ingest job.
 *
 * @param batchSize       records per uploaded CSV chunk
 * @param externalIdField required for {@link BulkOperation#UPSERT}, ignored otherwise
 */
public record BulkRequest(String objectType,
                          BulkOperation operation,
                          List<Map<String, Object>> records,
                          int batchSize,
                          String externalIdField) {

    public static final int DEFAULT_BATCH_SIZE = 200;

    public BulkRequest {
        if (objectType == null || objectType.isBlank()) {
            throw new IllegalArgumentException("objectType is required");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation is required");
        }
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("At least one record is required");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1, was " + batchSize);
        }
        if (operation == BulkOperation.UPSERT && (externalIdField == null || externalIdField.isBlank())) {
            throw new IllegalArgumentException("upsert requires an external id field");
        }
        for (int i = 0; i < records.size(); i++) {
            Map<String, Object> record = records.get(i);
            if (record == null) {
                throw new IllegalArgumentException("Record " + i + " is null");
            }
            if (operation == BulkOperation.DELETE && isBlank(record.get("Id"))) {
                throw new IllegalArgumentException("Record " + i + " has no Id, delete needs one per record");
            }
        }
        records = Collections.unmodifiableList(new ArrayList<>(records));
        if (operation != BulkOperation.UPSERT) {
            externalIdField = null;
        }
    }

    public static BulkRequest of(String objectType, BulkOperation operation, List<Map<String, Object>> records) {
        return new BulkRequest(objectType, operation, records, DEFAULT_BATCH_SIZE, null);
    }

    public int batchCount() {
        return (records.size() + batchSize - 1) / batchSize;
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }
}
