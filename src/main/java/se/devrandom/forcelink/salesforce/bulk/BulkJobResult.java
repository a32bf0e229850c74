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

import java.util.List;

/**
 * @param results one entry per submitted record, in input order
 */
public record BulkJobResult(String jobId,
                            String objectType,
                            BulkOperation operation,
                            BulkJobState state,
                            int batchCount,
                            int recordsProcessed,
                            int recordsFailed,
                            List<RecordResult> results) {

    public BulkJobResult {
        results = List.copyOf(results);
    }

    public long successCount() {
        return results.stream().filter(RecordResult::success).count();
    }
}
