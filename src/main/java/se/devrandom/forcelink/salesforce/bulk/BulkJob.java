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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Local view of one ingest job. Confined to the orchestrator invocation that created it;
 * batches and results are only ever appended.
 */
public class BulkJob {

    private final String jobId;
    private final String objectType;
    private final BulkOperation operation;
    private final Instant createdAt;
    private final List<String> batches = new ArrayList<>();
    private final Map<Integer, RecordResult> results = new TreeMap<>();
    private BulkJobState state = BulkJobState.CREATED;

    public BulkJob(String jobId, String objectType, BulkOperation operation, Instant createdAt) {
        this.jobId = jobId;
        this.objectType = objectType;
        this.operation = operation;
        this.createdAt = createdAt;
    }

    /**
     * Moving to the current state is a no-op.
     *
     * @throws IllegalStateException the transition table does not allow the move
     */
    public void transitionTo(BulkJobState next) {
        if (next == state) {
            return;
        }
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Bulk job " + jobId + " cannot move from "
                    + state.getRemoteName() + " to " + next.getRemoteName());
        }
        state = next;
    }

    public void addBatch(String csv) {
        if (state != BulkJobState.OPEN) {
            throw new IllegalStateException("Bulk job " + jobId + " accepts uploads only while Open, is " + state.getRemoteName());
        }
        batches.add(csv);
    }

    public void addResult(RecordResult result) {
        if (results.putIfAbsent(result.index(), result) != null) {
            throw new IllegalStateException("Result for record " + result.index() + " already recorded");
        }
    }

    public boolean hasResult(int index) {
        return results.containsKey(index);
    }

    public String getJobId() {
        return jobId;
    }

    public String getObjectType() {
        return objectType;
    }

    public BulkOperation getOperation() {
        return operation;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public BulkJobState getState() {
        return state;
    }

    public List<String> getBatches() {
        return Collections.unmodifiableList(batches);
    }

    /**
     * @return results ordered by input index
     */
    public List<RecordResult> getResults() {
        return List.copyOf(results.values());
    }
}
