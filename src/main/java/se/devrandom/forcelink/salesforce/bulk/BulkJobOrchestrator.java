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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.devrandom.forcelink.exception.BulkOperationException;
import se.devrandom.forcelink.exception.OperationTimeoutException;
import se.devrandom.forcelink.salesforce.http.SalesforceHttpDispatcher;
import se.devrandom.forcelink.salesforce.http.SalesforceRequest;
import se.devrandom.forcelink.salesforce.objects.IngestJobInfo;
import se.devrandom.forcelink.salesforce.registry.OrgContext;
import se.devrandom.forcelink.util.Deadline;
import se.devrandom.forcelink.util.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Drives one Bulk API 2.0 ingest job from creation to its per-record results:
 * create, upload the batches, mark the upload complete, poll until the job is terminal and
 * read back the successful, failed and unprocessed rows.
 *
 * <p>Polling is bounded by a fixed number of status checks. A job that is still running when
 * the bound is reached is reported as timed out and left alone on the remote side; failed or
 * aborted jobs are never resubmitted.
 */
public class BulkJobOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BulkJobOrchestrator.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);
    public static final int DEFAULT_MAX_POLLS = 150;

    private static final String SF_ID = "sf__Id";
    private static final String SF_CREATED = "sf__Created";
    private static final String SF_ERROR = "sf__Error";
    private static final String SF_PREFIX = "sf__";

    private final SalesforceHttpDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final CsvCodec csvCodec;
    private final Duration pollInterval;
    private final int maxPolls;
    private final Sleeper sleeper;
    private final Clock clock;

    public BulkJobOrchestrator(SalesforceHttpDispatcher dispatcher,
                               ObjectMapper objectMapper,
                               Duration pollInterval,
                               int maxPolls,
                               Sleeper sleeper,
                               Clock clock) {
        if (maxPolls < 1) {
            throw new IllegalArgumentException("maxPolls must be at least 1, was " + maxPolls);
        }
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
        this.csvCodec = new CsvCodec(objectMapper);
        this.pollInterval = pollInterval;
        this.maxPolls = maxPolls;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public BulkJobResult run(String orgAlias, BulkRequest request, Deadline deadline) {
        OrgContext org = dispatcher.getRegistry().resolve(orgAlias);
        String alias = org.alias();
        String jobsPath = org.config().apiPath("/jobs/ingest");

        BulkJob job = createJob(alias, jobsPath, request, deadline);
        String jobPath = jobsPath + "/" + job.getJobId();

        try {
            for (List<Map<String, Object>> batch : partition(request.records(), request.batchSize())) {
                String csv = csvCodec.write(batch);
                dispatcher.send(alias, SalesforceRequest.putCsv("bulk.uploadBatch", jobPath + "/batches", csv), deadline);
                job.addBatch(csv);
                log.debug("Uploaded batch {} of {} ({} records) to bulk job {}",
                        job.getBatches().size(), request.batchCount(), batch.size(), job.getJobId());
            }
            dispatcher.send(alias, SalesforceRequest.patch("bulk.uploadComplete", jobPath,
                    toJson(Map.of("state", BulkJobState.UPLOAD_COMPLETE.getRemoteName()))), deadline);
            job.transitionTo(BulkJobState.UPLOAD_COMPLETE);
        } catch (RuntimeException e) {
            abort(alias, jobPath, job, e, deadline);
            throw e;
        }
        log.info("Bulk job {} ({} {}) uploaded {} records in {} batches",
                job.getJobId(), request.operation().getWireName(), request.objectType(),
                request.records().size(), job.getBatches().size());

        IngestJobInfo info = poll(alias, jobPath, job, deadline);

        if (job.getState() == BulkJobState.FAILED || job.getState() == BulkJobState.ABORTED) {
            BulkOperationException.Reason reason = job.getState() == BulkJobState.FAILED
                    ? BulkOperationException.Reason.FAILED
                    : BulkOperationException.Reason.ABORTED;
            String remoteMessage = info.errorMessage;
            log.error("Bulk job {} ended as {}: {}", job.getJobId(), job.getState().getRemoteName(), remoteMessage);
            throw new BulkOperationException(reason, job.getJobId(), "Bulk job " + job.getJobId() + " "
                    + reason.getWireName() + ": " + (remoteMessage != null ? remoteMessage : "Unknown error"),
                    remoteMessage);
        }

        collectResults(alias, jobPath, job, request.records(), deadline);

        BulkJobResult result = new BulkJobResult(job.getJobId(), job.getObjectType(), job.getOperation(),
                job.getState(), job.getBatches().size(), info.getNumberRecordsProcessed(),
                info.getNumberRecordsFailed(), job.getResults());
        log.info("Bulk job {} complete: {} processed, {} failed", job.getJobId(),
                result.recordsProcessed(), result.recordsFailed());
        return result;
    }

    private BulkJob createJob(String alias, String jobsPath, BulkRequest request, Deadline deadline) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("object", request.objectType());
        body.put("operation", request.operation().getWireName());
        body.put("contentType", "CSV");
        body.put("lineEnding", "LF");
        if (request.externalIdField() != null) {
            body.put("externalIdFieldName", request.externalIdField());
        }
        IngestJobInfo created = dispatcher.send(alias, SalesforceRequest.post("bulk.createJob", jobsPath, toJson(body)), deadline)
                .readAs(IngestJobInfo.class);
        if (created.getId() == null) {
            throw new BulkOperationException(BulkOperationException.Reason.FAILED, null,
                    "Bulk job creation returned no job id", created.errorMessage);
        }

        BulkJob job = new BulkJob(created.getId(), request.objectType(), request.operation(), clock.instant());
        job.transitionTo(BulkJobState.OPEN);
        log.info("Created bulk job {} for {} {} on org '{}'", job.getJobId(),
                request.operation().getWireName(), request.objectType(), alias);
        return job;
    }

    private IngestJobInfo poll(String alias, String jobPath, BulkJob job, Deadline deadline) {
        for (int poll = 1; poll <= maxPolls; poll++) {
            IngestJobInfo info = dispatcher.send(alias, SalesforceRequest.get("bulk.pollJob", jobPath), deadline)
                    .readAs(IngestJobInfo.class);
            follow(job, info.getState());
            if (job.getState().isTerminal()) {
                log.debug("Bulk job {} reached {} after {} polls", job.getJobId(), job.getState().getRemoteName(), poll);
                return info;
            }
            if (poll < maxPolls) {
                waitForNextPoll(job, deadline);
            }
        }
        log.warn("Bulk job {} still {} after {} polls, giving up", job.getJobId(), job.getState().getRemoteName(), maxPolls);
        throw new BulkOperationException(BulkOperationException.Reason.TIMEOUT, job.getJobId(),
                "Bulk job " + job.getJobId() + " did not finish within " + maxPolls + " status checks", null);
    }

    private void follow(BulkJob job, String remoteState) {
        BulkJobState observed = BulkJobState.fromRemote(remoteState);
        if (observed == null) {
            log.warn("Bulk job {} reported unknown state '{}'", job.getJobId(), remoteState);
            return;
        }
        if (observed != job.getState() && !job.getState().canTransitionTo(observed)) {
            log.warn("Bulk job {} reported {} while {}, ignoring", job.getJobId(),
                    observed.getRemoteName(), job.getState().getRemoteName());
            return;
        }
        job.transitionTo(observed);
    }

    private void waitForNextPoll(BulkJob job, Deadline deadline) {
        if (!deadline.allows(pollInterval)) {
            throw new OperationTimeoutException("bulk.pollJob",
                    "Deadline reached while waiting for bulk job " + job.getJobId());
        }
        try {
            sleeper.sleep(pollInterval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationTimeoutException("bulk.pollJob",
                    "Interrupted while waiting for bulk job " + job.getJobId(), e);
        }
    }

    private void abort(String alias, String jobPath, BulkJob job, RuntimeException cause, Deadline deadline) {
        log.warn("Upload to bulk job {} failed, aborting job: {}", job.getJobId(), cause.getMessage());
        try {
            dispatcher.send(alias, SalesforceRequest.patch("bulk.abortJob", jobPath,
                    toJson(Map.of("state", BulkJobState.ABORTED.getRemoteName()))), deadline);
            job.transitionTo(BulkJobState.ABORTED);
        } catch (RuntimeException abortFailure) {
            log.warn("Could not abort bulk job {}: {}", job.getJobId(), abortFailure.getMessage());
            cause.addSuppressed(abortFailure);
        }
    }

    /**
     * Maps result rows back to input positions by the data columns Salesforce echoes. Each input
     * record is claimed by at most one row; records no row claims are reported as unprocessed.
     */
    private void collectResults(String alias, String jobPath, BulkJob job,
                                List<Map<String, Object>> records, Deadline deadline) {
        match(job, records, fetchCsv(alias, jobPath + "/successfulResults/", "bulk.successfulResults", deadline),
                (index, row) -> RecordResult.succeeded(index, emptyToNull(row.get(SF_ID)),
                        Boolean.parseBoolean(row.get(SF_CREATED))));
        match(job, records, fetchCsv(alias, jobPath + "/failedResults/", "bulk.failedResults", deadline),
                (index, row) -> RecordResult.failed(index, emptyToNull(row.get(SF_ID)), row.get(SF_ERROR)));
        match(job, records, fetchCsv(alias, jobPath + "/unprocessedrecords/", "bulk.unprocessedRecords", deadline),
                (index, row) -> RecordResult.unprocessed(index));
        for (int i = 0; i < records.size(); i++) {
            if (!job.hasResult(i)) {
                log.debug("Bulk job {} reported no result for record {}", job.getJobId(), i);
                job.addResult(RecordResult.unprocessed(i));
            }
        }
    }

    private List<Map<String, String>> fetchCsv(String alias, String path, String operation, Deadline deadline) {
        String body = dispatcher.send(alias, SalesforceRequest.getCsv(operation, path), deadline).getBody();
        return csvCodec.read(body);
    }

    private void match(BulkJob job, List<Map<String, Object>> records, List<Map<String, String>> rows,
                       BiFunction<Integer, Map<String, String>, RecordResult> toResult) {
        if (rows.isEmpty()) {
            return;
        }
        List<String> columns = new ArrayList<>();
        for (String column : rows.get(0).keySet()) {
            if (!column.startsWith(SF_PREFIX)) {
                columns.add(column);
            }
        }

        // Identical records queue up in input order
        Map<String, Deque<Integer>> unclaimed = new HashMap<>();
        for (int i = 0; i < records.size(); i++) {
            if (job.hasResult(i)) {
                continue;
            }
            Map<String, Object> record = records.get(i);
            String recordKey = key(columns, column -> csvCodec.render(record.get(column)));
            unclaimed.computeIfAbsent(recordKey, k -> new ArrayDeque<>()).add(i);
        }

        for (Map<String, String> row : rows) {
            Deque<Integer> candidates = unclaimed.get(key(columns, row::get));
            Integer index = candidates == null ? null : candidates.pollFirst();
            if (index == null) {
                log.warn("Bulk job {} returned a result row matching no submitted record (id: {})",
                        job.getJobId(), row.get(SF_ID));
                continue;
            }
            job.addResult(toResult.apply(index, row));
        }
    }

    private static String key(List<String> columns, Function<String, String> value) {
        StringBuilder key = new StringBuilder();
        for (String column : columns) {
            String v = value.apply(column);
            key.append(v == null ? "" : v).append('\u0000');
        }
        return key.toString();
    }

    static List<List<Map<String, Object>>> partition(List<Map<String, Object>> records, int batchSize) {
        List<List<Map<String, Object>>> batches = new ArrayList<>();
        for (int start = 0; start < records.size(); start += batchSize) {
            batches.add(records.subList(start, Math.min(start + batchSize, records.size())));
        }
        return batches;
    }

    private String toJson(Map<String, Object> body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body cannot be written as JSON", e);
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
