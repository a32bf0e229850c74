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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import se.devrandom.forcelink.exception.BulkOperationException;
import se.devrandom.forcelink.exception.ValidationException;
import se.devrandom.forcelink.salesforce.http.AuditSink;
import se.devrandom.forcelink.salesforce.http.RetryPolicy;
import se.devrandom.forcelink.salesforce.http.SalesforceHttpDispatcher;
import se.devrandom.forcelink.salesforce.registry.MultiOrgRegistry;
import se.devrandom.forcelink.support.MutableClock;
import se.devrandom.forcelink.support.RecordingSleeper;
import se.devrandom.forcelink.support.StubAuthProvider;
import se.devrandom.forcelink.support.StubExchangeFunction;
import se.devrandom.forcelink.support.StubResponse;
import se.devrandom.forcelink.support.TestOrgs;
import se.devrandom.forcelink.util.Deadline;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BulkJobOrchestratorTest {

    private static final String JOBS = "/services/data/v59.0/jobs/ingest";
    private static final String JOB_ID = "7505g000001AbCdAAK";
    private static final String JOB = JOBS + "/" + JOB_ID;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MutableClock clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
    private final RecordingSleeper sleeper = new RecordingSleeper(clock);
    private final StubExchangeFunction stub = new StubExchangeFunction();

    private BulkJobOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        MultiOrgRegistry registry = MultiOrgRegistry.builder()
                .register(TestOrgs.context("prod", clock, new StubAuthProvider(clock)))
                .defaultAlias("prod")
                .build();
        SalesforceHttpDispatcher dispatcher = new SalesforceHttpDispatcher(registry, stub.webClient(), objectMapper,
                RetryPolicy.defaults(), Duration.ofSeconds(30), AuditSink.NONE, sleeper, clock);
        orchestrator = new BulkJobOrchestrator(dispatcher, objectMapper, Duration.ofSeconds(2), 5, sleeper, clock);

        stub.on(HttpMethod.POST, JOBS, StubResponse.json(200, job("Open", null)))
                .on(HttpMethod.PUT, JOB + "/batches", StubResponse.status(201))
                .on(HttpMethod.PATCH, JOB, StubResponse.json(200, job("UploadComplete", null)));
    }

    @Test
    void uploadsInBatchesAndReturnsResultsInInputOrder() throws Exception {
        List<Map<String, Object>> records = accounts(450);
        StringBuilder successful = new StringBuilder("\"sf__Id\",\"sf__Created\",\"Name\"\n");
        for (int i = records.size() - 1; i >= 0; i--) {
            if (i != 7) {
                successful.append(id(i)).append(",true,Account ").append(i).append('\n');
            }
        }
        stub.on(HttpMethod.GET, JOB,
                        StubResponse.json(200, job("InProgress", null)),
                        StubResponse.json(200, "{\"id\":\"" + JOB_ID + "\",\"state\":\"JobComplete\","
                                + "\"numberRecordsProcessed\":450,\"numberRecordsFailed\":1}"))
                .on(HttpMethod.GET, JOB + "/successfulResults/", StubResponse.csv(successful.toString()))
                .on(HttpMethod.GET, JOB + "/failedResults/", StubResponse.csv("\"sf__Id\",\"sf__Error\",\"Name\"\n"
                        + ",\"REQUIRED_FIELD_MISSING:Required fields are missing: [Industry]:Industry --\",Account 7\n"))
                .on(HttpMethod.GET, JOB + "/unprocessedrecords/", StubResponse.csv("Name\n"));

        BulkJobResult result = orchestrator.run("prod",
                new BulkRequest("Account", BulkOperation.INSERT, records, 200, null), Deadline.none());

        assertThat(result.jobId()).isEqualTo(JOB_ID);
        assertThat(result.state()).isEqualTo(BulkJobState.JOB_COMPLETE);
        assertThat(result.batchCount()).isEqualTo(3);
        assertThat(result.recordsProcessed()).isEqualTo(450);
        assertThat(result.recordsFailed()).isEqualTo(1);
        assertThat(result.results()).hasSize(450);
        for (int i = 0; i < 450; i++) {
            RecordResult record = result.results().get(i);
            assertThat(record.index()).isEqualTo(i);
            if (i == 7) {
                assertThat(record.success()).isFalse();
                assertThat(record.error()).startsWith("REQUIRED_FIELD_MISSING");
                assertThat(record.id()).isNull();
            } else {
                assertThat(record.success()).isTrue();
                assertThat(record.id()).isEqualTo(id(i));
                assertThat(record.created()).isTrue();
            }
        }
        assertThat(result.successCount()).isEqualTo(449);

        List<StubExchangeFunction.RecordedRequest> uploads = stub.requestsTo(HttpMethod.PUT, JOB + "/batches");
        assertThat(uploads).extracting(upload -> upload.body().split("\n").length).containsExactly(201, 201, 51);
        assertThat(uploads.get(0).header("Content-Type")).startsWith("text/csv");
        assertThat(uploads.get(0).body()).startsWith("Name\nAccount 0\n");

        JsonNode created = objectMapper.readTree(stub.requestsTo(HttpMethod.POST, JOBS).get(0).body());
        assertThat(created.path("object").asText()).isEqualTo("Account");
        assertThat(created.path("operation").asText()).isEqualTo("insert");
        assertThat(created.path("contentType").asText()).isEqualTo("CSV");
        assertThat(created.path("lineEnding").asText()).isEqualTo("LF");
        assertThat(created.has("externalIdFieldName")).isFalse();

        assertThat(stub.requestsTo(HttpMethod.PATCH, JOB)).singleElement()
                .satisfies(patch -> assertThat(patch.body()).contains("UploadComplete"));
        assertThat(sleeper.getSleeps()).containsExactly(Duration.ofSeconds(2));
    }

    @Test
    void givesUpAfterTheLastStatusCheck() {
        stub.on(HttpMethod.GET, JOB, StubResponse.json(200, job("InProgress", null)));

        assertThatThrownBy(() -> orchestrator.run("prod", BulkRequest.of("Account", BulkOperation.INSERT, accounts(3)),
                Deadline.none()))
                .isInstanceOfSatisfying(BulkOperationException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(BulkOperationException.Reason.TIMEOUT);
                    assertThat(e.getJobId()).isEqualTo(JOB_ID);
                });

        assertThat(stub.requestsTo(HttpMethod.GET, JOB)).hasSize(5);
        assertThat(sleeper.getSleeps()).hasSize(4).containsOnly(Duration.ofSeconds(2));
        // the remote job is left running, not aborted
        assertThat(stub.requestsTo(HttpMethod.PATCH, JOB)).hasSize(1);
    }

    @Test
    void failedJobIsReportedAndNotResubmitted() {
        stub.on(HttpMethod.GET, JOB,
                StubResponse.json(200, job("Failed", "InvalidBatch : Field name not found : Industri")));

        assertThatThrownBy(() -> orchestrator.run("prod", BulkRequest.of("Account", BulkOperation.INSERT, accounts(2)),
                Deadline.none()))
                .isInstanceOfSatisfying(BulkOperationException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(BulkOperationException.Reason.FAILED);
                    assertThat(e.getRemoteMessage()).contains("Field name not found");
                    assertThat(e.getDetails()).containsEntry("reason", "failed");
                });

        assertThat(stub.requestsTo(HttpMethod.POST, JOBS)).hasSize(1);
        assertThat(stub.requestsTo(HttpMethod.GET, JOB + "/successfulResults/")).isEmpty();
    }

    @Test
    void abortedJobIsReported() {
        stub.on(HttpMethod.GET, JOB, StubResponse.json(200, job("Aborted", null)));

        assertThatThrownBy(() -> orchestrator.run("prod", BulkRequest.of("Account", BulkOperation.INSERT, accounts(2)),
                Deadline.none()))
                .isInstanceOfSatisfying(BulkOperationException.class,
                        e -> assertThat(e.getReason()).isEqualTo(BulkOperationException.Reason.ABORTED));
    }

    @Test
    void failedUploadAbortsTheJob() {
        stub.on(HttpMethod.PUT, JOB + "/batches", StubResponse.json(400,
                "[{\"errorCode\":\"INVALIDJOBSTATE\",\"message\":\"Job is not open\"}]"));

        assertThatThrownBy(() -> orchestrator.run("prod", BulkRequest.of("Account", BulkOperation.INSERT, accounts(2)),
                Deadline.none()))
                .isInstanceOf(ValidationException.class);

        assertThat(stub.requestsTo(HttpMethod.PATCH, JOB)).singleElement()
                .satisfies(patch -> assertThat(patch.body()).contains("Aborted"));
        assertThat(stub.requestsTo(HttpMethod.GET, JOB)).isEmpty();
    }

    @Test
    void upsertSendsExternalIdAndReportsCreatedFlag() throws Exception {
        List<Map<String, Object>> records = new ArrayList<>();
        records.add(record("External_Id__c", "EXT-1", "Name", "Acme"));
        records.add(record("External_Id__c", "EXT-2", "Name", "Globex"));
        stub.on(HttpMethod.GET, JOB, StubResponse.json(200, job("JobComplete", null)))
                .on(HttpMethod.GET, JOB + "/successfulResults/", StubResponse.csv(
                        "sf__Id,sf__Created,External_Id__c,Name\n"
                                + "001000000000002AAA,false,EXT-2,Globex\n"
                                + "001000000000001AAA,true,EXT-1,Acme\n"))
                .on(HttpMethod.GET, JOB + "/failedResults/", StubResponse.csv(""))
                .on(HttpMethod.GET, JOB + "/unprocessedrecords/", StubResponse.csv(""));

        BulkJobResult result = orchestrator.run("prod",
                new BulkRequest("Account", BulkOperation.UPSERT, records, 200, "External_Id__c"), Deadline.none());

        JsonNode created = objectMapper.readTree(stub.requestsTo(HttpMethod.POST, JOBS).get(0).body());
        assertThat(created.path("operation").asText()).isEqualTo("upsert");
        assertThat(created.path("externalIdFieldName").asText()).isEqualTo("External_Id__c");
        assertThat(result.results()).containsExactly(
                RecordResult.succeeded(0, "001000000000001AAA", true),
                RecordResult.succeeded(1, "001000000000002AAA", false));
    }

    @Test
    void recordsWithoutAResultAreUnprocessed() {
        List<Map<String, Object>> records = accounts(3);
        stub.on(HttpMethod.GET, JOB, StubResponse.json(200, job("JobComplete", null)))
                .on(HttpMethod.GET, JOB + "/successfulResults/",
                        StubResponse.csv("sf__Id,sf__Created,Name\n" + id(0) + ",true,Account 0\n"))
                .on(HttpMethod.GET, JOB + "/failedResults/", StubResponse.csv("sf__Id,sf__Error,Name\n"))
                .on(HttpMethod.GET, JOB + "/unprocessedrecords/", StubResponse.csv("Name\nAccount 2\n"));

        BulkJobResult result = orchestrator.run("prod", BulkRequest.of("Account", BulkOperation.INSERT, records),
                Deadline.none());

        assertThat(result.results()).containsExactly(
                RecordResult.succeeded(0, id(0), true),
                RecordResult.unprocessed(1),
                RecordResult.unprocessed(2));
    }

    @Test
    void identicalRecordsAreMatchedInInputOrder() {
        List<Map<String, Object>> records = new ArrayList<>();
        records.add(record("Name", "Same"));
        records.add(record("Name", "Same"));
        stub.on(HttpMethod.GET, JOB, StubResponse.json(200, job("JobComplete", null)))
                .on(HttpMethod.GET, JOB + "/successfulResults/", StubResponse.csv(
                        "sf__Id,sf__Created,Name\n001000000000001AAA,true,Same\n001000000000002AAA,true,Same\n"))
                .on(HttpMethod.GET, JOB + "/failedResults/", StubResponse.csv(""))
                .on(HttpMethod.GET, JOB + "/unprocessedrecords/", StubResponse.csv(""));

        BulkJobResult result = orchestrator.run("prod", BulkRequest.of("Account", BulkOperation.INSERT, records),
                Deadline.none());

        assertThat(result.results()).extracting(RecordResult::id)
                .containsExactly("001000000000001AAA", "001000000000002AAA");
    }

    @Test
    void partitionsByBatchSize() {
        assertThat(BulkJobOrchestrator.partition(accounts(5), 2)).extracting(List::size).containsExactly(2, 2, 1);
        assertThat(BulkJobOrchestrator.partition(accounts(4), 200)).hasSize(1);
    }

    private static List<Map<String, Object>> accounts(int count) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(record("Name", "Account " + i));
        }
        return Collections.unmodifiableList(records);
    }

    private static Map<String, Object> record(Object... keyValues) {
        Map<String, Object> record = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            record.put((String) keyValues[i], keyValues[i + 1]);
        }
        return record;
    }

    private static String id(int index) {
        return String.format("001%012dAAA", index);
    }

    private static String job(String state, String errorMessage) {
        return "{\"id\":\"" + JOB_ID + "\",\"state\":\"" + state + "\""
                + (errorMessage != null ? ",\"errorMessage\":\"" + errorMessage + "\"" : "") + "}";
    }
}
