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
package se.devrandom.forcelink.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A bulk ingest job did not complete: it timed out while polling, or the remote system reported
 * it as failed or aborted. The job is never resubmitted automatically.
 */
public class BulkOperationException extends ForcelinkException {

    public enum Reason {
        TIMEOUT("timeout"),
        FAILED("failed"),
        ABORTED("aborted");

        private final String wireName;

        Reason(String wireName) {
            this.wireName = wireName;
        }

        public String getWireName() {
            return wireName;
        }
    }

    private final Reason reason;
    private final String jobId;
    private final String remoteMessage;

    public BulkOperationException(Reason reason, String jobId, String message, String remoteMessage) {
        super(message);
        this.reason = reason;
        this.jobId = jobId;
        this.remoteMessage = remoteMessage;
    }

    public Reason getReason() {
        return reason;
    }

    public String getJobId() {
        return jobId;
    }

    public String getRemoteMessage() {
        return remoteMessage;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.BULK_OPERATION_ERROR;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason.getWireName());
        details.put("job_id", jobId);
        if (remoteMessage != null) {
            details.put("remote_message", remoteMessage);
        }
        return details;
    }
}
