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
package se.devrandom.forcelink.salesforce.objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Bulk API 2.0 ingest job resource, as returned by job creation and status polling.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IngestJobInfo {
    public String id;
    public String operation;
    public String object;
    public String externalIdFieldName;
    public String createdById;
    public String createdDate;
    public String systemModstamp;
    public String state;
    public String concurrencyMode;
    public String contentType;
    public String apiVersion;
    public String lineEnding;
    public String columnDelimiter;
    public String jobType;
    public String errorMessage;
    public Integer numberRecordsProcessed;
    public Integer numberRecordsFailed;
    public Integer retries;
    public Long totalProcessingTime;

    public String getId() {
        return id;
    }

    public String getState() {
        return state;
    }

    public int getNumberRecordsProcessed() {
        return numberRecordsProcessed == null ? 0 : numberRecordsProcessed;
    }

    public int getNumberRecordsFailed() {
        return numberRecordsFailed == null ? 0 : numberRecordsFailed;
    }
}
