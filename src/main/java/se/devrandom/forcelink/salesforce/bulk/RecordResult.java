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
 * Outcome of one input record.
 *
 * @param index   position of the record in the submitted list
 * @param id      record id reported by the org, null when there is none
 * @param created true when an upsert or insert created the record
 * @param error   remote error text, null on success
 */
public record RecordResult(int index, boolean success, String id, boolean created, String error) {

    public static final String UNPROCESSED = "Record was not processed by the job";

    public static RecordResult succeeded(int index, String id, boolean created) {
        return new RecordResult(index, true, id, created, null);
    }

    public static RecordResult failed(int index, String id, String error) {
        return new RecordResult(index, false, id, false, error);
    }

    public static RecordResult unprocessed(int index) {
        return new RecordResult(index, false, null, false, UNPROCESSED);
    }
}
