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

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of an ingest job. {@code JobComplete}, {@code Failed} and {@code Aborted} are terminal.
 */
public enum BulkJobState {
    CREATED("Created"),
    OPEN("Open"),
    UPLOAD_COMPLETE("UploadComplete"),
    IN_PROGRESS("InProgress"),
    JOB_COMPLETE("JobComplete"),
    FAILED("Failed"),
    ABORTED("Aborted");

    private static final Map<BulkJobState, Set<BulkJobState>> TRANSITIONS = new EnumMap<>(BulkJobState.class);

    static {
        TRANSITIONS.put(CREATED, EnumSet.of(OPEN));
        TRANSITIONS.put(OPEN, EnumSet.of(UPLOAD_COMPLETE, FAILED, ABORTED));
        TRANSITIONS.put(UPLOAD_COMPLETE, EnumSet.of(IN_PROGRESS, JOB_COMPLETE, FAILED, ABORTED));
        TRANSITIONS.put(IN_PROGRESS, EnumSet.of(JOB_COMPLETE, FAILED, ABORTED));
        TRANSITIONS.put(JOB_COMPLETE, EnumSet.noneOf(BulkJobState.class));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(BulkJobState.class));
        TRANSITIONS.put(ABORTED, EnumSet.noneOf(BulkJobState.class));
    }

    private final String remoteName;

    BulkJobState(String remoteName) {
        this.remoteName = remoteName;
    }

    public String getRemoteName() {
        return remoteName;
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    public boolean canTransitionTo(BulkJobState next) {
        return TRANSITIONS.get(this).contains(next);
    }

    /**
     * @return null for a state name this client does not know
     */
    public static BulkJobState fromRemote(String name) {
        for (BulkJobState state : values()) {
            if (state.remoteName.equals(name)) {
                return state;
            }
        }
        return null;
    }
}
