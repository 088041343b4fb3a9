package com.mibprofile.template.sync;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.mibprofile.domain.TemplateSyncStatus.SyncStatusValue;

import java.time.Instant;

/**
 * Outcome of one sync run.
 *
 * @param backlogSize       authoritative paths missing from the cache when the run started
 * @param authoritativeSize paths in the remote listing after prefix/suffix filtering
 */
public record SyncRunResult(
        SyncStatusValue status,
        int itemsSynced,
        int itemsFailed,
        int backlogSize,
        int authoritativeSize,
        Instant startedAt,
        Instant finishedAt,
        String message) {

    public static SyncRunResult failed(Instant startedAt, Instant finishedAt, String message) {
        return new SyncRunResult(SyncStatusValue.FAILED, 0, 0, 0, 0, startedAt, finishedAt, message);
    }

    @JsonIgnore
    public boolean isComplete() {
        return status == SyncStatusValue.COMPLETE;
    }
}
