package com.mibprofile.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Outcome of the latest template sync run for one corpus (single document per corpus id).
 */
@Document(collection = "template_sync_status")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TemplateSyncStatus {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private SyncStatusValue status;
    private int itemsSynced;
    private int itemsFailed;
    /** Backlog size at the start of the run (authoritative paths not yet cached). */
    private int backlogSize;
    private int authoritativeSize;
    private String message;
    private Instant startedAt;
    private Instant finishedAt;
    /** Consecutive FAILED runs; reset by any run that got past the listing. */
    private int consecutiveFailures;

    public enum SyncStatusValue {
        COMPLETE,
        PARTIAL,
        FAILED
    }
}
