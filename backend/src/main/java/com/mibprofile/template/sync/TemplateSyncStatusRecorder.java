package com.mibprofile.template.sync;

import com.mibprofile.domain.TemplateSyncStatus;
import com.mibprofile.domain.TemplateSyncStatusRepository;
import com.mibprofile.template.config.TemplateSyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Keeps template_sync_status in step with the latest run. Best effort: a store outage is logged and the run result
 * is unaffected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TemplateSyncStatusRecorder {

    private final TemplateSyncStatusRepository repository;
    private final TemplateSyncProperties properties;

    @EventListener
    public void onSyncCompleted(TemplateSyncCompletedEvent event) {
        SyncRunResult result = event.result();
        try {
            TemplateSyncStatus status = repository.findById(properties.getCorpusId()).orElseGet(() -> {
                TemplateSyncStatus s = new TemplateSyncStatus();
                s.setId(properties.getCorpusId());
                return s;
            });
            status.setConsecutiveFailures(result.status() == TemplateSyncStatus.SyncStatusValue.FAILED
                    ? status.getConsecutiveFailures() + 1
                    : 0);
            status.setStatus(result.status());
            status.setItemsSynced(result.itemsSynced());
            status.setItemsFailed(result.itemsFailed());
            status.setBacklogSize(result.backlogSize());
            status.setAuthoritativeSize(result.authoritativeSize());
            status.setMessage(result.message());
            status.setStartedAt(result.startedAt());
            status.setFinishedAt(result.finishedAt());
            repository.save(status);
        } catch (DataAccessException e) {
            log.warn("Could not record template sync status: {}", e.getMessage());
        }
    }

    public Optional<TemplateSyncStatus> latest() {
        try {
            return repository.findById(properties.getCorpusId());
        } catch (DataAccessException e) {
            log.warn("Could not read template sync status: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
