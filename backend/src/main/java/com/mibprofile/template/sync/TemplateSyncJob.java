package com.mibprofile.template.sync;

import com.mibprofile.template.config.TemplateSyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic template sync. A listing failure ends the run; the next scheduled run tries again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TemplateSyncJob {

    private final TemplateSyncWorker templateSyncWorker;
    private final TemplateSyncProperties properties;

    @Scheduled(
            fixedDelayString = "${mibprofile.sync.interval-ms:3600000}",
            initialDelayString = "${mibprofile.sync.initial-delay-ms:30000}")
    public void runScheduled() {
        if (!properties.isEnabled()) {
            log.debug("Template sync disabled");
            return;
        }
        try {
            templateSyncWorker.runOnce();
        } catch (TemplateSyncListingException e) {
            log.error("Scheduled template sync aborted: {}", e.getMessage());
        }
    }
}
