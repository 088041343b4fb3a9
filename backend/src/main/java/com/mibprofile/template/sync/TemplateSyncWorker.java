package com.mibprofile.template.sync;

import com.mibprofile.domain.TemplateSyncStatus.SyncStatusValue;
import com.mibprofile.template.cache.TemplateCache;
import com.mibprofile.template.cache.TemplateCacheException;
import com.mibprofile.template.config.TemplateSyncProperties;
import com.mibprofile.template.source.TemplateSource;
import com.mibprofile.template.source.TemplateSourceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Mirrors the remote template corpus into the cache, a bounded slice per run.
 * <ol>
 *   <li>list authoritative paths (failure aborts the run)</li>
 *   <li>backlog = listed paths not yet cached, in listing order (presence only; cached content is never re-checked)</li>
 *   <li>fetch and upsert the first {@code quota} backlog paths one by one; a failed item is skipped</li>
 * </ol>
 * Never deletes. Overlapping runs are safe since every write is an upsert by path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TemplateSyncWorker {

    private final TemplateSource templateSource;
    private final TemplateCache templateCache;
    private final TemplateSyncProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * One run with the configured quota.
     */
    public SyncRunResult runOnce() {
        return run(properties.getQuota());
    }

    /**
     * One run fetching at most {@code quota} backlog items.
     *
     * @throws TemplateSyncListingException when the authoritative listing cannot be fetched
     */
    public SyncRunResult run(int quota) {
        Instant startedAt = Instant.now(clock);
        List<String> authoritative;
        try {
            authoritative = templateSource.listPaths(properties.getPathPrefix(), properties.getPathSuffix());
        } catch (TemplateSourceException e) {
            SyncRunResult failed = SyncRunResult.failed(startedAt, Instant.now(clock), e.getMessage());
            eventPublisher.publishEvent(new TemplateSyncCompletedEvent(failed));
            throw new TemplateSyncListingException("Template listing failed: " + e.getMessage(), e, failed);
        }

        Set<String> cached = templateCache.listPaths();
        List<String> backlog = authoritative.stream()
                .filter(path -> !cached.contains(path))
                .distinct()
                .toList();
        int limit = Math.max(0, quota);
        List<String> batch = backlog.subList(0, Math.min(limit, backlog.size()));

        int synced = 0;
        int failed = 0;
        for (String path : batch) {
            try {
                String content = templateSource.fetchContent(path);
                templateCache.put(path, content);
                synced++;
                log.debug("Synced template {}", path);
            } catch (TemplateSourceException | TemplateCacheException e) {
                failed++;
                log.warn("Failed to sync template {}: {}", path, e.getMessage());
            }
        }

        SyncStatusValue status = backlog.size() <= limit ? SyncStatusValue.COMPLETE : SyncStatusValue.PARTIAL;
        String message = String.format("Synced %d of %d backlog (%d failed, %d authoritative)",
                synced, backlog.size(), failed, authoritative.size());
        SyncRunResult result = new SyncRunResult(status, synced, failed, backlog.size(), authoritative.size(),
                startedAt, Instant.now(clock), message);
        log.info("Template sync {}: {}", status, message);
        eventPublisher.publishEvent(new TemplateSyncCompletedEvent(result));
        return result;
    }
}
