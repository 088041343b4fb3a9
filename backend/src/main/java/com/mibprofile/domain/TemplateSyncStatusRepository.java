package com.mibprofile.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for template_sync_status. Written by TemplateSyncStatusRecorder, read by the sync API.
 */
public interface TemplateSyncStatusRepository extends MongoRepository<TemplateSyncStatus, String> {
}
