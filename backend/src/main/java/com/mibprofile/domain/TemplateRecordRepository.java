package com.mibprofile.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for template_cache. save() is an upsert by path.
 */
public interface TemplateRecordRepository extends MongoRepository<TemplateRecord, String>, TemplateRecordRepositoryCustom {
}
