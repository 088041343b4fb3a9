package com.mibprofile.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * MongoTemplate-backed path projection for template_cache.
 */
@Repository
@RequiredArgsConstructor
public class TemplateRecordRepositoryImpl implements TemplateRecordRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Set<String> findAllPaths() {
        Query query = new Query();
        query.fields().include("_id");
        Set<String> paths = new LinkedHashSet<>();
        try (Stream<TemplateRecord> records = mongoTemplate.stream(query, TemplateRecord.class)) {
            records.forEach(record -> paths.add(record.getPath()));
        }
        return paths;
    }
}
