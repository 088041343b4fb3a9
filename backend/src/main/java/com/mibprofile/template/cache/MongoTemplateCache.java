package com.mibprofile.template.cache;

import com.mibprofile.config.CaffeineConfig;
import com.mibprofile.domain.TemplateRecord;
import com.mibprofile.domain.TemplateRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Template cache on the template_cache collection. Reads absorb store outages (logged, treated as absent);
 * writes surface them as {@link TemplateCacheException}. The path listing is memoized in Caffeine and evicted on
 * every write; an empty listing is never memoized.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MongoTemplateCache implements TemplateCache {

    private final TemplateRecordRepository repository;
    private final Clock clock;

    @Override
    @CacheEvict(cacheNames = CaffeineConfig.TEMPLATE_PATHS_CACHE, allEntries = true)
    public void put(String path, String content) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        try {
            repository.save(new TemplateRecord(path, content, Instant.now(clock)));
        } catch (DataAccessException e) {
            throw new TemplateCacheException("Template cache write failed for " + path, e);
        }
    }

    @Override
    public Optional<String> get(String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        try {
            return repository.findById(path).map(TemplateRecord::getContent);
        } catch (DataAccessException e) {
            log.warn("Template cache unavailable reading {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    @Cacheable(cacheNames = CaffeineConfig.TEMPLATE_PATHS_CACHE, unless = "#result.isEmpty()")
    public Set<String> listPaths() {
        try {
            return Collections.unmodifiableSortedSet(new TreeSet<>(repository.findAllPaths()));
        } catch (DataAccessException e) {
            log.warn("Template cache unavailable listing paths: {}", e.getMessage());
            return Set.of();
        }
    }
}
