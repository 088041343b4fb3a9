package com.mibprofile.domain;

import java.util.Set;

/**
 * Custom queries for template_cache that must not load template content.
 */
public interface TemplateRecordRepositoryCustom {

    /**
     * All cached paths. Projection on the id only; content is never transported.
     */
    Set<String> findAllPaths();
}
