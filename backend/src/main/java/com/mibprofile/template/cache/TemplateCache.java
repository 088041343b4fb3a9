package com.mibprofile.template.cache;

import java.util.Optional;
import java.util.Set;

/**
 * Durable path-to-template store. Soft dependency: when the backing store is unreachable, reads return absent/empty
 * instead of failing, and callers fall back to defaults.
 */
public interface TemplateCache {

    /**
     * Unconditional upsert; replaces any previous content for the path.
     *
     * @throws TemplateCacheException when the write could not be stored
     */
    void put(String path, String content);

    /**
     * Content for the path, or empty when not cached or the store is unreachable.
     */
    Optional<String> get(String path);

    /**
     * All cached paths (keys only). Empty when the store is unreachable.
     */
    Set<String> listPaths();
}
