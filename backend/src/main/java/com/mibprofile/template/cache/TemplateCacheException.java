package com.mibprofile.template.cache;

/**
 * Thrown when a template cannot be written to the cache.
 */
public class TemplateCacheException extends RuntimeException {

    public TemplateCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
