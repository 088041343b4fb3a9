package com.mibprofile.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. The template path listing is memoized briefly; every cache write evicts it.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String TEMPLATE_PATHS_CACHE = "templatePathsCache";

    @Bean
    public CacheManager caffeineCacheManager(
            @Value("${mibprofile.cache.paths-ttl-seconds:60}") long pathsTtlSeconds) {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(TEMPLATE_PATHS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(pathsTtlSeconds, TimeUnit.SECONDS)
                .maximumSize(1)
                .build());
        return manager;
    }
}
