package com.mibprofile.template.config;

import com.mibprofile.generation.TextGenerationClient;
import com.mibprofile.template.selection.KeywordReferenceSelector;
import com.mibprofile.template.selection.LlmReferenceSelector;
import com.mibprofile.template.selection.ReferenceSelector;
import com.mibprofile.template.source.GitHubTemplateSource;
import com.mibprofile.template.source.TemplateSource;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Template module wiring: remote source, its rate limiter, and the selection strategy.
 */
@Configuration
@EnableConfigurationProperties({ GitHubSourceProperties.class, TemplateSyncProperties.class, SelectionProperties.class })
@Slf4j
public class TemplateConfig {

    @Bean(name = "templateSourceRateLimiter")
    public RateLimiter templateSourceRateLimiter(GitHubSourceProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("template-source", config);
    }

    @Bean
    public TemplateSource templateSource(
            GitHubSourceProperties properties,
            WebClient.Builder webClientBuilder,
            @Qualifier("templateSourceRateLimiter") RateLimiter rateLimiter) {
        return new GitHubTemplateSource(properties, webClientBuilder, rateLimiter);
    }

    @Bean
    public KeywordReferenceSelector keywordReferenceSelector(SelectionProperties properties) {
        return new KeywordReferenceSelector(properties.getFallbackPath());
    }

    /**
     * Active selection strategy. Unknown strategy names fall back to keyword.
     */
    @Bean
    @Primary
    public ReferenceSelector referenceSelector(
            SelectionProperties properties,
            KeywordReferenceSelector keywordReferenceSelector,
            TextGenerationClient textGenerationClient) {
        if ("llm".equalsIgnoreCase(properties.getStrategy())) {
            return new LlmReferenceSelector(textGenerationClient, keywordReferenceSelector, properties.getMaxLlmCandidates());
        }
        if (!"keyword".equalsIgnoreCase(properties.getStrategy())) {
            log.warn("Unknown selection strategy '{}', using keyword", properties.getStrategy());
        }
        return keywordReferenceSelector;
    }
}
