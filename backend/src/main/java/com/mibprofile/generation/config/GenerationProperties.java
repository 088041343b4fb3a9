package com.mibprofile.generation.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Optional text generation service used by the llm selection strategy, augmented profiles and symbol annotations.
 */
@ConfigurationProperties(prefix = "mibprofile.generation")
@NoArgsConstructor
@Getter
@Setter
public class GenerationProperties {

    /** When false, a no-op client is wired and every generation request yields no answer. */
    private boolean enabled = false;

    private String baseUrl = "https://api.anthropic.com";

    private String apiKey = "";

    /** Value of the anthropic-version header. */
    private String apiVersion = "2023-06-01";

    private String model = "claude-3-haiku-20240307";

    private int maxTokens = 2_000;

    private long timeoutMs = 30_000;

    /** Max symbols sent in one annotation request. */
    private int annotationMaxSymbols = 50;
}
