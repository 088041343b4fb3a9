package com.mibprofile.generation.config;

import com.mibprofile.generation.LlmProfileGenerationClient;
import com.mibprofile.generation.LlmSymbolAnnotationClient;
import com.mibprofile.generation.MessagesApiTextGenerationClient;
import com.mibprofile.generation.NoopTextGenerationClient;
import com.mibprofile.generation.ProfileGenerationClient;
import com.mibprofile.generation.SymbolAnnotationClient;
import com.mibprofile.generation.TextGenerationClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Generation module wiring. Disabled by default.
 */
@Configuration
@EnableConfigurationProperties(GenerationProperties.class)
public class GenerationConfig {

    @Bean
    public TextGenerationClient textGenerationClient(GenerationProperties properties, WebClient.Builder webClientBuilder) {
        if (!properties.isEnabled()) {
            return new NoopTextGenerationClient();
        }
        return new MessagesApiTextGenerationClient(properties, webClientBuilder);
    }

    @Bean
    public ProfileGenerationClient profileGenerationClient(TextGenerationClient textGenerationClient) {
        return new LlmProfileGenerationClient(textGenerationClient);
    }

    @Bean
    public SymbolAnnotationClient symbolAnnotationClient(TextGenerationClient textGenerationClient,
                                                         GenerationProperties properties) {
        return new LlmSymbolAnnotationClient(textGenerationClient, properties.getAnnotationMaxSymbols());
    }
}
