package com.mibprofile.symbol.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mibprofile.symbol.compiler.MibCompiler;
import com.mibprofile.symbol.compiler.MibdumpCompiler;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Symbol module wiring: compiler adapter and its properties.
 */
@Configuration
@EnableConfigurationProperties(CompilerProperties.class)
public class SymbolConfig {

    @Bean
    public MibCompiler mibCompiler(CompilerProperties properties, ObjectMapper objectMapper) {
        return new MibdumpCompiler(properties, objectMapper);
    }
}
