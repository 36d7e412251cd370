package com.example.statements.config;

import com.example.statements.application.service.BankSignatureRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Wires the shared, read-only collaborators of the pipeline.
 */
@Configuration
@EnableConfigurationProperties(ExtractionProperties.class)
public class ExtractionConfig {

    /**
     * Loads the bank signature registry once at start-up.
     *
     * @param objectMapper Jackson mapper provided by Spring Boot
     * @param signatures   JSON resource listing the signatures in priority order
     * @return immutable registry shared by all requests
     */
    @Bean
    public BankSignatureRegistry bankSignatureRegistry(ObjectMapper objectMapper,
                                                       @Value("${statement.extraction.signatures:classpath:bank-signatures.json}") Resource signatures) {
        return BankSignatureRegistry.load(objectMapper, signatures);
    }

    @Bean
    public RestTemplate languageModelRestTemplate(RestTemplateBuilder builder) {
        return builder.build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
