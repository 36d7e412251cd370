package com.example.statements.infrastructure.llm;

import com.example.statements.config.ExtractionProperties;
import com.example.statements.infrastructure.exception.LanguageModelException;
import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link LanguageModelClient} for the Mistral chat completion API (EU hosted).
 */
@Component
public class MistralChatClient implements LanguageModelClient {

    private static final Logger log = LoggerFactory.getLogger(MistralChatClient.class);
    private static final String COMPLETIONS_PATH = "/v1/chat/completions";

    private final RestTemplate restTemplate;
    private final ExtractionProperties.Llm settings;

    public MistralChatClient(RestTemplate restTemplate, ExtractionProperties properties) {
        this.restTemplate = restTemplate;
        this.settings = properties.llm();
    }

    @Override
    public String complete(String prompt) {
        if (!settings.hasApiKey()) {
            throw new LanguageModelException("Mistral API key is not configured.");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", settings.model());
        payload.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        payload.put("temperature", settings.temperature());
        payload.put("max_tokens", settings.maxTokens());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(settings.apiKey());

        ResponseEntity<JsonNode> response;
        try {
            log.info("Calling {} ({} prompt characters)", settings.model(), prompt.length());
            response = restTemplate.postForEntity(settings.baseUrl() + COMPLETIONS_PATH,
                    new HttpEntity<>(payload, headers), JsonNode.class);
        } catch (RestClientException ex) {
            throw new LanguageModelException("Mistral API call failed: " + ex.getMessage(), ex);
        }

        JsonNode body = response.getBody();
        JsonNode content = body == null ? null : body.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual() || content.asText().isBlank()) {
            throw new LanguageModelException("Mistral API returned no completion content.");
        }
        return content.asText().strip();
    }
}
