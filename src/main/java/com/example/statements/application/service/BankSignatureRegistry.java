package com.example.statements.application.service;

import com.example.statements.domain.model.BankSignature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable list of supported statement issuers.
 * Order matters: when a text matches several signatures, the first one wins.
 */
public class BankSignatureRegistry {

    private static final Logger log = LoggerFactory.getLogger(BankSignatureRegistry.class);

    private final List<BankSignature> signatures;

    public BankSignatureRegistry(List<BankSignature> signatures) {
        if (signatures == null || signatures.isEmpty()) {
            throw new IllegalArgumentException("At least one bank signature is required.");
        }
        this.signatures = List.copyOf(signatures);
    }

    /**
     * Reads a JSON array of signatures.
     *
     * @param objectMapper Jackson mapper
     * @param resource     JSON resource
     * @return loaded registry
     * @throws UncheckedIOException when the resource cannot be read
     */
    public static BankSignatureRegistry load(ObjectMapper objectMapper, Resource resource) {
        try (InputStream input = resource.getInputStream()) {
            List<BankSignature> signatures = objectMapper.readValue(input, new TypeReference<List<BankSignature>>() {
            });
            log.info("Loaded {} bank signatures from {}", signatures.size(), resource.getDescription());
            return new BankSignatureRegistry(signatures);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to load bank signatures from " + resource.getDescription(), ex);
        }
    }

    public List<BankSignature> signatures() {
        return signatures;
    }

    /**
     * @param text statement text
     * @return first signature in registry order with at least one keyword in the text
     */
    public Optional<BankSignature> detect(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        String upper = text.toUpperCase(Locale.ROOT);
        return signatures.stream().filter(signature -> signature.matches(upper)).findFirst();
    }

    public Optional<BankSignature> find(String code) {
        return signatures.stream().filter(signature -> signature.code().equals(code)).findFirst();
    }

    /**
     * @return code to description, in registry order
     */
    public Map<String, String> supportedBanks() {
        Map<String, String> banks = new LinkedHashMap<>();
        signatures.forEach(signature -> banks.put(signature.code(), signature.description()));
        return banks;
    }

    /**
     * @param text statement text
     * @return matched keywords per signature code, only for signatures with at least one match
     */
    public Map<String, List<String>> keywordsFound(String text) {
        Map<String, List<String>> found = new LinkedHashMap<>();
        String upper = text == null ? "" : text.toUpperCase(Locale.ROOT);
        for (BankSignature signature : signatures) {
            List<String> matched = signature.matchedKeywords(upper);
            if (!matched.isEmpty()) {
                found.put(signature.code(), matched);
            }
        }
        return found;
    }
}
