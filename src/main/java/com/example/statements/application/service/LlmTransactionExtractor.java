package com.example.statements.application.service;

import com.example.statements.config.ExtractionProperties;
import com.example.statements.domain.model.StatementDates;
import com.example.statements.domain.model.TierResult;
import com.example.statements.domain.model.Transaction;
import com.example.statements.infrastructure.llm.LanguageModelClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Language-model tier: asks the model for a JSON array of transactions and keeps only the records
 * that pass schema, date, amount and label checks.
 */
@Service
public class LlmTransactionExtractor {

    private static final Logger log = LoggerFactory.getLogger(LlmTransactionExtractor.class);

    private static final Pattern JSON_ARRAY = Pattern.compile("\\[.*]", Pattern.DOTALL);
    private static final int LOG_PREVIEW = 500;

    private final LanguageModelClient client;
    private final ObjectMapper objectMapper;
    private final ExtractionProperties properties;

    public LlmTransactionExtractor(LanguageModelClient client, ObjectMapper objectMapper, ExtractionProperties properties) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

	/**
	 * Runs the tier. Nothing is thrown: transport or parsing problems come back as an error result.
	 *
	 * @param text     statement text
	 * @param bankHint detected bank code, may be {@code null}
	 * @return {@code SUCCESS}, {@code EMPTY} when every record was rejected, or {@code ERROR}
	 */
    public TierResult extract(String text, String bankHint) {
        try {
            String prompt = buildPrompt(text, bankHint);
            if (properties.debug()) {
                log.info("LLM prompt preview: {}", preview(prompt));
            }
            String reply = client.complete(prompt);
            if (properties.debug()) {
                log.info("LLM reply: {}", reply);
            } else {
                log.debug("LLM reply preview: {}", preview(reply));
            }
            List<Transaction> transactions = parseReply(reply);
            log.info("LLM tier: {} transactions accepted", transactions.size());
            return TierResult.of(transactions, "Language model returned no usable transaction");
        } catch (RuntimeException | JsonProcessingException ex) {
            log.warn("LLM tier failed: {}", ex.getMessage());
            return TierResult.error("Language model extraction failed: " + ex.getMessage());
        }
    }

	/**
	 * @param text     statement text, truncated to the configured budget
	 * @param bankHint detected bank code, may be {@code null}
	 * @return French instruction asking for a strict JSON array
	 */
    String buildPrompt(String text, String bankHint) {
        String source = text == null ? "" : text;
        int limit = properties.llm().maxInputChars();
        if (source.length() > limit) {
            log.info("Statement text truncated from {} to {} characters for the language model", source.length(), limit);
            source = source.substring(0, limit);
        }
        String bankContext = bankHint == null || bankHint.isBlank() ? "" : " (banque détectée: " + bankHint + ")";

        return """
                Tu es un expert en extraction de données bancaires françaises.
                Analyse ce relevé bancaire%s et extrait TOUTES les transactions visibles au format JSON strict.

                Relevé bancaire:
                %s

                Format JSON attendu (IMPORTANT - respecter exactement ce format):
                [
                  {"date": "30/10/2025", "libelle": "CERTAS ESSOF024", "montant": -16.62},
                  {"date": "31/10/2025", "libelle": "CAFE FRANCIS", "montant": -23.40},
                  {"date": "01/11/2025", "libelle": "VIREMENT SALAIRE", "montant": 2500.00}
                ]

                Règles strictes:
                1. Date: format JJ/MM/AAAA (ex: 30/10/2025)
                2. Montant:
                   - NÉGATIF pour débits/achats (ex: -16.62)
                   - POSITIF pour crédits/virements reçus (ex: 2500.00)
                   - Format décimal avec point (ex: 16.62, pas 16,62)
                3. Libellé: nom du commerce/opération (sans la date)
                4. Extraire TOUTES les transactions (débits ET crédits)
                5. Retourner UNIQUEMENT le tableau JSON, aucun texte avant/après
                6. Si une ligne contient "CREDIT" ou "VIREMENT RECU", le montant est POSITIF

                JSON (sans markdown, sans explications):""".formatted(bankContext, source);
    }

	/**
	 * Validates every record of the reply independently.
	 *
	 * @param reply raw model output, possibly wrapped in a Markdown fence
	 * @return accepted transactions in reply order
	 * @throws JsonProcessingException when the array is not valid JSON
	 * @throws IllegalArgumentException when the reply holds no JSON array
	 */
    List<Transaction> parseReply(String reply) throws JsonProcessingException {
        String cleaned = reply == null ? "" : reply.replace("```json", "").replace("```", "").strip();
        Matcher array = JSON_ARRAY.matcher(cleaned);
        if (!array.find()) {
            throw new IllegalArgumentException("No JSON array in the language model reply.");
        }
        JsonNode items = objectMapper.readTree(array.group());
        if (!items.isArray()) {
            throw new IllegalArgumentException("Language model reply is not a JSON array.");
        }

        List<Transaction> accepted = new ArrayList<>();
        int rejected = 0;
        int index = 0;
        for (JsonNode item : items) {
            index++;
            Optional<Transaction> transaction = toTransaction(item, index);
            if (transaction.isPresent()) {
                accepted.add(transaction.get());
            } else {
                rejected++;
            }
        }
        log.info("LLM reply: {} records, {} accepted, {} rejected", items.size(), accepted.size(), rejected);
        return accepted;
    }

    private Optional<Transaction> toTransaction(JsonNode item, int index) {
        JsonNode date = item.get("date");
        JsonNode label = firstPresent(item, "libelle", "label");
        JsonNode amount = firstPresent(item, "montant", "amount");
        if (date == null || label == null || amount == null) {
            reject(index, "missing field", item);
            return Optional.empty();
        }

        Optional<LocalDate> occurredOn = StatementDates.parse(date.asText());
        if (occurredOn.isEmpty()) {
            reject(index, "invalid date '" + date.asText() + "'", item);
            return Optional.empty();
        }

        Optional<BigDecimal> value = toAmount(amount);
        if (value.isEmpty()) {
            reject(index, "invalid amount '" + amount.asText() + "'", item);
            return Optional.empty();
        }

        if (!label.isValueNode() || label.asText().isBlank()) {
            reject(index, "blank label", item);
            return Optional.empty();
        }
        return Optional.of(new Transaction(occurredOn.get(), label.asText(), value.get()));
    }

    private JsonNode firstPresent(JsonNode item, String name, String alias) {
        JsonNode node = item.get(name);
        if (node == null || node.isNull()) {
            node = item.get(alias);
        }
        return node == null || node.isNull() ? null : node;
    }

    private Optional<BigDecimal> toAmount(JsonNode amount) {
        if (amount.isNumber()) {
            return Optional.of(amount.decimalValue());
        }
        if (amount.isTextual()) {
            try {
                return Optional.of(new BigDecimal(amount.asText().strip()));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private void reject(int index, String reason, JsonNode item) {
        if (properties.debug()) {
            log.info("Record #{} rejected: {} {}", index, reason, item);
        } else {
            log.debug("Record #{} rejected: {}", index, reason);
        }
    }

    private static String preview(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= LOG_PREVIEW ? value : value.substring(0, LOG_PREVIEW) + "...";
    }
}
