package com.example.statements.application.service;

import com.example.statements.config.ExtractionProperties;
import com.example.statements.domain.model.ExtractedDocument;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a statement is an image-only scan whose text layer cannot be trusted.
 */
@Service
public class ScanDetector {

    private static final Logger log = LoggerFactory.getLogger(ScanDetector.class);

    private static final Pattern WORD = Pattern.compile("\\b[a-zA-ZÀ-ÿ]{3,}\\b");
    private static final List<String> BANKING_KEYWORDS = List.of(
            "BANQUE", "CREDIT", "COMPTE", "RELEVE", "TRANSACTION",
            "DEBIT", "CARTE", "PAIEMENT", "MONTANT", "DATE", "LCL");

    private final ExtractionProperties.Scan settings;

    public ScanDetector(ExtractionProperties properties) {
        this.settings = properties.scan();
    }

    /**
     * Samples the leading pages of the document.
     *
     * @param document extracted pages
     * @return {@code true} when the document looks scanned
     */
    public boolean isScanned(ExtractedDocument document) {
        return isScanned(document.firstPages(settings.samplePages()));
    }

    /**
     * Short-circuiting checks: too little text, too few words, then too few banking keywords.
     * Any unexpected failure answers "not scanned".
     *
     * @param text text to classify
     * @return {@code true} when the text looks like the residue of a scan
     */
    public boolean isScanned(String text) {
        try {
            String sample = text == null ? "" : text.strip();
            if (sample.length() < settings.minTextLength()) {
                log.info("Scan check: {} characters, treated as scanned", sample.length());
                return true;
            }

            int words = countWords(sample);
            if (words < settings.minWordCount()) {
                log.info("Scan check: {} words, treated as scanned", words);
                return true;
            }

            long keywordHits = keywordHits(sample);
            if (keywordHits >= settings.minKeywordHits()) {
                log.debug("Scan check: {} banking keywords, native text", keywordHits);
                return false;
            }
            log.info("Scan check: only {} banking keywords, treated as scanned", keywordHits);
            return true;
        } catch (RuntimeException ex) {
            log.warn("Scan check failed, assuming native text: {}", ex.getMessage());
            return false;
        }
    }

    private int countWords(String text) {
        Matcher matcher = WORD.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private long keywordHits(String text) {
        String upper = text.toUpperCase(Locale.ROOT);
        return BANKING_KEYWORDS.stream().filter(upper::contains).count();
    }
}
