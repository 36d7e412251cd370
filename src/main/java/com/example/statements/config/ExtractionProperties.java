package com.example.statements.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration of the extraction pipeline, bound from {@code statement.extraction.*}.
 * Missing or non-positive values fall back to the defaults below so components can be built from
 * {@link #defaults()} in tests.
 *
 * @param debug             promotes prompt, reply and rejection details to INFO logs
 * @param minimumTextLength below this many characters (after OCR) a document is unreadable
 * @param defaultYear       year given to statements whose lines carry no year; {@code null} means the current year
 * @param tierPriority      which parsing tier runs first
 * @param scan              scan detector thresholds
 * @param ocr               optical recognition settings
 * @param llm               language model settings
 */
@ConfigurationProperties(prefix = "statement.extraction")
public record ExtractionProperties(
        boolean debug,
        int minimumTextLength,
        Integer defaultYear,
        TierPriority tierPriority,
        Scan scan,
        Ocr ocr,
        Llm llm
) {

    public ExtractionProperties {
        minimumTextLength = minimumTextLength > 0 ? minimumTextLength : 50;
        tierPriority = tierPriority == null ? TierPriority.LAYOUT_FIRST : tierPriority;
        scan = scan == null ? Scan.defaults() : scan;
        ocr = ocr == null ? Ocr.defaults() : ocr;
        llm = llm == null ? Llm.defaults() : llm;
    }

    public static ExtractionProperties defaults() {
        return new ExtractionProperties(false, 0, null, null, null, null, null);
    }

    public ExtractionProperties withDefaultYear(Integer year) {
        return new ExtractionProperties(debug, minimumTextLength, year, tierPriority, scan, ocr, llm);
    }

    public ExtractionProperties withTierPriority(TierPriority priority) {
        return new ExtractionProperties(debug, minimumTextLength, defaultYear, priority, scan, ocr, llm);
    }

    /**
     * @param minTextLength  fewer characters in the sampled pages means scanned
     * @param minWordCount   fewer alphabetic words means scanned
     * @param minKeywordHits distinct banking keywords needed to call a document native
     * @param samplePages    number of leading pages sampled
     */
    public record Scan(int minTextLength, int minWordCount, int minKeywordHits, int samplePages) {

        public Scan {
            minTextLength = minTextLength > 0 ? minTextLength : 200;
            minWordCount = minWordCount > 0 ? minWordCount : 50;
            minKeywordHits = minKeywordHits > 0 ? minKeywordHits : 2;
            samplePages = samplePages > 0 ? samplePages : 3;
        }

        public static Scan defaults() {
            return new Scan(0, 0, 0, 0);
        }
    }

    /**
     * @param triggerLength native text shorter than this triggers OCR even for non-scanned documents
     * @param dpi           rasterization resolution
     * @param language      Tesseract language model
     * @param pageSegMode   Tesseract page segmentation mode, 6 is "uniform block of text"
     * @param dataPath      tessdata directory, {@code null} to use {@code TESSDATA_PREFIX}
     */
    public record Ocr(int triggerLength, int dpi, String language, int pageSegMode, String dataPath) {

        public Ocr {
            triggerLength = triggerLength > 0 ? triggerLength : 100;
            dpi = dpi > 0 ? dpi : 300;
            language = language == null || language.isBlank() ? "fra" : language;
            pageSegMode = pageSegMode > 0 ? pageSegMode : 6;
            dataPath = dataPath == null || dataPath.isBlank() ? null : dataPath;
        }

        public static Ocr defaults() {
            return new Ocr(0, 0, null, 0, null);
        }
    }

    /**
     * @param baseUrl       chat completion API root
     * @param apiKey        bearer token, blank disables the tier
     * @param model         model name
     * @param maxInputChars statement characters submitted per request
     * @param temperature   sampling temperature, {@code null} for the default; 0 is allowed
     * @param maxTokens     reply token limit
     */
    public record Llm(String baseUrl, String apiKey, String model, int maxInputChars, Double temperature, int maxTokens) {

        public Llm {
            baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.mistral.ai" : baseUrl;
            model = model == null || model.isBlank() ? "mistral-small-latest" : model;
            maxInputChars = maxInputChars > 0 ? maxInputChars : 8000;
            temperature = temperature == null || temperature < 0 ? Double.valueOf(0.1) : temperature;
            maxTokens = maxTokens > 0 ? maxTokens : 4000;
        }

        public static Llm defaults() {
            return new Llm(null, null, null, 0, null, 0);
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
