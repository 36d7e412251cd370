package com.example.statements.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Troubleshooting view of a single PDF: what was extracted and how it was classified.
 */
public record StatementDiagnostics(
        long fileSizeBytes,
        int pageCount,
        boolean scanned,
        String extractionMethod,
        int textLength,
        String textPreview,
        String bankDetected,
        Map<String, List<String>> keywordsFound,
        ValidationResult validation,
        int lineCount,
        List<String> firstLines
) {
}
