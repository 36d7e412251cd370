package com.example.statements.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compatibility verdict for one statement text.
 *
 * @param compatible     {@code true} when a signature matched and the text is not a scan
 * @param bank           matched signature code or {@code null}
 * @param errorKind      failure category, {@code null} when compatible
 * @param message        user facing explanation
 * @param supportedBanks code to description map of every supported bank, in registry order
 */
public record ValidationResult(
        boolean compatible,
        String bank,
        ValidationErrorKind errorKind,
        String message,
        Map<String, String> supportedBanks
) {

    public ValidationResult {
        supportedBanks = supportedBanks == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(supportedBanks));
    }

    public static ValidationResult compatible(String bank, String description, Map<String, String> supportedBanks) {
        return new ValidationResult(true, bank, null,
                "Statement recognized as " + description + ".", supportedBanks);
    }

    public static ValidationResult incompatible(ValidationErrorKind errorKind, String message, Map<String, String> supportedBanks) {
        return new ValidationResult(false, null, errorKind, message, supportedBanks);
    }
}
