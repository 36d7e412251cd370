package com.example.statements.domain.model;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword signature of a supported statement issuer.
 * Instances are immutable and shared by every request once the registry is loaded.
 *
 * @param code        short identifier reported to callers (for example {@code LCL})
 * @param description human readable bank name
 * @param keywords    case-insensitive markers looked up in the statement text
 * @param layoutKind  parser convention for this bank's statements
 */
public record BankSignature(
        String code,
        String description,
        Set<String> keywords,
        LayoutKind layoutKind
) {

    public BankSignature {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Bank signature code is required.");
        }
        if (layoutKind == null) {
            throw new IllegalArgumentException("Bank signature " + code + " has no layout kind.");
        }
        keywords = keywords == null ? Set.of() : Set.copyOf(keywords);
        description = description == null ? code : description;
    }

    /**
     * Lists the keywords contained in the given text.
     *
     * @param upperText statement text already upper-cased with {@link Locale#ROOT}
     * @return matched keywords, empty when the signature does not apply
     */
    public List<String> matchedKeywords(String upperText) {
        if (upperText == null || upperText.isEmpty()) {
            return List.of();
        }
        return keywords.stream()
                .filter(keyword -> upperText.contains(keyword.toUpperCase(Locale.ROOT)))
                .sorted()
                .toList();
    }

    public boolean matches(String upperText) {
        return !matchedKeywords(upperText).isEmpty();
    }
}
