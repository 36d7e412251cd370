package com.example.statements.domain.model;

/**
 * Tier that produced the committed transaction list.
 */
public enum ExtractionMethod {
    NATIVE_REGEX,
    OCR_REGEX,
    LLM
}
