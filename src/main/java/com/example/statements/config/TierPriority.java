package com.example.statements.config;

/**
 * Order in which the two parsing tiers are attempted once a statement is accepted.
 */
public enum TierPriority {
    /** Bank layout parsers first, language model as fallback. */
    LAYOUT_FIRST,
    /** Language model first, bank layout parsers as fallback. */
    LLM_FIRST
}
