package com.example.statements.infrastructure.llm;

/**
 * Prompt-to-text completion backend used by the language-model extraction tier.
 * Calls are blocking and attempted once.
 */
public interface LanguageModelClient {

    /**
     * @param prompt complete user instruction
     * @return raw model reply
     * @throws com.example.statements.infrastructure.exception.LanguageModelException on missing credentials,
     *                                                                               transport errors or empty replies
     */
    String complete(String prompt);
}
