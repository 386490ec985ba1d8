package com.production.pdf_analysis.llm;

import com.production.pdf_analysis.exception.ProviderFailureException;

/**
 * One configured language-model service. Implementations classify their own failures so
 * the router can decide between retry and failover without inspecting messages.
 */
public interface LlmProvider {

    String name();

    /**
     * Sends one chat completion.
     *
     * @param systemPrompt may be {@code null}
     * @return the assistant text, never blank
     * @throws ProviderFailureException on any failure, including an empty answer
     */
    String generate(String prompt, String systemPrompt);
}
