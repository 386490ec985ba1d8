package com.production.pdf_analysis.exception;

import lombok.Getter;

import java.util.List;

/**
 * Every configured provider failed. Carries one entry per attempt in the order they
 * were made; the message names the last provider and its last error.
 */
@Getter
public class ProviderExhaustedException extends PdfAnalysisException {

    private final List<ProviderFailureException> failures;

    public ProviderExhaustedException(List<ProviderFailureException> failures) {
        super(ErrorKind.PROVIDER_EXHAUSTED, buildMessage(failures),
                failures.isEmpty() ? null : failures.get(failures.size() - 1));
        this.failures = List.copyOf(failures);
    }

    private static String buildMessage(List<ProviderFailureException> failures) {
        if (failures.isEmpty()) {
            return "No LLM providers configured. Set at least one API key.";
        }
        ProviderFailureException last = failures.get(failures.size() - 1);
        return "All LLM providers failed. Last error from " + last.getProviderName()
                + " (" + last.getFailureKind() + "): " + last.getMessage();
    }
}
