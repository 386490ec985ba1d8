package com.production.pdf_analysis.exception;

public class ProviderTransientFailureException extends ProviderFailureException {

    public ProviderTransientFailureException(String providerName, String message, Throwable cause) {
        super(providerName, ProviderFailureKind.TRANSIENT, message, cause);
    }
}
