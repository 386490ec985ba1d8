package com.production.pdf_analysis.exception;

public class ProviderAuthFailureException extends ProviderFailureException {

    public ProviderAuthFailureException(String providerName, String message, Throwable cause) {
        super(providerName, ProviderFailureKind.AUTHENTICATION, message, cause);
    }
}
