package com.production.pdf_analysis.exception;

import lombok.Getter;

/**
 * A single provider call failed. The {@link ProviderFailureKind} is assigned where the
 * vendor error is first seen, so the router never inspects messages.
 */
@Getter
public class ProviderFailureException extends PdfAnalysisException {

    private final String providerName;
    private final ProviderFailureKind failureKind;

    public ProviderFailureException(String providerName, ProviderFailureKind failureKind, String message) {
        this(providerName, failureKind, message, null);
    }

    public ProviderFailureException(String providerName, ProviderFailureKind failureKind,
                                    String message, Throwable cause) {
        super(toErrorKind(failureKind), providerName + ": " + message, cause);
        this.providerName = providerName;
        this.failureKind = failureKind;
    }

    private static ErrorKind toErrorKind(ProviderFailureKind kind) {
        return switch (kind) {
            case AUTHENTICATION -> ErrorKind.PROVIDER_AUTH_FAILURE;
            case TRANSIENT -> ErrorKind.PROVIDER_TRANSIENT_FAILURE;
            default -> ErrorKind.PROVIDER_FAILURE;
        };
    }
}
