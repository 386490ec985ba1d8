package com.production.pdf_analysis.exception;

import lombok.Getter;

/**
 * Root of the analysis error taxonomy. Every failure that crosses a component
 * boundary is one of its subclasses, so callers can switch on {@link #getKind()}
 * instead of matching messages.
 */
@Getter
public abstract class PdfAnalysisException extends RuntimeException {

    private final ErrorKind kind;

    protected PdfAnalysisException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PdfAnalysisException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
