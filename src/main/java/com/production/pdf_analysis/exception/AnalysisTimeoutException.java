package com.production.pdf_analysis.exception;

public class AnalysisTimeoutException extends PdfAnalysisException {

    public AnalysisTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}
