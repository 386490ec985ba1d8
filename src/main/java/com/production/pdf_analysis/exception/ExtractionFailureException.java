package com.production.pdf_analysis.exception;

public class ExtractionFailureException extends PdfAnalysisException {

    public ExtractionFailureException(String message) {
        super(ErrorKind.EXTRACTION_FAILURE, message);
    }

    public ExtractionFailureException(String message, Throwable cause) {
        super(ErrorKind.EXTRACTION_FAILURE, message, cause);
    }
}
