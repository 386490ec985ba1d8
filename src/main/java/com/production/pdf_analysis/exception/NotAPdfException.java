package com.production.pdf_analysis.exception;

public class NotAPdfException extends PdfAnalysisException {

    public NotAPdfException(String sourceName) {
        super(ErrorKind.NOT_A_PDF, "Provided content is not a PDF (missing %PDF header): " + sourceName);
    }
}
