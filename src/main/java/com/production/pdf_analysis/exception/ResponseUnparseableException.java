package com.production.pdf_analysis.exception;

public class ResponseUnparseableException extends PdfAnalysisException {

    public ResponseUnparseableException(String message) {
        super(ErrorKind.RESPONSE_UNPARSEABLE, message);
    }
}
