package com.production.pdf_analysis.exception;

public enum ErrorKind {
    NOT_A_PDF,
    DOWNLOAD_FAILURE,
    EXTRACTION_FAILURE,
    PROVIDER_AUTH_FAILURE,
    PROVIDER_TRANSIENT_FAILURE,
    PROVIDER_FAILURE,
    PROVIDER_EXHAUSTED,
    RESPONSE_UNPARSEABLE,
    SCHEMA_VIOLATION,
    TIMEOUT
}
