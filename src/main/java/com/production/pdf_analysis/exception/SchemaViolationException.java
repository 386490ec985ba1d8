package com.production.pdf_analysis.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class SchemaViolationException extends PdfAnalysisException {

    private final List<String> violations;

    public SchemaViolationException(String message, List<String> violations) {
        super(ErrorKind.SCHEMA_VIOLATION, message + ": " + violations);
        this.violations = List.copyOf(violations);
    }
}
