package com.production.pdf_analysis.controller;

import com.production.pdf_analysis.exception.AnalysisTimeoutException;
import com.production.pdf_analysis.exception.DownloadFailureException;
import com.production.pdf_analysis.exception.ExtractionFailureException;
import com.production.pdf_analysis.exception.NotAPdfException;
import com.production.pdf_analysis.exception.PdfAnalysisException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the analysis error taxonomy onto HTTP statuses with a JSON body
 * {@code {error, kind, message}}.
 */
@RestControllerAdvice(annotations = RestController.class)
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(PdfAnalysisException.class)
    public ResponseEntity<Map<String, Object>> handleAnalysisFailure(PdfAnalysisException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("Request failed ({}): {}", ex.getKind(), ex.getMessage());
        } else {
            log.warn("Request rejected ({}): {}", ex.getKind(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(body(status, ex.getKind().name(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message));
    }

    static HttpStatus statusFor(PdfAnalysisException ex) {
        if (ex instanceof NotAPdfException) {
            return HttpStatus.UNSUPPORTED_MEDIA_TYPE;
        }
        if (ex instanceof DownloadFailureException) {
            return HttpStatus.BAD_GATEWAY;
        }
        if (ex instanceof ExtractionFailureException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (ex instanceof AnalysisTimeoutException) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static Map<String, Object> body(HttpStatus status, String kind, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", status.getReasonPhrase());
        body.put("kind", kind);
        body.put("message", message != null ? message : "");
        return body;
    }
}
