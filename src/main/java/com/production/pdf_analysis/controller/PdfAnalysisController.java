package com.production.pdf_analysis.controller;

import com.production.pdf_analysis.analysis.AnalysisOrchestrator;
import com.production.pdf_analysis.batch.BatchAnalysisJobService;
import com.production.pdf_analysis.batch.BatchAnalysisResponse;
import com.production.pdf_analysis.batch.JobStatus;
import com.production.pdf_analysis.exception.ExtractionFailureException;
import com.production.pdf_analysis.extract.PdfSource;
import com.production.pdf_analysis.model.AnalysisResult;
import com.production.pdf_analysis.model.CategoryDecision;
import com.production.pdf_analysis.model.ExtractedDocument;
import com.production.pdf_analysis.model.InternalMetadata;
import com.production.pdf_analysis.model.LlmMetadata;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * HTTP surface of the analysis pipeline. Synchronous endpoints block until the analysis
 * finishes or the timeout passes; batch runs return a jobId immediately.
 */
@RestController
@RequestMapping("/api/v1/analysis")
@Slf4j
public class PdfAnalysisController {

    private final AnalysisOrchestrator orchestrator;
    private final BatchAnalysisJobService batchJobService;

    public PdfAnalysisController(AnalysisOrchestrator orchestrator,
                                 BatchAnalysisJobService batchJobService) {
        this.orchestrator = orchestrator;
        this.batchJobService = batchJobService;
    }

    @PostMapping(value = "/pdf", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> analyzePdf(@RequestPart("file") MultipartFile file,
                                        @RequestParam(value = "timeoutSeconds", required = false) Integer timeoutSeconds) {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "Bad Request",
                    "kind", "INVALID_REQUEST",
                    "message", "File is empty: " + file.getOriginalFilename()
            ));
        }
        log.info("Analysis request: upload '{}' ({} bytes)", file.getOriginalFilename(), file.getSize());

        byte[] data;
        try {
            data = file.getBytes();
        } catch (IOException e) {
            throw new ExtractionFailureException("Failed to read uploaded file: " + e.getMessage(), e);
        }
        AnalysisResult result = orchestrator.analyzePdf(
                new PdfSource(data, file.getOriginalFilename()), timeout(timeoutSeconds));
        return ResponseEntity.ok(result);
    }

    @PostMapping("/url")
    public ResponseEntity<AnalysisResult> analyzeUrl(@Valid @RequestBody UrlRequest request) {
        log.info("Analysis request: url {}", request.getUrl());
        return ResponseEntity.ok(orchestrator.analyzePdfUrl(request.getUrl(), timeout(request.getTimeoutSeconds())));
    }

    @PostMapping("/extract")
    public ResponseEntity<ExtractedDocument> extract(@Valid @RequestBody ExtractRequest request) {
        Duration timeout = timeout(request.getTimeoutSeconds());
        ExtractedDocument document = request.getPath() != null && !request.getPath().isBlank()
                ? orchestrator.extract(Paths.get(request.getPath()), timeout)
                : orchestrator.extract(request.getUrl().trim(), timeout);
        return ResponseEntity.ok(document);
    }

    @PostMapping("/text")
    public ResponseEntity<AnalysisResult> analyzeText(@Valid @RequestBody TextAnalysisRequest request) {
        LlmMetadata meta = request.getMeta() != null ? request.getMeta() : LlmMetadata.empty();
        return ResponseEntity.ok(orchestrator.analyze(request.getText(), meta,
                InternalMetadata.empty(), timeout(request.getTimeoutSeconds())));
    }

    @PostMapping("/category")
    public ResponseEntity<CategoryDecision> classify(@Valid @RequestBody CategoryRequest request) {
        return ResponseEntity.ok(orchestrator.classifyOrCreateCategory(request.getText(), request.getMeta(),
                request.getExistingCategories() != null ? request.getExistingCategories() : List.of(),
                timeout(request.getTimeoutSeconds())));
    }

    @PostMapping("/category/define")
    public ResponseEntity<CategoryDecision> defineCategory(@Valid @RequestBody CategoryRequest request) {
        return ResponseEntity.ok(orchestrator.defineCategory(request.getText(), request.getMeta(),
                timeout(request.getTimeoutSeconds())));
    }

    @PostMapping("/batch")
    public ResponseEntity<BatchAnalysisResponse> startBatch(@Valid @RequestBody LocalDirectoryRequest request) {
        Path dirPath = Paths.get(request.getDirectory());

        if (!Files.isDirectory(dirPath)) {
            return ResponseEntity.badRequest()
                    .body(BatchAnalysisResponse.builder()
                            .status(JobStatus.FAILED)
                            .message("Directory does not exist: " + request.getDirectory())
                            .build());
        }

        List<Path> pdfFiles;
        try {
            pdfFiles = BatchAnalysisJobService.listPdfs(dirPath);
        } catch (IOException e) {
            log.error("Failed to list directory: {}", request.getDirectory(), e);
            return ResponseEntity.internalServerError()
                    .body(BatchAnalysisResponse.builder()
                            .status(JobStatus.FAILED)
                            .message("Failed to read directory: " + e.getMessage())
                            .build());
        }

        if (pdfFiles.isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(BatchAnalysisResponse.builder()
                            .status(JobStatus.FAILED)
                            .message("No PDF files found in: " + request.getDirectory())
                            .build());
        }

        String jobId = batchJobService.startJob(pdfFiles);
        JobStatus status = batchJobService.getJobStatus(jobId);
        log.info("Batch job {} submitted: {} PDF(s) in {}", jobId, pdfFiles.size(), request.getDirectory());

        return ResponseEntity.accepted()
                .body(BatchAnalysisResponse.builder()
                        .jobId(jobId)
                        .status(JobStatus.PROCESSING)
                        .message(pdfFiles.size() + " file(s) submitted for analysis")
                        .filesSubmitted(pdfFiles.size())
                        .outputDir(status != null ? status.getOutputDir() : null)
                        .build());
    }

    @GetMapping("/batch/status/{jobId}")
    public ResponseEntity<?> getJobStatus(@PathVariable String jobId) {
        JobStatus status = batchJobService.getJobStatus(jobId);

        if (status == null) {
            return ResponseEntity.status(404).body(Map.of(
                    "error", "Job not found",
                    "jobId", jobId
            ));
        }

        return ResponseEntity.ok(status);
    }

    @GetMapping("/providers")
    public ResponseEntity<Map<String, Object>> providers() {
        return ResponseEntity.ok(Map.of("providers", orchestrator.providerNames()));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    private Duration timeout(Integer seconds) {
        return seconds != null && seconds > 0 ? Duration.ofSeconds(seconds) : orchestrator.defaultTimeout();
    }
}
