package com.production.pdf_analysis.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatus {

    public static final String PROCESSING = "PROCESSING";
    public static final String COMPLETED = "COMPLETED";
    public static final String FAILED = "FAILED";

    private final String jobId;
    private volatile String status;
    private final AtomicInteger documentsProcessed = new AtomicInteger(0);
    private final AtomicInteger documentsFailed = new AtomicInteger(0);
    private final String outputDir;
    private final Instant startTime;
    private volatile Instant endTime;
    private volatile String errorMessage;
    private final int totalFiles;

    public JobStatus(String jobId, int totalFiles, String outputDir) {
        this.jobId = jobId;
        this.totalFiles = totalFiles;
        this.outputDir = outputDir;
        this.status = PROCESSING;
        this.startTime = Instant.now();
    }

    public void documentSucceeded() {
        documentsProcessed.incrementAndGet();
    }

    public void documentFailed() {
        documentsFailed.incrementAndGet();
    }

    public void complete() {
        this.status = COMPLETED;
        this.endTime = Instant.now();
    }

    public void fail(String errorMessage) {
        this.errorMessage = errorMessage;
        this.status = FAILED;
        this.endTime = Instant.now();
    }

    // Custom getters for AtomicInteger fields (Jackson serialization)
    public int getDocumentsProcessed() {
        return documentsProcessed.get();
    }

    public int getDocumentsFailed() {
        return documentsFailed.get();
    }
}
