package com.production.pdf_analysis.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.production.pdf_analysis.analysis.AnalysisOrchestrator;
import com.production.pdf_analysis.config.AppConfig;
import com.production.pdf_analysis.model.AnalysisResult;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

/**
 * Analyzes every PDF of a local directory in the background.
 *
 * Each job runs on the batch executor and fans documents out to a pool of
 * {@code batch.concurrency} workers. Every successful analysis is written to
 * {@code <output-dir>/<stem>.json}; a failed document is logged and counted, never fatal to the job.
 */
@Service
@Slf4j
public class BatchAnalysisJobService {

    private final ConcurrentHashMap<String, JobStatus> jobs = new ConcurrentHashMap<>();
    private final AnalysisOrchestrator orchestrator;
    private final AppConfig appConfig;
    private final Executor batchExecutor;
    private final ObjectMapper objectMapper;
    private final ExecutorService documentPool;

    public BatchAnalysisJobService(AnalysisOrchestrator orchestrator,
                                   AppConfig appConfig,
                                   ObjectMapper objectMapper,
                                   @Qualifier("batchExecutor") Executor batchExecutor) {
        this.orchestrator = orchestrator;
        this.appConfig = appConfig;
        this.batchExecutor = batchExecutor;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.documentPool = Executors.newFixedThreadPool(Math.max(1, appConfig.getBatch().getConcurrency()));
    }

    @PreDestroy
    public void shutdown() {
        documentPool.shutdownNow();
    }

    /**
     * Sorted regular {@code *.pdf} files (case-insensitive) directly inside {@code directory}.
     */
    public static List<Path> listPdfs(Path directory) throws IOException {
        try (Stream<Path> stream = Files.list(directory)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
                    .sorted()
                    .toList();
        }
    }

    /**
     * Starts an async batch job over {@code files}. Returns the jobId immediately.
     */
    public String startJob(List<Path> files) {
        String jobId = "job_" + UUID.randomUUID().toString().substring(0, 12);
        Path outputDir = Paths.get(appConfig.getBatch().getOutputDir()).toAbsolutePath();
        JobStatus status = new JobStatus(jobId, files.size(), outputDir.toString());
        jobs.put(jobId, status);

        log.info("[{}] Batch job created: {} files queued, output {}", jobId, files.size(), outputDir);

        batchExecutor.execute(() -> processJob(jobId, files, outputDir));

        return jobId;
    }

    public JobStatus getJobStatus(String jobId) {
        return jobs.get(jobId);
    }

    void processJob(String jobId, List<Path> files, Path outputDir) {
        JobStatus status = jobs.get(jobId);
        int totalFiles = files.size();
        long jobStartTime = System.currentTimeMillis();
        int progressInterval = Math.max(1, Math.min(totalFiles / 10, 10));
        Duration timeout = orchestrator.defaultTimeout();

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            log.error("[{}] Cannot create output directory {}: {}", jobId, outputDir, e.getMessage());
            status.fail("Cannot create output directory: " + e.getMessage());
            return;
        }

        List<Future<?>> futures = new ArrayList<>();
        for (Path file : files) {
            futures.add(documentPool.submit(() -> {
                processSinglePdf(jobId, file, outputDir, timeout, status);
                logProgress(jobId, status, progressInterval, totalFiles, jobStartTime);
            }));
        }

        try {
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status.fail("Interrupted");
            return;
        } catch (ExecutionException e) {
            log.error("[{}] Error waiting for document analysis: {}", jobId, e.getMessage(), e);
            status.fail(e.getMessage());
            return;
        }

        status.complete();
        long totalTime = System.currentTimeMillis() - jobStartTime;
        log.info("[{}] Job completed: OK={}, FAIL={}, {}s. JSON saved to {}",
                jobId, status.getDocumentsProcessed(), status.getDocumentsFailed(),
                String.format("%.1f", totalTime / 1000.0), outputDir);
    }

    private void processSinglePdf(String jobId, Path file, Path outputDir, Duration timeout, JobStatus status) {
        try {
            AnalysisResult result = orchestrator.analyzePdfPath(file, timeout);
            Path target = outputDir.resolve(stemOf(file) + ".json");
            objectMapper.writeValue(target.toFile(), result);
            status.documentSucceeded();
            log.info("[{}] {}", jobId, summaryLine(file, result));
        } catch (IOException e) {
            status.documentFailed();
            log.error("[{}] [FAIL] {}: cannot write result: {}", jobId, file, e.getMessage());
        } catch (RuntimeException e) {
            status.documentFailed();
            log.error("[{}] [FAIL] {}: {}", jobId, file, e.getMessage());
        }
    }

    private void logProgress(String jobId, JobStatus status, int progressInterval, int totalFiles, long jobStartTime) {
        int failed = status.getDocumentsFailed();
        int done = status.getDocumentsProcessed() + failed;
        if (done % progressInterval == 0 || done == totalFiles) {
            long elapsed = Math.max(1, System.currentTimeMillis() - jobStartTime);
            log.info("[{}] Progress: {}/{} files, {} files/sec{}",
                    jobId, done, totalFiles, String.format("%.2f", done * 1000.0 / elapsed),
                    failed > 0 ? ", " + failed + " failed" : "");
        }
    }

    /** One-line summary of an analysis, e.g. for batch logs. */
    static String summaryLine(Path file, AnalysisResult r) {
        return String.format(Locale.ROOT,
                "[OK] %s | lang=%s pages=%s words=%d t=%sm | complexity=%s(%d) | category=%s(%s) basis=%s",
                file, r.docLanguage(),
                r.volume().pageCount(), r.volume().wordCount(), r.volume().readingTimeMin(),
                r.complexity().level().getWireValue(), r.complexity().score(),
                r.category().label(), r.category().score(), r.category().basis());
    }

    static String stemOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
