package com.production.pdf_analysis.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.production.pdf_analysis.analysis.AnalysisOrchestrator;
import com.production.pdf_analysis.analysis.HeuristicAnalyzer;
import com.production.pdf_analysis.config.AppConfig;
import com.production.pdf_analysis.exception.ExtractionFailureException;
import com.production.pdf_analysis.model.AnalysisResult;
import com.production.pdf_analysis.model.LlmMetadata;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BatchAnalysisJobServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AppConfig appConfig = new AppConfig();
    private final AnalysisOrchestrator orchestrator = mock(AnalysisOrchestrator.class);
    private BatchAnalysisJobService service;

    @BeforeEach
    void setUp() {
        appConfig.getBatch().setOutputDir(tempDir.resolve("out").toString());
        when(orchestrator.defaultTimeout()).thenReturn(Duration.ofSeconds(5));
        service = new BatchAnalysisJobService(orchestrator, appConfig, objectMapper, Runnable::run);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void jobWritesOneJsonPerDocumentAndCountsFailures() throws Exception {
        Path good = Files.write(tempDir.resolve("report.pdf"), new byte[]{1});
        Path bad = Files.write(tempDir.resolve("broken.pdf"), new byte[]{2});
        when(orchestrator.analyzePdfPath(eq(good), any())).thenReturn(sampleResult());
        when(orchestrator.analyzePdfPath(eq(bad), any())).thenThrow(new ExtractionFailureException("damaged"));

        String jobId = service.startJob(List.of(good, bad));

        JobStatus status = service.getJobStatus(jobId);
        assertThat(jobId).startsWith("job_");
        assertThat(status.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(status.getDocumentsProcessed()).isEqualTo(1);
        assertThat(status.getDocumentsFailed()).isEqualTo(1);
        assertThat(status.getTotalFiles()).isEqualTo(2);
        assertThat(status.getEndTime()).isNotNull();

        Path written = tempDir.resolve("out").resolve("report.json");
        assertThat(written).exists();
        assertThat(tempDir.resolve("out").resolve("broken.json")).doesNotExist();
        JsonNode json = objectMapper.readTree(written.toFile());
        assertThat(json.path("doc_language").asText()).isEqualTo("en");
        assertThat(json.path("volume").path("word_count").asInt()).isEqualTo(900);
    }

    @Test
    void unwritableOutputDirectoryFailsTheJob() throws Exception {
        Path blocker = Files.write(tempDir.resolve("blocker"), new byte[]{0});
        appConfig.getBatch().setOutputDir(blocker.resolve("out").toString());

        String jobId = service.startJob(List.of(tempDir.resolve("a.pdf")));

        JobStatus status = service.getJobStatus(jobId);
        assertThat(status.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(status.getErrorMessage()).startsWith("Cannot create output directory");
    }

    @Test
    void unknownJobHasNoStatus() {
        assertThat(service.getJobStatus("job_missing")).isNull();
    }

    @Test
    void listPdfsIsSortedAndCaseInsensitive() throws Exception {
        Files.write(tempDir.resolve("b.PDF"), new byte[]{1});
        Files.write(tempDir.resolve("a.pdf"), new byte[]{1});
        Files.write(tempDir.resolve("notes.txt"), new byte[]{1});
        Files.createDirectories(tempDir.resolve("nested.pdf"));

        assertThat(BatchAnalysisJobService.listPdfs(tempDir))
                .extracting(p -> p.getFileName().toString())
                .containsExactly("a.pdf", "b.PDF");
    }

    @Test
    void summaryLineListsTheKeyFigures() {
        String line = BatchAnalysisJobService.summaryLine(Paths.get("docs/finance_q3.pdf"), sampleResult());

        assertThat(line).isEqualTo("[OK] docs/finance_q3.pdf | lang=en pages=3 words=900 t=4.5m"
                + " | complexity=medium(40) | category=Business(0.6) basis=filename");
    }

    @Test
    void stemDropsOnlyTheLastExtension() {
        assertThat(BatchAnalysisJobService.stemOf(Paths.get("dir/paper.v2.pdf"))).isEqualTo("paper.v2");
        assertThat(BatchAnalysisJobService.stemOf(Paths.get(".hidden"))).isEqualTo(".hidden");
    }

    private AnalysisResult sampleResult() {
        LlmMetadata meta = LlmMetadata.builder()
                .precomputedWordCount(900)
                .pageCount(3)
                .langHint("en")
                .sourceName("finance_q3.pdf")
                .build();
        return new HeuristicAnalyzer(appConfig).analyze("word ".repeat(200), meta, null);
    }
}
