package com.production.pdf_analysis.controller;

import com.production.pdf_analysis.analysis.AnalysisOrchestrator;
import com.production.pdf_analysis.analysis.HeuristicAnalyzer;
import com.production.pdf_analysis.batch.BatchAnalysisJobService;
import com.production.pdf_analysis.batch.JobStatus;
import com.production.pdf_analysis.config.AppConfig;
import com.production.pdf_analysis.exception.AnalysisTimeoutException;
import com.production.pdf_analysis.exception.DownloadFailureException;
import com.production.pdf_analysis.exception.NotAPdfException;
import com.production.pdf_analysis.model.CategoryDecision;
import com.production.pdf_analysis.model.LlmMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PdfAnalysisControllerTest {

    private static final String BASE = "/api/v1/analysis";

    @TempDir
    Path tempDir;

    private final AnalysisOrchestrator orchestrator = mock(AnalysisOrchestrator.class);
    private final BatchAnalysisJobService batchJobService = mock(BatchAnalysisJobService.class);
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        when(orchestrator.defaultTimeout()).thenReturn(Duration.ofSeconds(60));
        mockMvc = MockMvcBuilders.standaloneSetup(new PdfAnalysisController(orchestrator, batchJobService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void uploadedPdfIsAnalyzed() throws Exception {
        when(orchestrator.analyzePdf(any(), any())).thenReturn(new HeuristicAnalyzer(new AppConfig())
                .analyze("text", LlmMetadata.builder().langHint("en").build(), null));

        mockMvc.perform(multipart(BASE + "/pdf")
                        .file(new MockMultipartFile("file", "a.pdf", "application/pdf", "%PDF-1.7".getBytes())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.doc_language").value("en"))
                .andExpect(jsonPath("$.complexity.level").value("low"));
    }

    @Test
    void emptyUploadIsRejected() throws Exception {
        mockMvc.perform(multipart(BASE + "/pdf")
                        .file(new MockMultipartFile("file", "a.pdf", "application/pdf", new byte[0])))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_REQUEST"));
        verify(orchestrator, never()).analyzePdf(any(), any());
    }

    @Test
    void notAPdfMapsTo415() throws Exception {
        when(orchestrator.analyzePdf(any(), any())).thenThrow(new NotAPdfException("a.txt"));

        mockMvc.perform(multipart(BASE + "/pdf")
                        .file(new MockMultipartFile("file", "a.txt", "text/plain", "hello".getBytes())))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.kind").value("NOT_A_PDF"));
    }

    @Test
    void downloadFailureMapsTo502() throws Exception {
        when(orchestrator.analyzePdfUrl(eq("https://example.test/a.pdf"), any()))
                .thenThrow(new DownloadFailureException("HTTP 404", 404));

        mockMvc.perform(post(BASE + "/url")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\":\"https://example.test/a.pdf\",\"timeoutSeconds\":5}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.kind").value("DOWNLOAD_FAILURE"))
                .andExpect(jsonPath("$.message").value(containsString("404")));
        verify(orchestrator).analyzePdfUrl("https://example.test/a.pdf", Duration.ofSeconds(5));
    }

    @Test
    void timeoutMapsTo504() throws Exception {
        when(orchestrator.analyze(anyString(), any(), any(), any()))
                .thenThrow(new AnalysisTimeoutException("Analysis timed out after 1s", null));

        mockMvc.perform(post(BASE + "/text")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"hello\",\"timeoutSeconds\":1}"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.kind").value("TIMEOUT"));
    }

    @Test
    void missingUrlIsAValidationError() throws Exception {
        mockMvc.perform(post(BASE + "/url")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_REQUEST"));
    }

    @Test
    void extractNeedsExactlyOneSource() throws Exception {
        mockMvc.perform(post(BASE + "/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"/tmp/a.pdf\",\"url\":\"https://example.test/a.pdf\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_REQUEST"));
    }

    @Test
    void categoryDecisionIsReturned() throws Exception {
        when(orchestrator.classifyOrCreateCategory(anyString(), any(), anyList(), any()))
                .thenReturn(CategoryDecision.neutral());

        mockMvc.perform(post(BASE + "/category")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"hello\",\"existingCategories\":[{\"label\":\"Finance\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.decision").value("created_new"))
                .andExpect(jsonPath("$.new_category_def.label").value("uncategorized"));
    }

    @Test
    void batchOverMissingDirectoryIsRejected() throws Exception {
        mockMvc.perform(post(BASE + "/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"directory\":\"" + tempDir.resolve("missing") + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(JobStatus.FAILED));
    }

    @Test
    void batchWithoutPdfsIsRejected() throws Exception {
        Files.write(tempDir.resolve("notes.txt"), new byte[]{1});

        mockMvc.perform(post(BASE + "/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"directory\":\"" + tempDir + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("No PDF files")));
    }

    @Test
    void batchIsAccepted() throws Exception {
        Files.write(tempDir.resolve("a.pdf"), new byte[]{1});
        Files.write(tempDir.resolve("b.pdf"), new byte[]{1});
        when(batchJobService.startJob(anyList())).thenReturn("job_abc");
        when(batchJobService.getJobStatus("job_abc")).thenReturn(new JobStatus("job_abc", 2, "/srv/out"));

        mockMvc.perform(post(BASE + "/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"directory\":\"" + tempDir + "\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value("job_abc"))
                .andExpect(jsonPath("$.status").value(JobStatus.PROCESSING))
                .andExpect(jsonPath("$.filesSubmitted").value(2))
                .andExpect(jsonPath("$.outputDir").value("/srv/out"));
    }

    @Test
    void unknownJobIs404() throws Exception {
        mockMvc.perform(get(BASE + "/batch/status/job_missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.jobId").value("job_missing"));
    }

    @Test
    void jobStatusIsReported() throws Exception {
        JobStatus jobStatus = new JobStatus("job_abc", 3, "/srv/out");
        jobStatus.documentSucceeded();
        when(batchJobService.getJobStatus("job_abc")).thenReturn(jobStatus);

        mockMvc.perform(get(BASE + "/batch/status/job_abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value(JobStatus.PROCESSING))
                .andExpect(jsonPath("$.documentsProcessed").value(1))
                .andExpect(jsonPath("$.totalFiles").value(3));
    }

    @Test
    void providersAndHealth() throws Exception {
        when(orchestrator.providerNames()).thenReturn(List.of("gemini", "gigachat"));

        mockMvc.perform(get(BASE + "/providers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.providers[0]").value("gemini"))
                .andExpect(jsonPath("$.providers[1]").value("gigachat"));
        mockMvc.perform(get(BASE + "/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
