package com.production.pdf_analysis.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchAnalysisResponse {

    private String jobId;
    private String status;
    private String message;
    private Integer filesSubmitted;
    private String outputDir;
}
