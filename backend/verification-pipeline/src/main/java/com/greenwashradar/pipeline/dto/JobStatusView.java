package com.greenwashradar.pipeline.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.greenwashradar.pipeline.entity.AnalysisJob;
import com.greenwashradar.pipeline.entity.AnalysisStage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusView {

    private String jobKey;
    private String jobId;
    private String companyCode;
    private Integer reportYear;
    private JobState state;
    private AnalysisStage stage;
    private String errorCode;
    private String message;
    private RiskSummary riskSummary;
    private LocalDateTime updatedAt;

    public static JobStatusView of(AnalysisJob job, JobState state, String message) {
        return JobStatusView.builder()
                .jobKey(job.getJobKey())
                .jobId(job.getId())
                .companyCode(job.getCompanyCode())
                .reportYear(job.getReportYear())
                .state(state)
                .stage(job.getStage())
                .message(message)
                .riskSummary(job.getArtifacts() != null ? job.getArtifacts().getRiskSummary() : null)
                .updatedAt(job.getUpdatedAt())
                .build();
    }

    public static JobStatusView notFound(JobKey key) {
        return JobStatusView.builder()
                .jobKey(key.asString())
                .companyCode(key.companyCode())
                .reportYear(key.reportYear())
                .state(JobState.NOT_FOUND)
                .message("No analysis exists for this company and year")
                .build();
    }
}
