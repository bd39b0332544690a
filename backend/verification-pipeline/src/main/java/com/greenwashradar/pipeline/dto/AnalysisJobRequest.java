package com.greenwashradar.pipeline.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to analyse one company's report for one year.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisJobRequest {

    @NotBlank
    private String companyCode;

    @NotNull
    @Min(2000)
    @Max(2100)
    private Integer reportYear;

    @NotBlank
    private String companyName;

    private String industry;

    /** Company website domain, excluded when repairing evidence links. */
    private String companyDomain;

    /** Re-run even when a completed analysis exists. */
    private boolean force;

    public JobKey toKey() {
        return new JobKey(companyCode.trim(), reportYear);
    }
}
