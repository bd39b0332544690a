package com.greenwashradar.pipeline.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.greenwashradar.pipeline.dto.JobArtifacts;
import com.greenwashradar.pipeline.dto.JobKey;
import com.greenwashradar.pipeline.dto.PipelineFailure;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One (company code, reporting year) unit of pipeline work.
 * The row doubles as the checkpoint: the stage column is only ever moved forward
 * through {@link com.greenwashradar.pipeline.checkpoint.CheckpointStore#compareAndAdvance}.
 */
@Entity
@Table(name = "analysis_jobs", indexes = {
        @Index(name = "idx_analysis_jobs_job_key", columnList = "job_key"),
        @Index(name = "idx_analysis_jobs_archived", columnList = "archived, archived_at")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisJob {

    @Id
    @Column(name = "job_id", length = 64)
    private String id;

    @Column(name = "job_key", nullable = false, length = 64)
    private String jobKey;

    @Column(name = "company_code", nullable = false, length = 32)
    private String companyCode;

    @Column(name = "report_year", nullable = false)
    private int reportYear;

    @Column(name = "company_name", nullable = false, length = 256)
    private String companyName;

    @Column(length = 128)
    private String industry;

    @Column(name = "company_domain", length = 256)
    private String companyDomain;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private AnalysisStage stage = AnalysisStage.FETCHING;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    @Builder.Default
    private JobArtifacts artifacts = new JobArtifacts();

    @Column(nullable = false)
    private boolean archived;

    @Column(name = "archived_at")
    private LocalDateTime archivedAt;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    /**
     * Failure of the last advance attempt. Never persisted.
     */
    @Transient
    @JsonIgnore
    private PipelineFailure lastFailure;

    public static AnalysisJob create(JobKey key, String companyName, String industry, String companyDomain) {
        LocalDateTime now = LocalDateTime.now();
        return AnalysisJob.builder()
                .id(generateJobId())
                .jobKey(key.asString())
                .companyCode(key.companyCode())
                .reportYear(key.reportYear())
                .companyName(companyName)
                .industry(industry)
                .companyDomain(companyDomain)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    @JsonIgnore
    public JobKey getKey() {
        return new JobKey(companyCode, reportYear);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return stage != null && stage.isTerminal();
    }

    @JsonIgnore
    public boolean hasFailure() {
        return lastFailure != null;
    }

    /**
     * Copy of this job carrying the given failure; the receiver is left untouched.
     */
    public AnalysisJob withFailure(PipelineFailure failure) {
        return toBuilder().lastFailure(failure).build();
    }

    public void markArchived() {
        this.archived = true;
        this.archivedAt = LocalDateTime.now();
        this.updatedAt = this.archivedAt;
    }

    public static String generateJobId() {
        return "gwjob_" + UUID.randomUUID().toString()
                .replace("-", "").substring(0, 16);
    }
}
