package com.greenwashradar.pipeline.dto;

import com.greenwashradar.pipeline.entity.AnalysisStage;
import com.greenwashradar.pipeline.exception.PipelineErrorCode;
import com.greenwashradar.pipeline.exception.PipelineException;

import java.time.Instant;

/**
 * Why the last advance of a job did not move its checkpoint.
 */
public record PipelineFailure(
        PipelineErrorCode errorCode,
        AnalysisStage stage,
        String message,
        Instant occurredAt
) {

    public static PipelineFailure of(PipelineErrorCode errorCode, AnalysisStage stage, String message) {
        return new PipelineFailure(errorCode, stage, message, Instant.now());
    }

    public static PipelineFailure from(PipelineException e, AnalysisStage stage) {
        return of(e.getErrorCode(), stage, e.getMessage());
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
