package com.greenwashradar.pipeline.dto;

import com.greenwashradar.pipeline.entity.AnalysisJob;

import java.util.concurrent.CompletableFuture;

/**
 * Answer to a submission: the status right now, plus the run's completion.
 * For coalesced or already completed submissions the completion refers to the existing run
 * or is already done.
 */
public record JobSubmission(JobStatusView status, CompletableFuture<AnalysisJob> completion) {
}
