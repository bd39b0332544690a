package com.greenwashradar.pipeline.exception;

import com.greenwashradar.pipeline.entity.AnalysisStage;

/**
 * The stored checkpoint is not at the stage the caller expected, or another advance holds the job.
 */
public class CheckpointConflictException extends PipelineException {

    public CheckpointConflictException(String message, String jobKey) {
        super(PipelineErrorCode.CHECKPOINT_CONFLICT, message, jobKey);
    }

    public static CheckpointConflictException stageMismatch(String jobKey, AnalysisStage expected, AnalysisStage actual) {
        return new CheckpointConflictException(
                "Checkpoint of " + jobKey + " is at " + actual + ", expected " + expected, jobKey);
    }

    public static CheckpointConflictException busy(String jobKey) {
        return new CheckpointConflictException("Another advance is running for " + jobKey, jobKey);
    }

    public static CheckpointConflictException activeJobExists(String jobKey) {
        return new CheckpointConflictException("An active job already exists for " + jobKey, jobKey);
    }
}
