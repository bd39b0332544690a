package com.greenwashradar.pipeline.checkpoint;

import com.greenwashradar.pipeline.dto.JobArtifacts;
import com.greenwashradar.pipeline.dto.JobKey;
import com.greenwashradar.pipeline.entity.AnalysisJob;
import com.greenwashradar.pipeline.entity.AnalysisStage;
import com.greenwashradar.pipeline.exception.CheckpointConflictException;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Durable record of how far each job has progressed.
 * Implementations must make {@link #compareAndAdvance} atomic with respect to concurrent callers.
 * Returned jobs are detached copies; mutating them never changes stored state.
 */
public interface CheckpointStore {

    Optional<AnalysisJob> findById(String jobId);

    /**
     * The non-archived job for a key, if any.
     */
    Optional<AnalysisJob> findActive(JobKey key);

    /**
     * The most recently created job for a key, archived or not.
     */
    Optional<AnalysisJob> findLatest(JobKey key);

    /**
     * Stores a new job.
     *
     * @throws CheckpointConflictException when a non-archived job already exists for the key
     */
    AnalysisJob create(AnalysisJob job);

    /**
     * Moves the job from {@code expected} to {@code next} and replaces its artifacts, in one step.
     *
     * @throws CheckpointConflictException when the stored stage is not {@code expected}
     */
    AnalysisJob compareAndAdvance(String jobId, AnalysisStage expected, AnalysisStage next, JobArtifacts artifacts);

    /**
     * Marks the job archived. Archiving an archived job is a no-op.
     */
    AnalysisJob archive(String jobId);

    /**
     * Deletes archived jobs archived before the cutoff.
     *
     * @return number of deleted jobs
     */
    int purgeArchivedBefore(LocalDateTime cutoff);
}
