package com.greenwashradar.pipeline.checkpoint;

import com.greenwashradar.pipeline.dto.JobArtifacts;
import com.greenwashradar.pipeline.dto.JobKey;
import com.greenwashradar.pipeline.entity.AnalysisJob;
import com.greenwashradar.pipeline.entity.AnalysisStage;
import com.greenwashradar.pipeline.exception.CheckpointConflictException;
import com.greenwashradar.pipeline.repository.AnalysisJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed checkpoint store. Compare-and-advance runs under a row lock.
 */
@Component
@ConditionalOnProperty(prefix = "pipeline.checkpoint", name = "store", havingValue = "jpa", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JpaCheckpointStore implements CheckpointStore {

    private final AnalysisJobRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<AnalysisJob> findById(String jobId) {
        return repository.findById(jobId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AnalysisJob> findActive(JobKey key) {
        List<AnalysisJob> active = repository.findByJobKeyAndArchivedFalseOrderByCreatedAtDesc(key.asString());
        if (active.size() > 1) {
            log.warn("Found {} active jobs for {}, using the newest", active.size(), key);
        }
        return active.stream().findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AnalysisJob> findLatest(JobKey key) {
        return repository.findFirstByJobKeyOrderByCreatedAtDesc(key.asString());
    }

    @Override
    @Transactional
    public AnalysisJob create(AnalysisJob job) {
        if (!repository.findByJobKeyAndArchivedFalseOrderByCreatedAtDesc(job.getJobKey()).isEmpty()) {
            throw CheckpointConflictException.activeJobExists(job.getJobKey());
        }
        AnalysisJob saved = repository.save(job);
        log.info("Created checkpoint: jobId={}, jobKey={}", saved.getId(), saved.getJobKey());
        return saved;
    }

    @Override
    @Transactional
    public AnalysisJob compareAndAdvance(String jobId, AnalysisStage expected, AnalysisStage next, JobArtifacts artifacts) {
        AnalysisJob job = repository.findByIdForUpdate(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown job: " + jobId));
        if (job.getStage() != expected) {
            throw CheckpointConflictException.stageMismatch(job.getJobKey(), expected, job.getStage());
        }
        job.setStage(next);
        job.setArtifacts(artifacts);
        job.setUpdatedAt(LocalDateTime.now());
        return repository.saveAndFlush(job);
    }

    @Override
    @Transactional
    public AnalysisJob archive(String jobId) {
        AnalysisJob job = repository.findByIdForUpdate(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown job: " + jobId));
        if (job.isArchived()) {
            return job;
        }
        job.markArchived();
        return repository.save(job);
    }

    @Override
    @Transactional
    public int purgeArchivedBefore(LocalDateTime cutoff) {
        return repository.deleteArchivedBefore(cutoff);
    }
}
