package com.greenwashradar.pipeline.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.greenwashradar.pipeline.dto.JobArtifacts;
import com.greenwashradar.pipeline.dto.JobKey;
import com.greenwashradar.pipeline.entity.AnalysisJob;
import com.greenwashradar.pipeline.entity.AnalysisStage;
import com.greenwashradar.pipeline.exception.CheckpointConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local checkpoint store for local runs and tests.
 * Jobs are deep-copied through Jackson on the way in and out.
 */
@Component
@ConditionalOnProperty(prefix = "pipeline.checkpoint", name = "store", havingValue = "memory")
@Slf4j
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, AnalysisJob> jobs = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public InMemoryCheckpointStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<AnalysisJob> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(this::copy);
    }

    @Override
    public Optional<AnalysisJob> findActive(JobKey key) {
        return jobs.values().stream()
                .filter(job -> job.getJobKey().equals(key.asString()) && !job.isArchived())
                .max(Comparator.comparing(AnalysisJob::getCreatedAt))
                .map(this::copy);
    }

    @Override
    public Optional<AnalysisJob> findLatest(JobKey key) {
        return jobs.values().stream()
                .filter(job -> job.getJobKey().equals(key.asString()))
                .max(Comparator.comparing(AnalysisJob::getCreatedAt))
                .map(this::copy);
    }

    @Override
    public synchronized AnalysisJob create(AnalysisJob job) {
        boolean activeExists = jobs.values().stream()
                .anyMatch(stored -> stored.getJobKey().equals(job.getJobKey()) && !stored.isArchived());
        if (activeExists) {
            throw CheckpointConflictException.activeJobExists(job.getJobKey());
        }
        AnalysisJob stored = copy(job);
        stored.setVersion(0L);
        if (stored.getCreatedAt() == null) {
            stored.setCreatedAt(LocalDateTime.now());
        }
        stored.setUpdatedAt(stored.getCreatedAt());
        jobs.put(stored.getId(), stored);
        log.debug("Created in-memory checkpoint: jobId={}, jobKey={}", stored.getId(), stored.getJobKey());
        return copy(stored);
    }

    @Override
    public AnalysisJob compareAndAdvance(String jobId, AnalysisStage expected, AnalysisStage next, JobArtifacts artifacts) {
        JobArtifacts detached = objectMapper.convertValue(artifacts, JobArtifacts.class);
        AnalysisJob updated = jobs.compute(jobId, (id, current) -> {
            if (current == null) {
                throw new IllegalArgumentException("Unknown job: " + jobId);
            }
            if (current.getStage() != expected) {
                throw CheckpointConflictException.stageMismatch(current.getJobKey(), expected, current.getStage());
            }
            AnalysisJob advanced = copy(current);
            advanced.setStage(next);
            advanced.setArtifacts(detached);
            advanced.setUpdatedAt(LocalDateTime.now());
            advanced.setVersion(current.getVersion() + 1);
            return advanced;
        });
        return copy(updated);
    }

    @Override
    public AnalysisJob archive(String jobId) {
        AnalysisJob updated = jobs.compute(jobId, (id, current) -> {
            if (current == null) {
                throw new IllegalArgumentException("Unknown job: " + jobId);
            }
            if (current.isArchived()) {
                return current;
            }
            AnalysisJob archived = copy(current);
            archived.markArchived();
            archived.setVersion(current.getVersion() + 1);
            return archived;
        });
        return copy(updated);
    }

    @Override
    public int purgeArchivedBefore(LocalDateTime cutoff) {
        int before = jobs.size();
        jobs.values().removeIf(job -> job.isArchived() && job.getArchivedAt().isBefore(cutoff));
        return before - jobs.size();
    }

    private AnalysisJob copy(AnalysisJob job) {
        return objectMapper.convertValue(job, AnalysisJob.class);
    }
}
