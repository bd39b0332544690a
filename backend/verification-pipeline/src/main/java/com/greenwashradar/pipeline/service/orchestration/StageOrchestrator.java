package com.greenwashradar.pipeline.service.orchestration;

import com.greenwashradar.pipeline.checkpoint.CheckpointStore;
import com.greenwashradar.pipeline.dto.JobArtifacts;
import com.greenwashradar.pipeline.dto.PipelineFailure;
import com.greenwashradar.pipeline.entity.AnalysisJob;
import com.greenwashradar.pipeline.entity.AnalysisStage;
import com.greenwashradar.pipeline.exception.CheckpointConflictException;
import com.greenwashradar.pipeline.exception.PipelineErrorCode;
import com.greenwashradar.pipeline.exception.PipelineException;
import com.greenwashradar.pipeline.service.orchestration.stage.StageHandler;
import com.greenwashradar.pipeline.service.storage.ReportArchive;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Moves a job through its stages one step at a time.
 * <p>
 * {@link #advance} executes exactly the current stage. On success the checkpoint is moved
 * forward with compare-and-advance and the advanced job is returned. On failure the caller's
 * job comes back unchanged with a {@link PipelineFailure} attached and the checkpoint is
 * left where it was. When the stored checkpoint is already past the caller's stage, the
 * stored job is returned without running anything.
 */
@Service
@Slf4j
public class StageOrchestrator {

    private final CheckpointStore checkpointStore;
    private final JobLockRegistry lockRegistry;
    private final ReportArchive reportArchive;
    private final MeterRegistry meterRegistry;
    private final Map<AnalysisStage, StageHandler> handlers = new EnumMap<>(AnalysisStage.class);

    public StageOrchestrator(CheckpointStore checkpointStore,
                             JobLockRegistry lockRegistry,
                             List<StageHandler> stageHandlers,
                             ReportArchive reportArchive,
                             MeterRegistry meterRegistry) {
        this.checkpointStore = checkpointStore;
        this.lockRegistry = lockRegistry;
        this.reportArchive = reportArchive;
        this.meterRegistry = meterRegistry;
        for (StageHandler handler : stageHandlers) {
            StageHandler previous = handlers.put(handler.stage(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for stage " + handler.stage());
            }
        }
        for (AnalysisStage stage : AnalysisStage.values()) {
            if (!stage.isTerminal() && !handlers.containsKey(stage)) {
                throw new IllegalStateException("No handler for stage " + stage);
            }
        }
    }

    public AnalysisJob advance(AnalysisJob job) {
        if (job.isTerminal()) {
            return job;
        }
        String jobKey = job.getJobKey();
        Optional<JobLockRegistry.JobLock> lock = lockRegistry.tryAcquire(jobKey);
        if (lock.isEmpty()) {
            log.warn("[{}] Advance rejected, another advance is running", jobKey);
            return fail(job, CheckpointConflictException.busy(jobKey));
        }

        try (JobLockRegistry.JobLock ignored = lock.get()) {
            AnalysisJob stored = checkpointStore.findById(job.getId())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown job: " + job.getId()));

            if (stored.getStage().isAfter(job.getStage())) {
                log.info("[{}] Checkpoint already at {}, nothing to do for {}", jobKey, stored.getStage(), job.getStage());
                return stored;
            }
            if (stored.getStage() != job.getStage()) {
                return fail(job, CheckpointConflictException.stageMismatch(jobKey, job.getStage(), stored.getStage()));
            }
            return runStage(stored);
        } catch (PipelineException e) {
            return fail(job, e);
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected failure in stage {}", jobKey, job.getStage(), e);
            return fail(job, new PipelineException(PipelineErrorCode.STAGE_FAILED,
                    "Stage " + job.getStage() + " failed: " + e.getMessage(), jobKey, e));
        }
    }

    private AnalysisJob runStage(AnalysisJob stored) {
        AnalysisStage stage = stored.getStage();
        StageHandler handler = handlers.get(stage);
        log.info("[{}] Running stage {}", stored.getJobKey(), stage);

        Timer.Sample sample = Timer.start(meterRegistry);
        JobArtifacts produced = handler.execute(stored);
        AnalysisJob advanced = checkpointStore.compareAndAdvance(stored.getId(), stage, stage.next(), produced);
        sample.stop(Timer.builder("pipeline.stage.duration")
                .description("Time spent executing a pipeline stage")
                .tag("stage", stage.name())
                .register(meterRegistry));
        Counter.builder("pipeline.stage.completed")
                .description("Number of completed pipeline stages")
                .tag("stage", stage.name())
                .register(meterRegistry)
                .increment();
        log.info("[{}] Stage {} done, checkpoint at {}", stored.getJobKey(), stage, advanced.getStage());

        if (advanced.isTerminal()) {
            advanced = finish(advanced);
        }
        return advanced;
    }

    private AnalysisJob finish(AnalysisJob persisted) {
        AnalysisJob archived = checkpointStore.archive(persisted.getId());
        if (archived.getArtifacts().getDocument() != null) {
            try {
                reportArchive.delete(archived.getArtifacts().getDocument());
            } catch (RuntimeException e) {
                log.warn("[{}] Could not remove archived report: {}", archived.getJobKey(), e.getMessage());
            }
        }
        log.info("[{}] Job {} completed and archived", archived.getJobKey(), archived.getId());
        return archived;
    }

    private AnalysisJob fail(AnalysisJob job, PipelineException e) {
        PipelineFailure failure = PipelineFailure.from(e, job.getStage());
        Counter.builder("pipeline.stage.failed")
                .description("Number of failed stage attempts")
                .tag("stage", job.getStage().name())
                .tag("error", e.getErrorCode().name())
                .register(meterRegistry)
                .increment();
        log.warn("[{}] Stage {} failed with {}: {}", job.getJobKey(), job.getStage(), e.getErrorCode(), e.getMessage());
        return job.withFailure(failure);
    }
}
