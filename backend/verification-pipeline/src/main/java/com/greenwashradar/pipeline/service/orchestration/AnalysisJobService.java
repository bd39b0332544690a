package com.greenwashradar.pipeline.service.orchestration;

import com.greenwashradar.pipeline.checkpoint.CheckpointStore;
import com.greenwashradar.pipeline.dto.AnalysisJobRequest;
import com.greenwashradar.pipeline.dto.JobKey;
import com.greenwashradar.pipeline.dto.JobState;
import com.greenwashradar.pipeline.dto.JobStatusView;
import com.greenwashradar.pipeline.dto.JobSubmission;
import com.greenwashradar.pipeline.dto.PipelineFailure;
import com.greenwashradar.pipeline.entity.AnalysisJob;
import com.greenwashradar.pipeline.exception.CheckpointConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for analysis requests.
 * <p>
 * A submission creates or resumes the job for its key and runs it to the end on the
 * pipeline executor; the caller gets the current status back immediately. At most one run
 * per job key is in flight in this process, later submissions join it.
 */
@Service
@Slf4j
public class AnalysisJobService {

    private final CheckpointStore checkpointStore;
    private final StageOrchestrator orchestrator;
    private final Executor pipelineExecutor;

    private final Map<String, CompletableFuture<AnalysisJob>> inFlight = new ConcurrentHashMap<>();
    private final Map<String, PipelineFailure> lastFailures = new ConcurrentHashMap<>();
    private final Set<String> abandoned = ConcurrentHashMap.newKeySet();

    public AnalysisJobService(CheckpointStore checkpointStore,
                              StageOrchestrator orchestrator,
                              @Qualifier("pipelineExecutor") Executor pipelineExecutor) {
        this.checkpointStore = checkpointStore;
        this.orchestrator = orchestrator;
        this.pipelineExecutor = pipelineExecutor;
    }

    public JobSubmission submit(AnalysisJobRequest request) {
        JobKey key = request.toKey();
        CompletableFuture<AnalysisJob> running = runningFor(key.asString());
        if (running != null) {
            log.info("[{}] Submission joined the run in flight", key);
            return new JobSubmission(inProgressView(key), running);
        }

        AnalysisJob job = resolveJob(request, key);
        if (job.isTerminal()) {
            log.info("[{}] Analysis already completed, returning stored result", key);
            return new JobSubmission(JobStatusView.of(job, JobState.COMPLETED, "Analysis completed"),
                    CompletableFuture.completedFuture(job));
        }

        CompletableFuture<AnalysisJob> completion = launch(job);
        return new JobSubmission(
                JobStatusView.of(job, JobState.IN_PROGRESS, "Analysis running at stage " + job.getStage()),
                completion);
    }

    public JobStatusView status(JobKey key) {
        String jobKey = key.asString();
        if (runningFor(jobKey) != null) {
            return inProgressView(key);
        }

        Optional<AnalysisJob> active = checkpointStore.findActive(key);
        if (active.isPresent()) {
            AnalysisJob job = active.get();
            if (job.isTerminal()) {
                return JobStatusView.of(job, JobState.COMPLETED, "Analysis completed");
            }
            PipelineFailure failure = lastFailures.get(jobKey);
            if (failure != null) {
                JobStatusView view = JobStatusView.of(job,
                        failure.isRetryable() ? JobState.TEMPORARILY_UNAVAILABLE : JobState.FAILED,
                        failure.message());
                view.setErrorCode(failure.errorCode().name());
                return view;
            }
            return JobStatusView.of(job, JobState.INTERRUPTED,
                    "Analysis stopped at stage " + job.getStage() + ", submit again to resume");
        }

        return checkpointStore.findLatest(key)
                .filter(AnalysisJob::isTerminal)
                .map(job -> JobStatusView.of(job, JobState.COMPLETED, "Analysis completed"))
                .orElseGet(() -> JobStatusView.notFound(key));
    }

    /**
     * Stops the run for the key after its current stage. The checkpoint stays resumable.
     *
     * @return false when no run was in flight
     */
    public boolean abandon(JobKey key) {
        if (runningFor(key.asString()) == null) {
            return false;
        }
        abandoned.add(key.asString());
        log.info("[{}] Abandon requested, stopping after the current stage", key);
        return true;
    }

    AnalysisJob runToCompletion(AnalysisJob job) {
        String jobKey = job.getJobKey();
        AnalysisJob current = job;
        while (!current.isTerminal()) {
            if (abandoned.remove(jobKey)) {
                log.info("[{}] Run abandoned at stage {}", jobKey, current.getStage());
                return current;
            }
            AnalysisJob next = orchestrator.advance(current);
            if (next.hasFailure()) {
                lastFailures.put(jobKey, next.getLastFailure());
                return next;
            }
            current = next;
        }
        lastFailures.remove(jobKey);
        return current;
    }

    private AnalysisJob resolveJob(AnalysisJobRequest request, JobKey key) {
        Optional<AnalysisJob> active = checkpointStore.findActive(key);
        if (active.isPresent()) {
            AnalysisJob job = active.get();
            if (job.isTerminal()) {
                // finished before it could be archived
                return checkpointStore.archive(job.getId());
            }
            log.info("[{}] Resuming job {} at stage {}", key, job.getId(), job.getStage());
            return job;
        }

        if (!request.isForce()) {
            Optional<AnalysisJob> latest = checkpointStore.findLatest(key).filter(AnalysisJob::isTerminal);
            if (latest.isPresent()) {
                return latest.get();
            }
        }

        AnalysisJob created = AnalysisJob.create(key, request.getCompanyName(), request.getIndustry(),
                request.getCompanyDomain());
        try {
            AnalysisJob stored = checkpointStore.create(created);
            log.info("[{}] Created job {}", key, stored.getId());
            return stored;
        } catch (CheckpointConflictException e) {
            log.info("[{}] Job created concurrently, resuming it", key);
            return checkpointStore.findActive(key).orElseThrow(() -> e);
        }
    }

    private CompletableFuture<AnalysisJob> launch(AnalysisJob job) {
        String jobKey = job.getJobKey();
        CompletableFuture<AnalysisJob> completion = new CompletableFuture<>();
        CompletableFuture<AnalysisJob> existing = inFlight.putIfAbsent(jobKey, completion);
        if (existing != null) {
            return existing;
        }
        // 실행을 시작하는 쪽만 이전 실행의 흔적을 지운다
        abandoned.remove(jobKey);
        lastFailures.remove(jobKey);
        try {
            pipelineExecutor.execute(() -> {
                try {
                    completion.complete(runToCompletion(job));
                } catch (RuntimeException e) {
                    log.error("[{}] Run aborted unexpectedly", jobKey, e);
                    completion.completeExceptionally(e);
                } finally {
                    inFlight.remove(jobKey, completion);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(jobKey, completion);
            throw e;
        }
        return completion;
    }

    private CompletableFuture<AnalysisJob> runningFor(String jobKey) {
        CompletableFuture<AnalysisJob> running = inFlight.get(jobKey);
        return running != null && !running.isDone() ? running : null;
    }

    private JobStatusView inProgressView(JobKey key) {
        return checkpointStore.findActive(key)
                .map(job -> JobStatusView.of(job, JobState.IN_PROGRESS, "Analysis running at stage " + job.getStage()))
                .orElseGet(() -> JobStatusView.builder()
                        .jobKey(key.asString())
                        .companyCode(key.companyCode())
                        .reportYear(key.reportYear())
                        .state(JobState.IN_PROGRESS)
                        .build());
    }
}
