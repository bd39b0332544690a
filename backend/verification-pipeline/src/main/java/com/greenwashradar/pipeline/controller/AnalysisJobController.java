package com.greenwashradar.pipeline.controller;

import com.greenwashradar.pipeline.dto.AnalysisJobRequest;
import com.greenwashradar.pipeline.dto.JobKey;
import com.greenwashradar.pipeline.dto.JobState;
import com.greenwashradar.pipeline.dto.JobStatusView;
import com.greenwashradar.pipeline.dto.JobSubmission;
import com.greenwashradar.pipeline.service.orchestration.AnalysisJobService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Starts analyses and reports their state.
 * A job is addressed by report year and company code.
 */
@RestController
@RequestMapping("/api/v1/analysis/jobs")
@RequiredArgsConstructor
@Slf4j
public class AnalysisJobController {

    private final AnalysisJobService jobService;

    /**
     * Start or resume the analysis for a company and year.
     *
     * @return 202 Accepted while running, 200 OK when a completed result already exists
     */
    @PostMapping
    public ResponseEntity<JobStatusView> submit(@Valid @RequestBody AnalysisJobRequest request) {
        log.info("Analysis requested: company={}, year={}, force={}",
                request.getCompanyCode(), request.getReportYear(), request.isForce());

        JobSubmission submission = jobService.submit(request);
        JobStatusView status = submission.status();
        HttpStatus httpStatus = status.getState() == JobState.COMPLETED ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(httpStatus).body(status);
    }

    @GetMapping("/{reportYear}/{companyCode}")
    public ResponseEntity<JobStatusView> status(@PathVariable int reportYear, @PathVariable String companyCode) {
        JobStatusView status = jobService.status(new JobKey(companyCode, reportYear));
        if (status.getState() == JobState.NOT_FOUND) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(status);
        }
        return ResponseEntity.ok(status);
    }

    /**
     * Stop a running analysis after its current stage. Submitting again resumes it.
     */
    @DeleteMapping("/{reportYear}/{companyCode}")
    public ResponseEntity<Map<String, Object>> abandon(@PathVariable int reportYear, @PathVariable String companyCode) {
        JobKey key = new JobKey(companyCode, reportYear);
        boolean stopped = jobService.abandon(key);
        if (!stopped) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                    "success", false,
                    "jobKey", key.asString(),
                    "message", "No analysis is running for this company and year"
            ));
        }
        return ResponseEntity.accepted().body(Map.of(
                "success", true,
                "jobKey", key.asString(),
                "message", "Analysis will stop after the current stage"
        ));
    }
}
