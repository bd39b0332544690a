package com.greenwashradar.pipeline.service.analysis;

import com.greenwashradar.pipeline.client.ScoringOracle;
import com.greenwashradar.pipeline.config.PipelineProperties;
import com.greenwashradar.pipeline.dto.Claim;
import com.greenwashradar.pipeline.dto.ClaimAssessment;
import com.greenwashradar.pipeline.dto.Evidence;
import com.greenwashradar.pipeline.dto.OracleRequest;
import com.greenwashradar.pipeline.dto.OracleTask;
import com.greenwashradar.pipeline.dto.ReportDocument;
import com.greenwashradar.pipeline.entity.AnalysisJob;
import com.greenwashradar.pipeline.exception.OracleCallException;
import com.greenwashradar.pipeline.exception.OracleUnavailableException;
import com.greenwashradar.pipeline.exception.RateLimitedException;
import com.greenwashradar.pipeline.service.resilience.ExternalCallPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Calls the scoring oracle under the shared call policy and validates what comes back.
 * <p>
 * Transient failures are retried with backoff; once retries are exhausted, or while the
 * circuit is open, {@link OracleUnavailableException} is thrown. Output that does not fit
 * the schema raises {@link com.greenwashradar.pipeline.exception.MalformedOutputException}
 * and is never retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisInvoker {

    public static final String DEPENDENCY = "scoring-oracle";

    private final ScoringOracle scoringOracle;
    private final ExternalCallPolicy callPolicy;
    private final OracleResponseParser parser;
    private final PipelineProperties properties;

    public List<Claim> extractClaims(AnalysisJob job, ReportDocument document) {
        OracleRequest request = OracleRequest.builder()
                .task(OracleTask.CLAIM_EXTRACTION)
                .jobKey(job.getJobKey())
                .companyName(job.getCompanyName())
                .industry(job.getIndustry())
                .reportYear(job.getReportYear())
                .framework(properties.getAnalysis().getFramework())
                .document(document)
                .build();

        String raw = invoke(request);
        List<Claim> claims = parser.parseClaims(raw);
        log.info("[{}] Extracted {} claims", job.getJobKey(), claims.size());
        return claims;
    }

    public List<ClaimAssessment> crossCheck(AnalysisJob job, List<Claim> claims, Map<String, List<Evidence>> evidenceByClaim) {
        OracleRequest request = OracleRequest.builder()
                .task(OracleTask.CROSS_CHECK)
                .jobKey(job.getJobKey())
                .companyName(job.getCompanyName())
                .industry(job.getIndustry())
                .reportYear(job.getReportYear())
                .framework(properties.getAnalysis().getFramework())
                .claims(claims)
                .evidenceByClaim(evidenceByClaim)
                .build();

        Set<String> claimIds = claims.stream()
                .map(Claim::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        String raw = invoke(request);
        List<ClaimAssessment> assessments = parser.parseAssessments(raw, claimIds);
        log.info("[{}] Cross-checked {} of {} claims", job.getJobKey(), assessments.size(), claimIds.size());
        return assessments;
    }

    private String invoke(OracleRequest request) {
        long started = System.currentTimeMillis();
        try {
            String raw = callPolicy.execute(DEPENDENCY, () -> scoringOracle.complete(request));
            log.debug("[{}] {} answered in {}ms", request.getJobKey(), request.getTask(),
                    System.currentTimeMillis() - started);
            return raw;
        } catch (OracleCallException e) {
            if (!e.isTransientFailure()) {
                throw e;
            }
            throw OracleUnavailableException.retriesExhausted(DEPENDENCY, e);
        } catch (RateLimitedException e) {
            throw OracleUnavailableException.retriesExhausted(DEPENDENCY, e);
        }
    }
}
