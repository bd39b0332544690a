package com.greenwashradar.pipeline.service.orchestration.stage;

import com.greenwashradar.pipeline.config.PipelineProperties;
import com.greenwashradar.pipeline.dto.Claim;
import com.greenwashradar.pipeline.dto.ClaimConsistency;
import com.greenwashradar.pipeline.dto.Evidence;
import com.greenwashradar.pipeline.dto.FetchOutcomeStatus;
import com.greenwashradar.pipeline.dto.JobArtifacts;
import com.greenwashradar.pipeline.dto.NewsArticle;
import com.greenwashradar.pipeline.dto.SearchTopic;
import com.greenwashradar.pipeline.dto.TopicFetchOutcome;
import com.greenwashradar.pipeline.entity.AnalysisJob;
import com.greenwashradar.pipeline.entity.AnalysisStage;
import com.greenwashradar.pipeline.service.fetch.ConcurrentFetchCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Searches news for every claim and turns the hits into unchecked evidence.
 * The evidence list is rebuilt from scratch on every run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NewsCrossCheckStage implements StageHandler {

    private final ConcurrentFetchCoordinator fetchCoordinator;
    private final PipelineProperties properties;

    @Override
    public AnalysisStage stage() {
        return AnalysisStage.NEWS_CROSS_CHECK;
    }

    @Override
    public JobArtifacts execute(AnalysisJob job) {
        JobArtifacts artifacts = job.getArtifacts();
        List<SearchTopic> topics = artifacts.getClaims().stream()
                .map(claim -> SearchTopic.forClaim(claim, job.getCompanyName(), job.getIndustry(), job.getReportYear()))
                .toList();

        Map<String, TopicFetchOutcome> outcomes = fetchCoordinator.fetchAll(topics);

        int perClaim = Math.max(1, properties.getFetch().getEvidencePerClaim());
        List<Claim> claims = new ArrayList<>();
        List<Evidence> evidence = new ArrayList<>();
        for (Claim claim : artifacts.getClaims()) {
            TopicFetchOutcome outcome = outcomes.get(claim.getId());
            Claim.ClaimBuilder updated = claim.toBuilder().evidenceIds(new ArrayList<>());

            if (outcome == null || outcome.status() == FetchOutcomeStatus.NO_EVIDENCE) {
                updated.consistency(ClaimConsistency.NO_EVIDENCE);
            } else if (!outcome.isFound()) {
                updated.consistency(ClaimConsistency.SEARCH_FAILED);
            } else {
                List<String> ids = new ArrayList<>();
                List<NewsArticle> articles = outcome.articles();
                for (int i = 0; i < Math.min(perClaim, articles.size()); i++) {
                    NewsArticle article = articles.get(i);
                    Evidence item = Evidence.builder()
                            .id(claim.getId() + "-E" + (i + 1))
                            .claimId(claim.getId())
                            .url(article.url())
                            .title(article.title())
                            .snippet(article.snippet())
                            .publishedAt(article.publishedAt())
                            .build();
                    evidence.add(item);
                    ids.add(item.getId());
                }
                updated.consistency(ClaimConsistency.PENDING).evidenceIds(ids);
            }
            claims.add(updated.build());
        }

        log.info("[{}] News cross-check: claims={}, evidence={}", job.getJobKey(), claims.size(), evidence.size());
        return artifacts.toBuilder()
                .claims(claims)
                .newsOutcomes(new LinkedHashMap<>(outcomes))
                .evidence(evidence)
                .build();
    }
}
