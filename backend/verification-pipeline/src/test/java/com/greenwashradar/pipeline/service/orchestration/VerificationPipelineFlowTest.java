package com.greenwashradar.pipeline.service.orchestration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.greenwashradar.pipeline.checkpoint.InMemoryCheckpointStore;
import com.greenwashradar.pipeline.client.ScoringOracle;
import com.greenwashradar.pipeline.client.SecondaryVerificationOracle;
import com.greenwashradar.pipeline.client.SideArtifactGenerator;
import com.greenwashradar.pipeline.config.PipelineProperties;
import com.greenwashradar.pipeline.dto.AnalysisBundle;
import com.greenwashradar.pipeline.dto.AnalysisJobRequest;
import com.greenwashradar.pipeline.dto.Claim;
import com.greenwashradar.pipeline.dto.ClaimConsistency;
import com.greenwashradar.pipeline.dto.Evidence;
import com.greenwashradar.pipeline.dto.JobKey;
import com.greenwashradar.pipeline.dto.JobState;
import com.greenwashradar.pipeline.dto.JobSubmission;
import com.greenwashradar.pipeline.dto.NewsArticle;
import com.greenwashradar.pipeline.dto.OracleRequest;
import com.greenwashradar.pipeline.dto.ReportDocument;
import com.greenwashradar.pipeline.dto.ReportQuery;
import com.greenwashradar.pipeline.dto.SideArtifact;
import com.greenwashradar.pipeline.dto.TopicFetchOutcome;
import com.greenwashradar.pipeline.dto.VerificationVerdict;
import com.greenwashradar.pipeline.entity.AnalysisJob;
import com.greenwashradar.pipeline.entity.AnalysisStage;
import com.greenwashradar.pipeline.exception.OracleCallException;
import com.greenwashradar.pipeline.fetcher.ReportDocumentFetcher;
import com.greenwashradar.pipeline.service.analysis.AnalysisInvoker;
import com.greenwashradar.pipeline.service.analysis.OracleResponseParser;
import com.greenwashradar.pipeline.service.analysis.RiskSummaryCalculator;
import com.greenwashradar.pipeline.service.fallback.FallbackQueryPlanner;
import com.greenwashradar.pipeline.service.fetch.ConcurrentFetchCoordinator;
import com.greenwashradar.pipeline.service.orchestration.stage.ClaimExtractionStage;
import com.greenwashradar.pipeline.service.orchestration.stage.DocumentFetchStage;
import com.greenwashradar.pipeline.service.orchestration.stage.ExternalVerificationStage;
import com.greenwashradar.pipeline.service.orchestration.stage.NewsCrossCheckStage;
import com.greenwashradar.pipeline.service.orchestration.stage.SourceValidationStage;
import com.greenwashradar.pipeline.service.resilience.ExternalCallPolicy;
import com.greenwashradar.pipeline.service.storage.FileSystemReportArchive;
import com.greenwashradar.pipeline.service.validation.EvidenceValidator;
import com.greenwashradar.pipeline.service.validation.OwnDomainPolicy;
import com.greenwashradar.pipeline.support.PipelineTestProperties;
import com.greenwashradar.pipeline.support.ScriptedNewsFetcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static com.greenwashradar.pipeline.support.ScriptedNewsFetcher.article;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * 보고서 수집부터 결과 전달까지 전체 단계를 실제 구성 요소로 실행하는 흐름 테스트.
 * 외부 시스템만 가짜로 대체합니다.
 */
class VerificationPipelineFlowTest {

    private static final JobKey KEY = new JobKey("1101", 2024);
    private static final String DEAD_LINK = "https://news.example.com/c2-kiln-dust";
    private static final String REPLACEMENT = "https://www.reuters.com/markets/taiwan-cement-dust-fine";

    private static final String EXTRACTED_CLAIMS = """
            [
              {"esg_category": "E", "sasb_topic": "GHG Emissions", "page_number": "12",
               "report_claim": "Scope 1 emissions fell 12% against the 2020 baseline", "risk_score": 2, "key_word": "carbon"},
              {"esg_category": "E", "sasb_topic": "Air Quality", "page_number": "18",
               "report_claim": "Kiln dust emissions are fully contained", "risk_score": 1, "key_word": "dust"},
              {"esg_category": "E", "sasb_topic": "Water Management", "page_number": "22",
               "report_claim": "Recycled water covers 60% of plant demand", "risk_score": 1, "key_word": "water"},
              {"esg_category": "S", "sasb_topic": "Community Relations", "page_number": "30",
               "report_claim": "Quarry restoration restored local biodiversity", "risk_score": 3, "key_word": "quarry"}
            ]
            """;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final List<AnalysisBundle> handedOff = new CopyOnWriteArrayList<>();
    private final AtomicInteger extractionCalls = new AtomicInteger();
    private final AtomicInteger repairCalls = new AtomicInteger();
    private final AtomicBoolean crossCheckDown = new AtomicBoolean();

    private InMemoryCheckpointStore store;
    private ScriptedNewsFetcher newsFetcher;
    private AnalysisJobService jobService;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = PipelineTestProperties.fast(2, 50);
        ExternalCallPolicy callPolicy = new ExternalCallPolicy(properties);
        Executor direct = Runnable::run;

        store = new InMemoryCheckpointStore(objectMapper);
        FileSystemReportArchive archive = new FileSystemReportArchive(tempDir.resolve("reports").toString());
        newsFetcher = new ScriptedNewsFetcher(this::searchNews);
        AnalysisInvoker invoker = new AnalysisInvoker(scoringOracle(), callPolicy,
                new OracleResponseParser(objectMapper, properties), properties);
        RiskSummaryCalculator calculator = new RiskSummaryCalculator();
        SideArtifactGenerator wordCloud = (key, document) -> new SideArtifact("wordclouds/" + key.asString() + ".png", 42);
        EvidenceValidator validator = new EvidenceValidator(verificationOracle(), callPolicy, new OwnDomainPolicy());

        StageOrchestrator orchestrator = new StageOrchestrator(store, new JobLockRegistry(), List.of(
                new DocumentFetchStage(reportFetcher(), archive, callPolicy),
                new ClaimExtractionStage(invoker, wordCloud, archive, direct, properties),
                new NewsCrossCheckStage(new ConcurrentFetchCoordinator(newsFetcher,
                        new FallbackQueryPlanner(properties), callPolicy, direct, properties), properties),
                new ExternalVerificationStage(invoker, calculator),
                new SourceValidationStage(validator, wordCloud, archive, handedOff::add, calculator)
        ), archive, new SimpleMeterRegistry());
        jobService = new AnalysisJobService(store, orchestrator, direct);
    }

    private AnalysisJobRequest request() {
        return AnalysisJobRequest.builder()
                .companyCode("1101")
                .reportYear(2024)
                .companyName("Taiwan Cement")
                .industry("Construction Materials")
                .companyDomain("taiwancement.com")
                .build();
    }

    @Test
    @DisplayName("네 개의 주장을 추출하고 뉴스 교차 검증, 링크 복구를 거쳐 한 번만 결과를 전달")
    void runsWholePipeline() throws Exception {
        // when
        JobSubmission submission = jobService.submit(request());
        AnalysisJob finished = submission.completion().join();

        // then
        assertThat(finished.getStage()).isEqualTo(AnalysisStage.PERSISTED);
        assertThat(finished.isArchived()).isTrue();
        assertThat(jobService.status(KEY).getState()).isEqualTo(JobState.COMPLETED);

        Map<String, TopicFetchOutcome> outcomes = finished.getArtifacts().getNewsOutcomes();
        assertThat(outcomes.values()).extracting(TopicFetchOutcome::tier).containsExactly(1, 1, 1, 3);

        assertThat(handedOff).hasSize(1);
        AnalysisBundle bundle = handedOff.get(0);
        assertThat(bundle.jobKey()).isEqualTo("2024_1101");
        assertThat(bundle.claims()).hasSize(4);
        Map<String, Claim> claims = bundle.claims().stream()
                .collect(Collectors.toMap(Claim::getId, claim -> claim, (a, b) -> a, LinkedHashMap::new));
        assertThat(claims.get("C2").getConsistency()).isEqualTo(ClaimConsistency.CONTRADICTED);
        assertThat(claims.get("C2").getRiskScore()).isEqualTo(4);
        assertThat(claims.get("C2").getRiskAdjustment()).isEqualTo(3);
        assertThat(claims.values()).filteredOn(c -> c.getConsistency() == ClaimConsistency.CONSISTENT).hasSize(3);
        assertThat(claims.values()).allMatch(Claim::hasEvidence);

        assertThat(bundle.evidence()).hasSize(4);
        Evidence repaired = bundle.evidence().stream().filter(Evidence::isRepaired).findFirst().orElseThrow();
        assertThat(repaired.getClaimId()).isEqualTo("C2");
        assertThat(repaired.getUrl()).isEqualTo(REPLACEMENT);
        assertThat(repaired.getOriginalUrl()).isEqualTo(DEAD_LINK);
        assertThat(repairCalls).hasValue(1);

        assertThat(bundle.riskSummary().contradictedCount()).isEqualTo(1);
        assertThat(bundle.riskSummary().claimsWithEvidence()).isEqualTo(4);
        assertThat(bundle.sideArtifactRef()).isEqualTo("wordclouds/2024_1101.png");
        assertThat(bundle.reportSourceUrl()).isEqualTo("https://reports.example.com/2024/1101.pdf");

        try (var files = Files.list(tempDir.resolve("reports"))) {
            assertThat(files.filter(p -> p.toString().endsWith(".pdf"))).isEmpty();
        }
    }

    @Test
    @DisplayName("완료된 분석을 다시 요청하면 재실행 없이 기존 결과를 반환")
    void completedAnalysisIsNotRerun() {
        // given
        jobService.submit(request()).completion().join();

        // when
        JobSubmission again = jobService.submit(request());

        // then
        assertThat(again.status().getState()).isEqualTo(JobState.COMPLETED);
        assertThat(handedOff).hasSize(1);
        assertThat(extractionCalls).hasValue(1);
    }

    @Test
    @DisplayName("교차 검증 단계에서 오라클이 멈추면 그 단계에서 멈추고 재요청 시 이어서 완료")
    void resumesAfterOracleOutage() {
        // given
        crossCheckDown.set(true);
        AnalysisJob stopped = jobService.submit(request()).completion().join();
        int queriesBeforeResume = newsFetcher.queries().size();

        // then
        assertThat(stopped.getStage()).isEqualTo(AnalysisStage.EXTERNAL_VERIFICATION);
        assertThat(jobService.status(KEY).getState()).isEqualTo(JobState.TEMPORARILY_UNAVAILABLE);
        assertThat(store.findActive(KEY).orElseThrow().getArtifacts().getEvidence()).hasSize(4);
        assertThat(handedOff).isEmpty();

        // when
        crossCheckDown.set(false);
        AnalysisJob finished = jobService.submit(request()).completion().join();

        // then
        assertThat(finished.isTerminal()).isTrue();
        assertThat(extractionCalls).hasValue(1);
        assertThat(newsFetcher.queries()).hasSize(queriesBeforeResume);
        assertThat(handedOff).hasSize(1);
    }

    private List<NewsArticle> searchNews(String query) {
        if (query.equals("Taiwan Cement")) {
            return List.of(article("https://news.example.com/c4-quarry"));
        }
        if (!query.contains("\"")) {
            return List.of();
        }
        if (query.contains("Scope 1")) {
            return List.of(article("https://news.example.com/c1-emissions"));
        }
        if (query.contains("Kiln dust")) {
            return List.of(article(DEAD_LINK));
        }
        if (query.contains("Recycled water")) {
            return List.of(article("https://news.example.com/c3-water"));
        }
        return List.of();
    }

    private ReportDocumentFetcher reportFetcher() {
        return new ReportDocumentFetcher() {
            @Override
            public String getSourceId() {
                return "report-source";
            }

            @Override
            public boolean isAvailable() {
                return true;
            }

            @Override
            public ReportDocument fetch(ReportQuery query) {
                return new ReportDocument("https://reports.example.com/" + query.reportYear() + "/" + query.companyCode() + ".pdf",
                        "application/pdf", "%PDF-1.7 sustainability report".getBytes(StandardCharsets.US_ASCII));
            }
        };
    }

    private ScoringOracle scoringOracle() {
        return request -> switch (request.getTask()) {
            case CLAIM_EXTRACTION -> {
                extractionCalls.incrementAndGet();
                yield EXTRACTED_CLAIMS;
            }
            case CROSS_CHECK -> {
                if (crossCheckDown.get()) {
                    throw OracleCallException.serverError("gemini", 503);
                }
                yield crossCheckAnswer(request);
            }
        };
    }

    private String crossCheckAnswer(OracleRequest request) {
        List<Map<String, Object>> assessments = new ArrayList<>();
        for (Claim claim : request.getClaims()) {
            boolean contradicted = claim.getId().equals("C2");
            assessments.add(Map.of(
                    "claim_id", claim.getId(),
                    "consistency_status", contradicted ? "contradicted" : "consistent",
                    "adjustment_score", contradicted ? 4 : claim.getRiskScore(),
                    "rationale", contradicted ? "Plant fined for dust emissions in 2024" : "Reported by press"));
        }
        try {
            return objectMapper.writeValueAsString(assessments);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private SecondaryVerificationOracle verificationOracle() {
        return request -> {
            if (request.isProbe()) {
                return DEAD_LINK.equals(request.candidateUrl())
                        ? VerificationVerdict.dead(request.candidateUrl(), "HTTP 404")
                        : VerificationVerdict.live(request.candidateUrl());
            }
            repairCalls.incrementAndGet();
            return VerificationVerdict.live(REPLACEMENT);
        };
    }
}
