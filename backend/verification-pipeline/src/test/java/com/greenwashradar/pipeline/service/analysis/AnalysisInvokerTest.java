package com.greenwashradar.pipeline.service.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.greenwashradar.pipeline.client.ScoringOracle;
import com.greenwashradar.pipeline.config.PipelineProperties;
import com.greenwashradar.pipeline.dto.Claim;
import com.greenwashradar.pipeline.dto.ClaimAssessment;
import com.greenwashradar.pipeline.dto.ClaimConsistency;
import com.greenwashradar.pipeline.dto.EsgCategory;
import com.greenwashradar.pipeline.dto.Evidence;
import com.greenwashradar.pipeline.dto.JobKey;
import com.greenwashradar.pipeline.dto.OracleRequest;
import com.greenwashradar.pipeline.dto.OracleTask;
import com.greenwashradar.pipeline.dto.ReportDocument;
import com.greenwashradar.pipeline.entity.AnalysisJob;
import com.greenwashradar.pipeline.exception.MalformedOutputException;
import com.greenwashradar.pipeline.exception.OracleCallException;
import com.greenwashradar.pipeline.exception.OracleUnavailableException;
import com.greenwashradar.pipeline.exception.RateLimitedException;
import com.greenwashradar.pipeline.service.resilience.ExternalCallPolicy;
import com.greenwashradar.pipeline.support.PipelineTestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * AnalysisInvoker 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class AnalysisInvokerTest {

    private static final String ONE_CLAIM = "[{\"esg_category\": \"E\", \"sasb_topic\": \"Energy Management\","
            + " \"report_claim\": \"40% of power from renewables\", \"risk_score\": 2, \"key_word\": \"renewable\"}]";

    @Mock
    private ScoringOracle scoringOracle;

    private AnalysisInvoker invoker;
    private AnalysisJob job;
    private ReportDocument document;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = PipelineTestProperties.fast(3, 4);
        invoker = new AnalysisInvoker(scoringOracle, new ExternalCallPolicy(properties),
                new OracleResponseParser(new ObjectMapper(), properties), properties);
        job = AnalysisJob.create(new JobKey("1101", 2024), "Taiwan Cement", "Construction Materials", null);
        document = new ReportDocument("https://reports.example.com/1101.pdf", "application/pdf",
                "%PDF-1.7".getBytes(StandardCharsets.US_ASCII));
    }

    @Test
    @DisplayName("주장 추출 요청을 보내고 결과를 검증")
    void extractsClaims() {
        // given
        when(scoringOracle.complete(any())).thenReturn(ONE_CLAIM);

        // when
        List<Claim> claims = invoker.extractClaims(job, document);

        // then
        assertThat(claims).singleElement()
                .satisfies(claim -> {
                    assertThat(claim.getId()).isEqualTo("C1");
                    assertThat(claim.getCategory()).isEqualTo(EsgCategory.E);
                });
        ArgumentCaptor<OracleRequest> captor = ArgumentCaptor.forClass(OracleRequest.class);
        verify(scoringOracle).complete(captor.capture());
        OracleRequest request = captor.getValue();
        assertThat(request.getTask()).isEqualTo(OracleTask.CLAIM_EXTRACTION);
        assertThat(request.getJobKey()).isEqualTo("2024_1101");
        assertThat(request.getFramework()).isEqualTo("SASB");
        assertThat(request.getDocument()).isSameAs(document);
    }

    @Test
    @DisplayName("일시적 오류가 계속되면 재시도 후 ORACLE_UNAVAILABLE")
    void exhaustsRetriesOnTransientFailures() {
        // given
        when(scoringOracle.complete(any())).thenThrow(OracleCallException.serverError("gemini", 503));

        // then
        assertThatThrownBy(() -> invoker.extractClaims(job, document))
                .isInstanceOf(OracleUnavailableException.class)
                .hasMessageContaining("Retries exhausted");
        verify(scoringOracle, times(3)).complete(any());
    }

    @Test
    @DisplayName("429 응답도 재시도 대상")
    void retriesRateLimitedAnswers() {
        // given
        when(scoringOracle.complete(any()))
                .thenThrow(RateLimitedException.remote("gemini"))
                .thenReturn(ONE_CLAIM);

        // when
        List<Claim> claims = invoker.extractClaims(job, document);

        // then
        assertThat(claims).hasSize(1);
        verify(scoringOracle, times(2)).complete(any());
    }

    @Test
    @DisplayName("형식 오류는 한 번만 호출하고 그대로 전달")
    void malformedOutputIsNotRetried() {
        // given
        when(scoringOracle.complete(any())).thenReturn("Sorry, I cannot help with that.");

        // then
        assertThatThrownBy(() -> invoker.extractClaims(job, document))
                .isInstanceOf(MalformedOutputException.class);
        verify(scoringOracle, times(1)).complete(any());
    }

    @Test
    @DisplayName("요청 거절은 재시도 없이 전달")
    void rejectedRequestSurfacesImmediately() {
        // given
        when(scoringOracle.complete(any())).thenThrow(OracleCallException.rejected("gemini", 400));

        // then
        assertThatThrownBy(() -> invoker.extractClaims(job, document))
                .isInstanceOf(OracleCallException.class)
                .isNotInstanceOf(OracleUnavailableException.class);
        verify(scoringOracle, times(1)).complete(any());
    }

    @Test
    @DisplayName("서킷이 열리면 오라클을 호출하지 않고 즉시 실패")
    void openCircuitShortCircuitsCalls() {
        // given
        when(scoringOracle.complete(any())).thenThrow(OracleCallException.timeout("gemini", null));
        assertThatThrownBy(() -> invoker.extractClaims(job, document)).isInstanceOf(OracleUnavailableException.class);
        assertThatThrownBy(() -> invoker.extractClaims(job, document)).isInstanceOf(OracleUnavailableException.class);

        // then
        assertThatThrownBy(() -> invoker.extractClaims(job, document))
                .isInstanceOf(OracleUnavailableException.class)
                .hasMessageContaining("Circuit breaker open");
        verify(scoringOracle, times(4)).complete(any());
    }

    @Test
    @DisplayName("교차 검증 요청에 주장과 증거를 담아 보냄")
    void crossChecksClaimsWithEvidence() {
        // given
        Claim claim = Claim.builder().id("C1").category(EsgCategory.E).topic("Energy Management")
                .text("40% of power from renewables").riskScore(2).build();
        Evidence evidence = Evidence.builder().id("C1-E1").claimId("C1").url("https://news.example.com/a").build();
        when(scoringOracle.complete(any())).thenReturn(
                "[{\"claim_id\": \"C1\", \"consistency_status\": \"contradicted\", \"adjustment_score\": 4}]");

        // when
        List<ClaimAssessment> assessments = invoker.crossCheck(job, List.of(claim), Map.of("C1", List.of(evidence)));

        // then
        assertThat(assessments).singleElement()
                .extracting(ClaimAssessment::consistency)
                .isEqualTo(ClaimConsistency.CONTRADICTED);
        ArgumentCaptor<OracleRequest> captor = ArgumentCaptor.forClass(OracleRequest.class);
        verify(scoringOracle).complete(captor.capture());
        assertThat(captor.getValue().getTask()).isEqualTo(OracleTask.CROSS_CHECK);
        assertThat(captor.getValue().getEvidenceByClaim()).containsKey("C1");
    }
}
