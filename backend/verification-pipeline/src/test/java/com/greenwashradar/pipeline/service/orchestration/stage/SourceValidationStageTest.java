package com.greenwashradar.pipeline.service.orchestration.stage;

import com.greenwashradar.pipeline.client.SideArtifactGenerator;
import com.greenwashradar.pipeline.dto.AnalysisBundle;
import com.greenwashradar.pipeline.dto.Claim;
import com.greenwashradar.pipeline.dto.EsgCategory;
import com.greenwashradar.pipeline.dto.Evidence;
import com.greenwashradar.pipeline.dto.EvidenceLiveness;
import com.greenwashradar.pipeline.dto.JobArtifacts;
import com.greenwashradar.pipeline.dto.JobKey;
import com.greenwashradar.pipeline.dto.ReportDocument;
import com.greenwashradar.pipeline.dto.ReportDocumentRef;
import com.greenwashradar.pipeline.dto.SideArtifact;
import com.greenwashradar.pipeline.dto.ValidationContext;
import com.greenwashradar.pipeline.dto.ValidationReport;
import com.greenwashradar.pipeline.entity.AnalysisJob;
import com.greenwashradar.pipeline.service.analysis.RiskSummaryCalculator;
import com.greenwashradar.pipeline.service.storage.AnalysisResultWriter;
import com.greenwashradar.pipeline.service.storage.ReportArchive;
import com.greenwashradar.pipeline.service.validation.EvidenceValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * SourceValidationStage 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class SourceValidationStageTest {

    private static final JobKey KEY = new JobKey("1101", 2024);
    private static final ReportDocumentRef DOCUMENT_REF = new ReportDocumentRef("2024_1101.pdf",
            "https://reports.example.com/1101.pdf", "application/pdf", 4, "abcd");
    private static final ReportDocument DOCUMENT = new ReportDocument(
            "https://reports.example.com/1101.pdf", "application/pdf", new byte[]{1, 2, 3, 4});

    @Mock
    private EvidenceValidator evidenceValidator;

    @Mock
    private SideArtifactGenerator sideArtifactGenerator;

    @Mock
    private ReportArchive reportArchive;

    @Mock
    private AnalysisResultWriter resultWriter;

    private SourceValidationStage stage;

    @BeforeEach
    void setUp() {
        stage = new SourceValidationStage(evidenceValidator, sideArtifactGenerator, reportArchive,
                resultWriter, new RiskSummaryCalculator());
    }

    private static Evidence evidence(String id, String claimId) {
        return Evidence.builder()
                .id(id)
                .claimId(claimId)
                .url("https://news.example.com/" + id)
                .title("기사 " + id)
                .liveness(EvidenceLiveness.UNCHECKED)
                .build();
    }

    private static AnalysisJob job(boolean sidePending, String sideRef) {
        Claim claim = Claim.builder()
                .id("c-1")
                .category(EsgCategory.E)
                .topic("GHG Emissions")
                .text("2030년까지 탄소 배출량 50% 감축")
                .riskScore(2)
                .evidenceIds(new ArrayList<>(List.of("ev-1", "ev-2")))
                .build();
        AnalysisJob job = AnalysisJob.create(KEY, "Taiwan Cement", "Cement", null);
        job.setArtifacts(JobArtifacts.builder()
                .document(DOCUMENT_REF)
                .claims(new ArrayList<>(List.of(claim)))
                .evidence(new ArrayList<>(List.of(evidence("ev-1", "c-1"), evidence("ev-2", "c-1"))))
                .sideArtifactRef(sideRef)
                .sideArtifactPending(sidePending)
                .build());
        return job;
    }

    private void validatorKeepsOnlyFirst() {
        Evidence live = evidence("ev-1", "c-1").toBuilder().liveness(EvidenceLiveness.LIVE).build();
        given(evidenceValidator.validate(anyList(), any(ValidationContext.class)))
                .willReturn(new ValidationReport(List.of(live), 0, 1, 0, 1));
    }

    private AnalysisBundle writtenBundle() {
        ArgumentCaptor<AnalysisBundle> captor = ArgumentCaptor.forClass(AnalysisBundle.class);
        verify(resultWriter).write(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("부가 산출물 재시도")
    class SideArtifactRetry {

        @Test
        @DisplayName("pending 산출물은 전달 전에 한 번 재생성된다")
        void pendingRetriedOnceBeforeHandOff() {
            // given
            AnalysisJob job = job(true, null);
            validatorKeepsOnlyFirst();
            given(reportArchive.load(DOCUMENT_REF)).willReturn(DOCUMENT);
            given(sideArtifactGenerator.generate(KEY, DOCUMENT))
                    .willReturn(new SideArtifact("wordcloud/2024_1101.png", 40));

            // when
            JobArtifacts result = stage.execute(job);

            // then
            verify(sideArtifactGenerator, times(1)).generate(KEY, DOCUMENT);
            assertThat(result.isSideArtifactPending()).isFalse();
            assertThat(result.getSideArtifactRef()).isEqualTo("wordcloud/2024_1101.png");
            assertThat(writtenBundle().sideArtifactRef()).isEqualTo("wordcloud/2024_1101.png");
        }

        @Test
        @DisplayName("재시도도 실패하면 산출물 없이 전달하고 pending 을 유지한다")
        void failedRetryStillHandsOff() {
            // given
            AnalysisJob job = job(true, null);
            validatorKeepsOnlyFirst();
            given(reportArchive.load(DOCUMENT_REF)).willReturn(DOCUMENT);
            given(sideArtifactGenerator.generate(KEY, DOCUMENT))
                    .willThrow(new IllegalStateException("word cloud service down"));

            // when
            JobArtifacts result = stage.execute(job);

            // then
            verify(sideArtifactGenerator, times(1)).generate(KEY, DOCUMENT);
            assertThat(result.isSideArtifactPending()).isTrue();
            assertThat(result.getSideArtifactRef()).isNull();
            assertThat(writtenBundle().sideArtifactRef()).isNull();
        }

        @Test
        @DisplayName("이미 생성된 산출물은 다시 만들지 않는다")
        void notPendingSkipsRetry() {
            // given
            AnalysisJob job = job(false, "wordcloud/existing.png");
            validatorKeepsOnlyFirst();

            // when
            JobArtifacts result = stage.execute(job);

            // then
            verifyNoInteractions(sideArtifactGenerator, reportArchive);
            assertThat(result.getSideArtifactRef()).isEqualTo("wordcloud/existing.png");
        }
    }

    @Nested
    @DisplayName("근거 정리")
    class EvidencePruning {

        @Test
        @DisplayName("제거된 근거는 클레임 참조에서도 빠지고 요약과 함께 전달된다")
        void droppedEvidenceUnlinkedFromClaims() {
            // given
            AnalysisJob job = job(false, "wordcloud/existing.png");
            validatorKeepsOnlyFirst();

            // when
            JobArtifacts result = stage.execute(job);

            // then
            assertThat(result.getEvidence()).extracting(Evidence::getId).containsExactly("ev-1");
            assertThat(result.getClaims().get(0).getEvidenceIds()).containsExactly("ev-1");
            assertThat(result.getRiskSummary()).isNotNull();
            assertThat(result.getRiskSummary().claimCount()).isEqualTo(1);

            AnalysisBundle bundle = writtenBundle();
            assertThat(bundle.jobKey()).isEqualTo("2024_1101");
            assertThat(bundle.reportSourceUrl()).isEqualTo("https://reports.example.com/1101.pdf");
            assertThat(bundle.evidence()).extracting(Evidence::getId).containsExactly("ev-1");
        }
    }
}
