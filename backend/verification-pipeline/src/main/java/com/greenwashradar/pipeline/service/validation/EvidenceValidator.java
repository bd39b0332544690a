package com.greenwashradar.pipeline.service.validation;

import com.greenwashradar.pipeline.client.SecondaryVerificationOracle;
import com.greenwashradar.pipeline.dto.Evidence;
import com.greenwashradar.pipeline.dto.EvidenceLiveness;
import com.greenwashradar.pipeline.dto.ValidationContext;
import com.greenwashradar.pipeline.dto.ValidationReport;
import com.greenwashradar.pipeline.dto.VerificationRequest;
import com.greenwashradar.pipeline.dto.VerificationVerdict;
import com.greenwashradar.pipeline.exception.OracleUnavailableException;
import com.greenwashradar.pipeline.exception.PipelineErrorCode;
import com.greenwashradar.pipeline.exception.PipelineException;
import com.greenwashradar.pipeline.service.resilience.ExternalCallPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 증거(Evidence) 링크 검증 서비스
 * <p>
 * Unchecked links are probed. Every dead link gets exactly one repair search that excludes
 * the company's own site; a usable replacement takes over the URL and the item is marked
 * repaired, otherwise the item is dropped. Live items are passed through untouched, so
 * validating an already validated set costs nothing.
 * <p>
 * Per-item failures are contained. Only an open circuit on the verification oracle aborts
 * the whole pass.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvidenceValidator {

    public static final String DEPENDENCY = "verification-oracle";

    private static final int REPAIR_SNIPPET_LENGTH = 50;

    private final SecondaryVerificationOracle verificationOracle;
    private final ExternalCallPolicy callPolicy;
    private final OwnDomainPolicy ownDomainPolicy;

    public ValidationReport validate(List<Evidence> evidence, ValidationContext context) {
        List<Evidence> kept = new ArrayList<>();
        int alreadyLive = 0;
        int verified = 0;
        int repaired = 0;
        int dropped = 0;

        for (Evidence item : evidence) {
            if (item.getLiveness() == EvidenceLiveness.LIVE) {
                kept.add(item);
                alreadyLive++;
                continue;
            }
            if (item.getLiveness() == EvidenceLiveness.UNCHECKED && probe(item, context)) {
                kept.add(item.toBuilder().liveness(EvidenceLiveness.LIVE).build());
                verified++;
                continue;
            }
            Evidence replacement = repair(item, context);
            if (replacement != null) {
                kept.add(replacement);
                repaired++;
            } else {
                dropped++;
            }
        }

        log.info("[{}] Evidence validation: total={}, alreadyLive={}, verified={}, repaired={}, dropped={}",
                context.jobKey(), evidence.size(), alreadyLive, verified, repaired, dropped);
        return new ValidationReport(kept, alreadyLive, verified, repaired, dropped);
    }

    private boolean probe(Evidence item, ValidationContext context) {
        try {
            VerificationVerdict verdict = callPolicy.execute(DEPENDENCY,
                    () -> verificationOracle.verify(VerificationRequest.probe(item.getUrl())));
            if (!verdict.isLive()) {
                log.info("[{}] Dead evidence link {}: {}", context.jobKey(), item.getUrl(), verdict.reason());
            }
            return verdict.isLive();
        } catch (OracleUnavailableException e) {
            throw e;
        } catch (PipelineException e) {
            log.warn("[{}] Probe of {} failed, treating as dead: {}", context.jobKey(), item.getUrl(), e.getMessage());
            return false;
        }
    }

    /**
     * One repair search per dead item.
     *
     * @return repaired copy, or null when the item has to be dropped
     */
    private Evidence repair(Evidence item, ValidationContext context) {
        String subject = context.claimTextById().getOrDefault(item.getClaimId(), item.getSnippet());
        String query = repairQuery(context, subject);
        VerificationRequest request = VerificationRequest.repair(query, context.companyName(),
                context.reportYear(), ownDomainPolicy.excludedDomains(context));

        VerificationVerdict verdict;
        try {
            verdict = callPolicy.execute(DEPENDENCY, () -> verificationOracle.verify(request));
        } catch (OracleUnavailableException e) {
            throw e;
        } catch (PipelineException e) {
            logDropped(context, item, "repair search failed: " + e.getMessage());
            return null;
        }

        String replacementUrl = verdict.url();
        if (!verdict.isLive() || replacementUrl == null || replacementUrl.isBlank()) {
            logDropped(context, item, verdict.reason() != null ? verdict.reason() : "no replacement found");
            return null;
        }
        if (replacementUrl.equals(item.getUrl())) {
            logDropped(context, item, "replacement is the dead link itself");
            return null;
        }
        if (ownDomainPolicy.isOwnDomain(replacementUrl, context)) {
            logDropped(context, item, "replacement " + replacementUrl + " is on the company's own site");
            return null;
        }

        log.info("[{}] Repaired evidence {}: {} -> {}", context.jobKey(), item.getId(), item.getUrl(), replacementUrl);
        return item.toBuilder()
                .url(replacementUrl)
                .liveness(EvidenceLiveness.LIVE)
                .repaired(true)
                .originalUrl(item.isRepaired() ? item.getOriginalUrl() : item.getUrl())
                .build();
    }

    static String repairQuery(ValidationContext context, String subject) {
        String snippet = subject == null ? "" : subject.trim();
        if (snippet.length() > REPAIR_SNIPPET_LENGTH) {
            snippet = snippet.substring(0, REPAIR_SNIPPET_LENGTH);
        }
        return (context.companyName() + " " + context.reportYear() + " ESG " + snippet).trim();
    }

    private static void logDropped(ValidationContext context, Evidence item, String reason) {
        log.warn("[{}] {} dropping evidence {} ({}): {}", context.jobKey(),
                PipelineErrorCode.VALIDATION_REPAIR_FAILED, item.getId(), item.getUrl(), reason);
    }
}
