package com.greenwashradar.pipeline.dto;

import java.util.Set;

/**
 * Request to the secondary verification oracle. Either probes a candidate URL
 * or searches for a replacement source for a claim.
 */
public record VerificationRequest(
        String candidateUrl,
        String claimText,
        String companyName,
        int reportYear,
        Set<String> excludedDomains
) {

    public static VerificationRequest probe(String url) {
        return new VerificationRequest(url, null, null, 0, Set.of());
    }

    public static VerificationRequest repair(String claimText, String companyName, int reportYear,
                                             Set<String> excludedDomains) {
        return new VerificationRequest(null, claimText, companyName, reportYear, Set.copyOf(excludedDomains));
    }

    public boolean isProbe() {
        return candidateUrl != null;
    }
}
