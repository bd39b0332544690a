package com.greenwashradar.pipeline.dto;

/**
 * @param url the probed URL, or the replacement found by a repair search (null when none)
 */
public record VerificationVerdict(EvidenceLiveness liveness, String url, String reason) {

    public static VerificationVerdict live(String url) {
        return new VerificationVerdict(EvidenceLiveness.LIVE, url, null);
    }

    public static VerificationVerdict dead(String url, String reason) {
        return new VerificationVerdict(EvidenceLiveness.DEAD, url, reason);
    }

    public static VerificationVerdict notFound(String reason) {
        return new VerificationVerdict(EvidenceLiveness.DEAD, null, reason);
    }

    public boolean isLive() {
        return liveness == EvidenceLiveness.LIVE;
    }
}
