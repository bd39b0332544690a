package com.greenwashradar.pipeline.dto;

/**
 * Verdict of comparing a report claim against external evidence.
 */
public enum ClaimConsistency {
    /** Not cross-checked yet. */
    PENDING,
    CONSISTENT,
    CONTRADICTED,
    /** Evidence was found but did not settle the claim. */
    UNVERIFIED,
    /** All search tiers came back empty. */
    NO_EVIDENCE,
    /** The news search failed for this claim. */
    SEARCH_FAILED
}
