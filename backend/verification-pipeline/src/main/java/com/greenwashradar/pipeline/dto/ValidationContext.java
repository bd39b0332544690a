package com.greenwashradar.pipeline.dto;

import java.util.Map;

/**
 * What the evidence validator needs to know about the job.
 *
 * @param companyDomain configured company website domain, may be null
 * @param claimTextById claim text used to build repair searches
 */
public record ValidationContext(
        String jobKey,
        String companyName,
        String companyDomain,
        int reportYear,
        Map<String, String> claimTextById
) {
}
