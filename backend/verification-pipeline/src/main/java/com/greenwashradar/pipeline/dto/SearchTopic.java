package com.greenwashradar.pipeline.dto;

/**
 * One news search subject derived from a claim.
 *
 * @param topicId  identifier used to key results, normally the claim id
 * @param phrase   claim text or a short phrase from it
 * @param keyword  topic keyword used by the broader tier
 */
public record SearchTopic(
        String topicId,
        String companyName,
        String industry,
        Integer reportYear,
        String phrase,
        String keyword
) {

    public static SearchTopic forClaim(Claim claim, String companyName, String industry, int reportYear) {
        String keyword = claim.getKeyword() != null && !claim.getKeyword().isBlank()
                ? claim.getKeyword()
                : claim.getTopic();
        // undisclosed topics carry "N/A" as claim text; only the broader tiers make sense for them
        String phrase = claim.getText() == null || "N/A".equalsIgnoreCase(claim.getText().trim())
                ? null
                : claim.getText();
        return new SearchTopic(claim.getId(), companyName, industry, reportYear, phrase, keyword);
    }
}
