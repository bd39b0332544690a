package com.greenwashradar.pipeline.service.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.greenwashradar.pipeline.config.PipelineProperties;
import com.greenwashradar.pipeline.dto.Claim;
import com.greenwashradar.pipeline.dto.ClaimAssessment;
import com.greenwashradar.pipeline.dto.ClaimConsistency;
import com.greenwashradar.pipeline.dto.EsgCategory;
import com.greenwashradar.pipeline.exception.MalformedOutputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Turns raw oracle text into typed results, or rejects it.
 * <p>
 * Recovery is attempted in order: parse as is, strip markdown code fences, then close a
 * truncated top-level array after its last complete object. Whatever parses must then
 * pass field validation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OracleResponseParser {

    private static final Pattern FENCE = Pattern.compile("^```(?:json)?\\s*|\\s*```$", Pattern.MULTILINE);

    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;

    public List<Claim> parseClaims(String raw) {
        JsonNode items = unwrapArray(readWithRecovery(raw), "claims", "items");
        List<Claim> claims = new ArrayList<>();
        Set<String> topics = new HashSet<>();
        int index = 0;
        for (JsonNode item : items) {
            index++;
            if (!item.isObject()) {
                throw MalformedOutputException.invalidField(index, "*", "is not an object");
            }
            EsgCategory category = EsgCategory.parse(text(item, "esg_category"))
                    .orElseThrow(invalid(index, "esg_category", "must be E, S or G"));
            String topic = required(item, index, "sasb_topic");
            String claimText = required(item, index, "report_claim");
            int risk = score(item, index, "risk_score");

            topics.add(topic);
            claims.add(Claim.builder()
                    .id("C" + index)
                    .category(category)
                    .topic(topic)
                    .pageNumber(text(item, "page_number"))
                    .text(claimText)
                    .keyword(text(item, "key_word"))
                    .greenwashingFactor(text(item, "greenwashing_factor"))
                    .riskScore(risk)
                    .build());
        }

        int factor = properties.getAnalysis().getAbnormalItemsPerTopic();
        if (factor > 0 && !claims.isEmpty() && claims.size() > topics.size() * factor) {
            throw new MalformedOutputException("Repetitive extraction output: " + claims.size()
                    + " items over " + topics.size() + " unique topics");
        }
        if (claims.isEmpty()) {
            log.warn("Oracle extracted no claims");
        }
        return claims;
    }

    /**
     * @param submittedClaimIds claims sent for cross-check; any other id is rejected
     */
    public List<ClaimAssessment> parseAssessments(String raw, Set<String> submittedClaimIds) {
        JsonNode items = unwrapArray(readWithRecovery(raw), "assessments", "items");
        List<ClaimAssessment> assessments = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int index = 0;
        for (JsonNode item : items) {
            index++;
            String claimId = required(item, index, "claim_id");
            if (!submittedClaimIds.contains(claimId)) {
                throw MalformedOutputException.invalidField(index, "claim_id", "refers to unknown claim " + claimId);
            }
            if (!seen.add(claimId)) {
                throw MalformedOutputException.invalidField(index, "claim_id", "repeats claim " + claimId);
            }
            ClaimConsistency consistency = consistency(required(item, index, "consistency_status"), index);
            assessments.add(new ClaimAssessment(
                    claimId,
                    consistency,
                    score(item, index, "adjustment_score"),
                    text(item, "rationale"),
                    text(item, "external_evidence_url"),
                    text(item, "external_evidence")));
        }
        return assessments;
    }

    JsonNode readWithRecovery(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedOutputException("Oracle returned an empty answer");
        }
        JsonProcessingException failure;
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            failure = e;
        }

        String stripped = FENCE.matcher(raw.trim()).replaceAll("").trim();
        try {
            return objectMapper.readTree(stripped);
        } catch (JsonProcessingException e) {
            failure = e;
        }

        String repaired = repairTruncatedArray(stripped);
        if (repaired != null) {
            try {
                JsonNode node = objectMapper.readTree(repaired);
                log.warn("Recovered truncated oracle output, kept {} items", node.size());
                return node;
            } catch (JsonProcessingException e) {
                failure = e;
            }
        }
        throw MalformedOutputException.notJson(failure);
    }

    /**
     * Cuts a truncated array after its last complete object and closes it.
     *
     * @return repaired text, or null when the text is not an array or has no complete object
     */
    static String repairTruncatedArray(String text) {
        if (!text.startsWith("[")) {
            return null;
        }
        int lastComplete = text.lastIndexOf("},");
        if (lastComplete < 0) {
            lastComplete = text.lastIndexOf('}');
            if (lastComplete < 0) {
                return null;
            }
        }
        return text.substring(0, lastComplete + 1) + "]";
    }

    private static JsonNode unwrapArray(JsonNode root, String... wrapperFields) {
        if (root.isArray()) {
            return root;
        }
        for (String field : wrapperFields) {
            JsonNode candidate = root.path(field);
            if (candidate.isArray()) {
                return candidate;
            }
        }
        throw new MalformedOutputException("Oracle output is not a JSON array");
    }

    private static ClaimConsistency consistency(String raw, int index) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "consistent", "一致" -> ClaimConsistency.CONSISTENT;
            case "contradicted", "inconsistent", "不一致" -> ClaimConsistency.CONTRADICTED;
            case "unverified", "unknown", "無法驗證" -> ClaimConsistency.UNVERIFIED;
            default -> throw MalformedOutputException.invalidField(index, "consistency_status", "has unknown value " + raw);
        };
    }

    private static int score(JsonNode item, int index, String field) {
        JsonNode node = item.get(field);
        if (node == null || !(node.isInt() || node.isTextual() && node.asText().trim().matches("\\d"))) {
            throw MalformedOutputException.invalidField(index, field, "must be an integer");
        }
        int value = node.isInt() ? node.asInt() : Integer.parseInt(node.asText().trim());
        if (value < 0 || value > 4) {
            throw MalformedOutputException.invalidField(index, field, "must be between 0 and 4 but was " + value);
        }
        return value;
    }

    private static String required(JsonNode item, int index, String field) {
        String value = text(item, field);
        if (value == null || value.isBlank()) {
            throw MalformedOutputException.invalidField(index, field, "is missing");
        }
        return value.trim();
    }

    private static String text(JsonNode item, String field) {
        JsonNode node = item.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static Supplier<MalformedOutputException> invalid(int index, String field, String reason) {
        return () -> MalformedOutputException.invalidField(index, field, reason);
    }
}
