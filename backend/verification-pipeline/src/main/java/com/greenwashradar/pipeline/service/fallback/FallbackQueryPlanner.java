package com.greenwashradar.pipeline.service.fallback;

import com.greenwashradar.pipeline.config.PipelineProperties;
import com.greenwashradar.pipeline.dto.FallbackQuery;
import com.greenwashradar.pipeline.dto.SearchTopic;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the ordered search tiers for one topic.
 * <ol>
 *   <li>company name with the quoted claim phrase</li>
 *   <li>company name, industry and topic keyword</li>
 *   <li>company name alone</li>
 * </ol>
 * Blank and duplicate tiers are skipped. The same topic always yields the same tiers.
 */
@Component
@RequiredArgsConstructor
public class FallbackQueryPlanner {

    private final PipelineProperties properties;

    public FallbackQuery plan(SearchTopic topic) {
        String company = normalize(topic.companyName());
        String year = properties.getFallback().isIncludeYear() && topic.reportYear() != null
                ? String.valueOf(topic.reportYear())
                : "";

        Set<String> tiers = new LinkedHashSet<>();
        if (!company.isEmpty()) {
            String phrase = truncate(stripQuotes(normalize(topic.phrase())));
            if (!phrase.isEmpty()) {
                tiers.add(join(company, "\"" + phrase + "\"", year));
            }

            String keyword = normalize(topic.keyword());
            if (!keyword.isEmpty()) {
                tiers.add(join(company, normalize(topic.industry()), keyword, year));
            }

            tiers.add(company);
        }
        return new FallbackQuery(topic.topicId(), new ArrayList<>(tiers));
    }

    private String truncate(String phrase) {
        int max = properties.getFallback().getMaxPhraseLength();
        if (max <= 0 || phrase.length() <= max) {
            return phrase;
        }
        return phrase.substring(0, max).trim();
    }

    private static String join(String... parts) {
        List<String> present = new ArrayList<>();
        for (String part : parts) {
            if (part != null && !part.isBlank()) {
                present.add(part.trim());
            }
        }
        return String.join(" ", present);
    }

    private static String stripQuotes(String text) {
        return text.replace("\"", "").replace("“", "").replace("”", "").replace("「", "").replace("」", "").trim();
    }

    private static String normalize(String text) {
        return text == null ? "" : text.trim().replaceAll("\\s+", " ");
    }
}
