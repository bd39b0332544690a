package com.greenwashradar.pipeline.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.greenwashradar.pipeline.dto.VerificationRequest;
import com.greenwashradar.pipeline.dto.VerificationVerdict;
import com.greenwashradar.pipeline.exception.OracleCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Probes links with {@link UrlLivenessChecker} and asks Perplexity for replacement sources.
 */
@Component
@Slf4j
public class PerplexityVerificationOracle implements SecondaryVerificationOracle {

    private static final String ORACLE = "perplexity";
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{.*}", Pattern.DOTALL);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final UrlLivenessChecker livenessChecker;

    @Value("${PERPLEXITY_API_KEY:}")
    private String apiKey;

    @Value("${PERPLEXITY_BASE_URL:https://api.perplexity.ai}")
    private String baseUrl;

    @Value("${PERPLEXITY_MODEL:sonar}")
    private String model;

    @Value("${pipeline.oracle.perplexity.timeout-seconds:60}")
    private int timeoutSeconds;

    public PerplexityVerificationOracle(WebClient webClient, ObjectMapper objectMapper, UrlLivenessChecker livenessChecker) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.livenessChecker = livenessChecker;
    }

    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public VerificationVerdict verify(VerificationRequest request) {
        if (request.isProbe()) {
            UrlLivenessChecker.LivenessProbe probe = livenessChecker.check(request.candidateUrl());
            return probe.alive()
                    ? VerificationVerdict.live(probe.url())
                    : VerificationVerdict.dead(probe.url(), probe.failureReason());
        }
        return searchReplacement(request);
    }

    private VerificationVerdict searchReplacement(VerificationRequest request) {
        if (!isEnabled()) {
            return VerificationVerdict.notFound("Perplexity API key is not configured");
        }
        List<String> candidates = askForSources(request);
        for (String candidate : candidates) {
            if (isExcluded(candidate, request.excludedDomains())) {
                log.debug("Skipping excluded-domain source: {}", candidate);
                continue;
            }
            UrlLivenessChecker.LivenessProbe probe = livenessChecker.check(candidate);
            if (probe.alive()) {
                return VerificationVerdict.live(probe.url());
            }
        }
        return VerificationVerdict.notFound("No live third-party source among " + candidates.size() + " candidates");
    }

    private List<String> askForSources(VerificationRequest request) {
        String prompt = "Provide one reliable third-party source URL about \"" + request.claimText()
                + "\". Exclude any official website or domain of " + request.companyName()
                + ". Answer only with JSON: {\"urls\": [\"url1\"]}";
        Map<String, Object> body = Map.of(
                "model", model,
                "messages", List.of(Map.of("role", "user", "content", prompt)));

        String url = baseUrl.endsWith("/") ? baseUrl + "chat/completions" : baseUrl + "/chat/completions";
        String response = webClient.post()
                .uri(url)
                .header("Authorization", "Bearer " + apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .onErrorMap(e -> OracleErrorMapper.map(ORACLE, e))
                .block();
        return parseUrls(response);
    }

    List<String> parseUrls(String response) {
        List<String> urls = new ArrayList<>();
        if (response == null || response.isBlank()) {
            return urls;
        }
        try {
            String content = objectMapper.readTree(response)
                    .path("choices").path(0).path("message").path("content").asText("");
            Matcher matcher = JSON_OBJECT.matcher(content);
            if (!matcher.find()) {
                return urls;
            }
            JsonNode parsed = objectMapper.readTree(matcher.group());
            for (JsonNode node : parsed.path("urls")) {
                String candidate = node.asText("").trim();
                if (!candidate.isEmpty()) {
                    urls.add(candidate);
                }
            }
            return urls;
        } catch (JsonProcessingException e) {
            throw new OracleCallException("Perplexity returned an unreadable answer", false, e);
        }
    }

    private static boolean isExcluded(String candidate, Set<String> excludedDomains) {
        String host;
        try {
            host = URI.create(candidate.trim()).getHost();
        } catch (IllegalArgumentException e) {
            return true;
        }
        if (host == null) {
            return true;
        }
        String normalizedHost = host.toLowerCase(Locale.ROOT);
        return excludedDomains.stream()
                .map(domain -> domain.toLowerCase(Locale.ROOT))
                .anyMatch(domain -> normalizedHost.equals(domain) || normalizedHost.endsWith("." + domain));
    }
}
