package com.greenwashradar.pipeline.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.greenwashradar.pipeline.dto.OracleRequest;
import com.greenwashradar.pipeline.dto.OracleTask;
import com.greenwashradar.pipeline.exception.OracleCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gemini {@code generateContent} adapter. The report PDF is sent inline; the task
 * instructions come from configuration and the job context is appended as JSON.
 */
@Component
@Slf4j
public class GeminiScoringOracle implements ScoringOracle {

    private static final String ORACLE = "gemini";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    @Value("${GEMINI_API_KEY:}")
    private String apiKey;

    @Value("${pipeline.oracle.gemini.base-url:https://generativelanguage.googleapis.com}")
    private String baseUrl;

    @Value("${pipeline.oracle.gemini.model:models/gemini-2.5-flash}")
    private String model;

    @Value("${pipeline.oracle.gemini.temperature:0.1}")
    private double temperature;

    @Value("${pipeline.oracle.gemini.timeout-seconds:300}")
    private int timeoutSeconds;

    @Value("${pipeline.oracle.extraction-instructions:Extract every sustainability claim of the attached report as a JSON array.}")
    private String extractionInstructions;

    @Value("${pipeline.oracle.cross-check-instructions:Compare each claim with its news evidence and answer with a JSON array of assessments.}")
    private String crossCheckInstructions;

    public GeminiScoringOracle(WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String complete(OracleRequest request) {
        if (!isEnabled()) {
            throw new OracleCallException("Gemini API key is not configured", false);
        }
        String url = baseUrl + "/v1beta/" + model + ":generateContent";

        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("role", "user", "parts", parts(request))),
                "generationConfig", Map.of(
                        "temperature", temperature,
                        "responseMimeType", "application/json"));

        log.debug("[{}] Calling Gemini {} for {}", request.getJobKey(), model, request.getTask());
        String response = webClient.post()
                .uri(url)
                .header("x-goog-api-key", apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .onErrorMap(e -> OracleErrorMapper.map(ORACLE, e))
                .block();

        return extractText(response);
    }

    private List<Map<String, Object>> parts(OracleRequest request) {
        List<Map<String, Object>> parts = new ArrayList<>();
        if (request.getDocument() != null && !request.getDocument().isEmpty()) {
            parts.add(Map.of("inline_data", Map.of(
                    "mime_type", request.getDocument().contentType(),
                    "data", Base64.getEncoder().encodeToString(request.getDocument().content()))));
        }
        String instructions = request.getTask() == OracleTask.CLAIM_EXTRACTION
                ? extractionInstructions
                : crossCheckInstructions;
        parts.add(Map.of("text", instructions + "\n\n" + context(request)));
        return parts;
    }

    private String context(OracleRequest request) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("company", request.getCompanyName());
        context.put("industry", request.getIndustry());
        context.put("year", request.getReportYear());
        context.put("framework", request.getFramework());
        if (request.getTask() == OracleTask.CROSS_CHECK) {
            context.put("claims", request.getClaims());
            context.put("evidence", request.getEvidenceByClaim());
        }
        try {
            return objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize oracle context", e);
        }
    }

    private String extractText(String response) {
        if (response == null || response.isBlank()) {
            return "";
        }
        try {
            JsonNode root = objectMapper.readTree(response);
            StringBuilder text = new StringBuilder();
            for (JsonNode part : root.path("candidates").path(0).path("content").path("parts")) {
                text.append(part.path("text").asText(""));
            }
            return text.toString();
        } catch (JsonProcessingException e) {
            throw new OracleCallException("Gemini returned an unreadable envelope", false, e);
        }
    }
}
