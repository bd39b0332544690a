package com.greenwashradar.pipeline.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.greenwashradar.pipeline.dto.JobKey;
import com.greenwashradar.pipeline.dto.ReportDocument;
import com.greenwashradar.pipeline.dto.SideArtifact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Sends the report to the word-cloud renderer. Without a configured endpoint generation is skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WordCloudServiceClient implements SideArtifactGenerator {

    private final WebClient webClient;

    @Value("${pipeline.word-cloud.base-url:}")
    private String baseUrl;

    @Value("${pipeline.word-cloud.timeout-seconds:120}")
    private int timeoutSeconds;

    @Override
    public SideArtifact generate(JobKey key, ReportDocument document) {
        if (baseUrl == null || baseUrl.isBlank()) {
            log.debug("[{}] Word cloud service not configured, skipping", key);
            return SideArtifact.skipped();
        }
        JsonNode response = webClient.post()
                .uri(baseUrl + "/api/word-clouds/{jobKey}", key.asString())
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue(document.content())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .block();

        if (response == null || response.path("artifactRef").asText("").isEmpty()) {
            throw new IllegalStateException("Word cloud service returned no artifact reference for " + key);
        }
        SideArtifact artifact = new SideArtifact(response.path("artifactRef").asText(), response.path("termCount").asInt(0));
        log.info("[{}] Word cloud generated: {} ({} terms)", key, artifact.reference(), artifact.termCount());
        return artifact;
    }
}
