package com.greenwashradar.pipeline.fetcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.greenwashradar.pipeline.config.PipelineProperties;
import com.greenwashradar.pipeline.dto.NewsArticle;
import com.greenwashradar.pipeline.exception.FetchException;
import com.greenwashradar.pipeline.exception.RateLimitedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * 뉴스 검색 API 클라이언트
 *
 * Expects the common {@code items[]} response shape with title, description,
 * originallink/link and pubDate fields. HTML markup in titles is stripped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SearchApiNewsFetcher implements NewsFetcher {

    public static final String SOURCE_ID = "news-search";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final PipelineProperties properties;

    @Value("${pipeline.news-search.url:}")
    private String searchUrl;

    @Value("${pipeline.news-search.client-id:}")
    private String clientId;

    @Value("${pipeline.news-search.client-secret:}")
    private String clientSecret;

    @Value("${pipeline.news-search.client-id-header:X-Naver-Client-Id}")
    private String clientIdHeader;

    @Value("${pipeline.news-search.client-secret-header:X-Naver-Client-Secret}")
    private String clientSecretHeader;

    @Value("${pipeline.news-search.timeout-seconds:15}")
    private int timeoutSeconds;

    @Override
    public String getSourceId() {
        return SOURCE_ID;
    }

    @Override
    public boolean isAvailable() {
        return searchUrl != null && !searchUrl.isBlank();
    }

    @Override
    public List<NewsArticle> fetch(String query) {
        if (!isAvailable()) {
            log.debug("News search is not configured, returning no articles for: {}", query);
            return List.of();
        }
        String url = UriComponentsBuilder.fromUriString(searchUrl)
                .queryParam("query", query)
                .queryParam("display", properties.getFetch().getArticlesPerQuery())
                .queryParam("sort", "sim")
                .encode()
                .build()
                .toUriString();

        String body = webClient.get()
                .uri(url)
                .headers(headers -> {
                    if (clientId != null && !clientId.isBlank()) {
                        headers.set(clientIdHeader, clientId);
                        headers.set(clientSecretHeader, clientSecret);
                    }
                })
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .onErrorMap(WebClientResponseException.class, e -> e.getStatusCode().value() == 429
                        ? RateLimitedException.remote(SOURCE_ID)
                        : FetchException.forStatus(SOURCE_ID, e.getStatusCode().value()))
                .onErrorMap(WebClientRequestException.class, e -> new FetchException("News search unreachable: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class, e -> FetchException.timeout(SOURCE_ID, e))
                .block();

        List<NewsArticle> articles = parse(body);
        log.debug("News search returned {} articles for: {}", articles.size(), query);
        return articles;
    }

    List<NewsArticle> parse(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FetchException("News search returned unreadable body", e);
        }
        List<NewsArticle> articles = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            String title = cleanHtml(item.path("title").asText(""));
            String link = item.path("originallink").asText("");
            if (link.isEmpty()) {
                link = item.path("link").asText("");
            }
            if (title.isEmpty() || link.isEmpty()) {
                continue;
            }
            String description = cleanHtml(item.path("description").asText(""));
            articles.add(new NewsArticle(link, title, description, item.path("pubDate").asText(null)));
        }
        return articles;
    }

    private String cleanHtml(String text) {
        if (text == null) return "";
        return text.replaceAll("<[^>]*>", "")
                   .replaceAll("&quot;", "\"")
                   .replaceAll("&amp;", "&")
                   .replaceAll("&lt;", "<")
                   .replaceAll("&gt;", ">")
                   .replaceAll("&nbsp;", " ")
                   .trim();
    }
}
