package com.greenwashradar.pipeline.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * URL 실존 여부 검증 (Liveness Check)
 *
 * Rejects malformed and obviously fabricated URLs without a request, then probes with
 * HEAD, falling back to GET. 2xx, 3xx and 403 count as alive: many news sites answer
 * 403 to non-browser clients while the article exists. Results are cached for a while.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UrlLivenessChecker {

    private final WebClient webClient;

    @Value("${pipeline.url-validation.timeout-seconds:10}")
    private int timeoutSeconds;

    @Value("${pipeline.url-validation.cache-ttl-minutes:30}")
    private int cacheTtlMinutes;

    private final Map<String, CachedProbe> cache = new ConcurrentHashMap<>();

    // LLM이 자주 생성하는 가짜 URL 패턴
    private static final List<Pattern> HALLUCINATION_URL_PATTERNS = List.of(
            Pattern.compile("example\\.(com|org|net)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("sample\\.com", Pattern.CASE_INSENSITIVE),
            Pattern.compile("placeholder\\.(com|org|net)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("/news/fake-", Pattern.CASE_INSENSITIVE),
            Pattern.compile("www\\d+\\.", Pattern.CASE_INSENSITIVE)
    );

    public record LivenessProbe(String url, boolean alive, int statusCode, String failureReason) {
    }

    private record CachedProbe(LivenessProbe probe, long cachedAt) {
    }

    public LivenessProbe check(String rawUrl) {
        String url = rawUrl == null ? "" : rawUrl.trim().replaceAll("^[\"']|[\"']$", "");

        CachedProbe cached = cache.get(url);
        if (cached != null && !isExpired(cached)) {
            return cached.probe();
        }

        LivenessProbe probe;
        if (!isValidUrlFormat(url)) {
            probe = new LivenessProbe(url, false, 0, "Invalid URL format");
        } else if (isLikelyHallucination(url)) {
            probe = new LivenessProbe(url, false, 0, "URL matches hallucination pattern");
        } else {
            probe = probe(url);
        }
        cache.put(url, new CachedProbe(probe, System.currentTimeMillis()));
        if (cache.size() > 1000) {
            cleanupExpiredCache();
        }
        return probe;
    }

    private LivenessProbe probe(String url) {
        try {
            Integer status = performHttpValidation(url).block();
            int code = status == null ? 0 : status;
            boolean alive = (code >= 200 && code < 400) || code == 403;
            return new LivenessProbe(url, alive, code, alive ? null : "HTTP " + code);
        } catch (RuntimeException e) {
            log.debug("Liveness probe failed for {}: {}", url, e.getMessage());
            String reason = e.getMessage() != null ? e.getMessage() : "Connection failed";
            return new LivenessProbe(url, false, 0, reason);
        }
    }

    private Mono<Integer> performHttpValidation(String url) {
        return webClient.method(HttpMethod.HEAD)
                .uri(url)
                .exchangeToMono(response -> Mono.just(response.statusCode().value()))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .flatMap(status -> status == 405 ? Mono.error(new IllegalStateException("HEAD not allowed")) : Mono.just(status))
                .onErrorResume(e -> webClient.method(HttpMethod.GET)
                        .uri(url)
                        .exchangeToMono(response -> response.releaseBody().thenReturn(response.statusCode().value()))
                        .timeout(Duration.ofSeconds(timeoutSeconds)));
    }

    private boolean isValidUrlFormat(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            String host = uri.getHost();
            return (scheme != null && (scheme.equals("http") || scheme.equals("https")))
                    && host != null && !host.isBlank();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private boolean isLikelyHallucination(String url) {
        for (Pattern pattern : HALLUCINATION_URL_PATTERNS) {
            if (pattern.matcher(url).find()) {
                log.debug("URL matches hallucination pattern: {}", url);
                return true;
            }
        }
        return false;
    }

    private boolean isExpired(CachedProbe cached) {
        return System.currentTimeMillis() > cached.cachedAt() + cacheTtlMinutes * 60 * 1000L;
    }

    private void cleanupExpiredCache() {
        cache.entrySet().removeIf(entry -> isExpired(entry.getValue()));
        log.info("Liveness cache cleanup completed. Remaining entries: {}", cache.size());
    }
}
