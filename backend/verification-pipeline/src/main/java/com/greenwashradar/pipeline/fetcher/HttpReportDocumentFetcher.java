package com.greenwashradar.pipeline.fetcher;

import com.greenwashradar.pipeline.dto.ReportDocument;
import com.greenwashradar.pipeline.dto.ReportQuery;
import com.greenwashradar.pipeline.exception.DocumentNotFoundException;
import com.greenwashradar.pipeline.exception.FetchException;
import com.greenwashradar.pipeline.exception.RateLimitedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Downloads report PDFs from the report repository service.
 * The URL template receives {@code {year}} and {@code {companyCode}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HttpReportDocumentFetcher implements ReportDocumentFetcher {

    public static final String SOURCE_ID = "report-source";

    private final WebClient webClient;

    @Value("${pipeline.report-source.url-template:}")
    private String urlTemplate;

    @Value("${pipeline.report-source.timeout-seconds:120}")
    private int timeoutSeconds;

    @Override
    public String getSourceId() {
        return SOURCE_ID;
    }

    @Override
    public boolean isAvailable() {
        return urlTemplate != null && !urlTemplate.isBlank();
    }

    @Override
    public ReportDocument fetch(ReportQuery query) {
        if (!isAvailable()) {
            throw new FetchException("Report source URL template is not configured", false);
        }
        String url = UriComponentsBuilder.fromUriString(urlTemplate)
                .buildAndExpand(query.reportYear(), query.companyCode())
                .toUriString();
        log.info("Downloading report: company={}, year={}, url={}", query.companyCode(), query.reportYear(), url);

        ResponseEntity<byte[]> response = webClient.get()
                .uri(url)
                .accept(MediaType.APPLICATION_PDF, MediaType.APPLICATION_OCTET_STREAM)
                .retrieve()
                .toEntity(byte[].class)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .onErrorMap(WebClientResponseException.class, e -> mapStatus(e, query))
                .onErrorMap(WebClientRequestException.class, e -> new FetchException("Report source unreachable: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class, e -> FetchException.timeout(SOURCE_ID, e))
                .block();

        if (response == null || response.getBody() == null || response.getBody().length == 0) {
            throw DocumentNotFoundException.atSource(query.companyCode(), query.reportYear());
        }
        MediaType contentType = response.getHeaders().getContentType();
        byte[] body = response.getBody();
        log.info("Downloaded report: company={}, year={}, bytes={}", query.companyCode(), query.reportYear(), body.length);
        return new ReportDocument(url, contentType != null ? contentType.toString() : MediaType.APPLICATION_PDF_VALUE, body);
    }

    private RuntimeException mapStatus(WebClientResponseException e, ReportQuery query) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        if (status == HttpStatus.NOT_FOUND) {
            return DocumentNotFoundException.atSource(query.companyCode(), query.reportYear());
        }
        if (status == HttpStatus.TOO_MANY_REQUESTS) {
            return RateLimitedException.remote(SOURCE_ID);
        }
        return FetchException.forStatus(SOURCE_ID, e.getStatusCode().value());
    }
}
