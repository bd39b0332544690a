package com.greenwashradar.pipeline.dto;

/**
 * Pointer to a report document kept in the local archive.
 */
public record ReportDocumentRef(
        String archiveKey,
        String sourceUrl,
        String contentType,
        long sizeBytes,
        String sha256
) {
}
