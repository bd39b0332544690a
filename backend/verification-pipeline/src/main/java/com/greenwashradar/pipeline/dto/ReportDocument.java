package com.greenwashradar.pipeline.dto;

/**
 * Raw sustainability report. The content is opaque to the pipeline.
 */
public record ReportDocument(String sourceUrl, String contentType, byte[] content) {

    public int size() {
        return content == null ? 0 : content.length;
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
