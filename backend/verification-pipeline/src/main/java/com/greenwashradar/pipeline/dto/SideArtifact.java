package com.greenwashradar.pipeline.dto;

/**
 * Non-critical by-product of claim extraction (the report word cloud).
 *
 * @param reference where the rendered artifact can be fetched, null when generation was skipped
 */
public record SideArtifact(String reference, int termCount) {

    public static SideArtifact skipped() {
        return new SideArtifact(null, 0);
    }

    public boolean isSkipped() {
        return reference == null;
    }
}
