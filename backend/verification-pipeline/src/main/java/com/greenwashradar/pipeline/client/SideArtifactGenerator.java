package com.greenwashradar.pipeline.client;

import com.greenwashradar.pipeline.dto.JobKey;
import com.greenwashradar.pipeline.dto.ReportDocument;
import com.greenwashradar.pipeline.dto.SideArtifact;

/**
 * Produces the non-critical companion artifact of a report (the word cloud).
 */
public interface SideArtifactGenerator {

    SideArtifact generate(JobKey key, ReportDocument document);
}
