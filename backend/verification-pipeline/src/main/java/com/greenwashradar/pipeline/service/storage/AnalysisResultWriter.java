package com.greenwashradar.pipeline.service.storage;

import com.greenwashradar.pipeline.dto.AnalysisBundle;

/**
 * Downstream consumer of finished analyses. Writing the same job key twice must leave
 * the same result as writing it once.
 */
public interface AnalysisResultWriter {

    void write(AnalysisBundle bundle);
}
