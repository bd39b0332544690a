package com.greenwashradar.pipeline.service.orchestration.stage;

import com.greenwashradar.pipeline.dto.JobArtifacts;
import com.greenwashradar.pipeline.entity.AnalysisJob;
import com.greenwashradar.pipeline.entity.AnalysisStage;

/**
 * The work of one stage.
 * <p>
 * A handler reads the artifacts checkpointed by the earlier stages and returns the complete
 * artifact set to store with the next checkpoint. It must not modify the job it is given,
 * so running it again from the same checkpoint produces the same artifacts.
 */
public interface StageHandler {

    AnalysisStage stage();

    JobArtifacts execute(AnalysisJob job);
}
