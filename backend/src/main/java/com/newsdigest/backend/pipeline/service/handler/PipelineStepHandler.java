package com.newsdigest.backend.pipeline.service.handler;

import com.newsdigest.backend.pipeline.entity.PipelineStep;
import com.newsdigest.backend.pipeline.service.StepContext;

/**
 * Work of one declared step. Steps without a handler belong to upstream collaborators and
 * complete without work.
 */
public interface PipelineStepHandler {

    PipelineStep step();

    /**
     * Run the step. Throwing {@link com.newsdigest.backend.exception.StepInterruptedException}
     * pauses the run; any other exception fails it.
     */
    void execute(StepContext context);
}
