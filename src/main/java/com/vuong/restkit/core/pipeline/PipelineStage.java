package com.vuong.restkit.core.pipeline;

/**
 * Where a request is in the pipeline.
 */
public enum PipelineStage {
    RECEIVED,
    METHOD_RESOLVED,
    VALIDATED,
    HANDLED,
    RESPONDED,
    ERROR_RESPONDED;

    public boolean isTerminal() {
        return this == RESPONDED || this == ERROR_RESPONDED;
    }
}
