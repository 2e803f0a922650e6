package com.companionagent.common.model;

/** Next step of a turn, as chosen by {@link PipelineState#nextNode(int)}. */
public enum PipelineNode {
    PLAN,
    DRAFT,
    CRITIQUE,
    REPAIR,
    /** Attempts exhausted: the current draft is accepted as is. */
    FORCE_ACCEPT,
    END
}
