package com.companionagent.orchestrator.completion;

/** Every kind of provider call the orchestrator makes. Each maps to one configured model. */
public enum CompletionTask {
    CLASSIFIER,
    PLANNER,
    DRAFT_NANO,
    DRAFT_PRO,
    REPAIR,
    JUDGE
}
