package com.companionagent.common.exception;

/**
 * Failure raised inside a pipeline component. Nodes recover from it locally; it is
 * logged with the component tag and never aborts an in-flight turn.
 */
public class PipelineException extends RuntimeException {

    public enum FailureKind {
        /** Remote classifier did not answer in time; routing degrades to factual. */
        CLASSIFIER_TIMEOUT,
        /** Completion call failed or returned nothing usable. */
        PROVIDER_FAILURE,
        /** Judge reply held no parseable verdict. */
        VERDICT_PARSE_FAILURE,
        /** Critique job exhausted its retries. */
        QUEUE_JOB_FAILURE,
        /** Event log or snapshot could not be read or written. */
        STATE_RECOMPUTE_FAILURE
    }

    private final String component;
    private final FailureKind kind;

    public PipelineException(String component, FailureKind kind, String message) {
        super("[" + component + "] " + message);
        this.component = component;
        this.kind = kind;
    }

    public PipelineException(String component, FailureKind kind, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
        this.kind = kind;
    }

    public String getComponent() {
        return component;
    }

    public FailureKind getKind() {
        return kind;
    }
}
