package junie.email.intel.model;

public enum AiDecision {
    INVOKE_NOW,
    QUEUE_BATCH,
    SKIP_BUDGET,
    DEFER_DIGEST
}
