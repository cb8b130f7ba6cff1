package junie.email.intel.entity;

/**
 * Where an email stands with respect to AI analysis.
 */
public enum AiStatus {
    /** Waiting in the medium-tier batch queue. */
    QUEUED,
    /** Being analysed inline by the request that scored it. */
    IN_PROGRESS,
    COMPLETED,
    /** Budget exhausted, rule-based score only. */
    SKIPPED_BUDGET,
    /** Low tier, left for the weekly digest. */
    DEFERRED_TO_DIGEST,
    /** Every model failed, rule-based score only. */
    FAILED_FALLBACK,
    /** Breaker was open, rule-based score only. */
    BREAKER_OPEN
}
