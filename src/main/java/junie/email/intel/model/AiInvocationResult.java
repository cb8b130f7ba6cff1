package junie.email.intel.model;

import junie.email.intel.entity.AiAnalysis;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class AiInvocationResult {
    public enum Outcome {
        SUCCESS,
        /** Breaker refused the call; the capability was not contacted. */
        BREAKER_OPEN,
        /** Every model and attempt failed. */
        EXHAUSTED
    }

    Outcome outcome;
    AiAnalysis analysis;
    /** Spend over all attempts. A timed-out attempt counts at its full token allowance. */
    BigDecimal costCents;
    /** Whole cents to charge to the budget. */
    long chargedCents;
    int attempts;
    String lastError;

    public static AiInvocationResult success(AiAnalysis analysis, BigDecimal costCents, long chargedCents, int attempts) {
        return new AiInvocationResult(Outcome.SUCCESS, analysis, costCents, chargedCents, attempts, null);
    }

    public static AiInvocationResult breakerOpen(BigDecimal costCents, long chargedCents, int attempts) {
        return new AiInvocationResult(Outcome.BREAKER_OPEN, null, costCents, chargedCents, attempts, "circuit breaker open");
    }

    public static AiInvocationResult exhausted(BigDecimal costCents, long chargedCents, int attempts, String lastError) {
        return new AiInvocationResult(Outcome.EXHAUSTED, null, costCents, chargedCents, attempts, lastError);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
