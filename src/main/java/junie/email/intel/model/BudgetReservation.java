package junie.email.intel.model;

import lombok.Value;

/**
 * Estimate held against a user's budget while an invocation is in flight.
 */
@Value
public class BudgetReservation {
    String userId;
    long estimatedCents;
}
