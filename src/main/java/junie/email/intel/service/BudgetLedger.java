package junie.email.intel.service;

import junie.email.intel.model.BudgetReservation;
import junie.email.intel.model.BudgetStatus;

import java.util.Optional;

/**
 * Per-user daily and monthly AI spend, in whole cents.
 * <p>
 * Implementations must make {@link #tryReserve} a single atomic check-and-increment so that
 * concurrent callers can overshoot a limit by at most one invocation.
 */
public interface BudgetLedger {

    /**
     * Holds {@code estimatedCents} when {@code usage + reserved < limit} for both windows.
     * @return the reservation, or empty when either window is exhausted
     */
    Optional<BudgetReservation> tryReserve(String userId, long estimatedCents);

    /**
     * Holds the estimate regardless of the limits. High-priority mail is analysed even over budget
     * but its cost still counts.
     */
    BudgetReservation forceReserve(String userId, long estimatedCents);

    /**
     * Releases the reservation and adds the actual cost to both windows.
     * @return status after settlement
     */
    BudgetStatus settle(BudgetReservation reservation, long actualCents);

    /**
     * Drops the reservation without charging anything.
     */
    void release(BudgetReservation reservation);

    BudgetStatus status(String userId);

    void updateLimits(String userId, long dailyLimitCents, long monthlyLimitCents);

    /**
     * Zeroes usage of every window whose period has ended.
     * @return number of windows reset
     */
    int resetExpiredWindows();
}
