package junie.email.intel.service;

import junie.email.intel.entity.ScoringPreferences;
import junie.email.intel.model.BudgetAlertEvent;
import junie.email.intel.model.BudgetReservation;
import junie.email.intel.model.BudgetStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Front of the budget ledger: reservations, settlement with alerting, and the nightly reset.
 */
@Slf4j
@Service
public class BudgetService {
    private final BudgetLedger ledger;
    private final ApplicationEventPublisher eventPublisher;

    public BudgetService(BudgetLedger ledger, ApplicationEventPublisher eventPublisher) {
        this.ledger = ledger;
        this.eventPublisher = eventPublisher;
    }

    public Optional<BudgetReservation> tryReserve(String userId, long estimatedCents) {
        return ledger.tryReserve(userId, estimatedCents);
    }

    public BudgetReservation forceReserve(String userId, long estimatedCents) {
        return ledger.forceReserve(userId, estimatedCents);
    }

    public BudgetStatus settle(BudgetReservation reservation, long actualCents) {
        BudgetStatus after = ledger.settle(reservation, actualCents);
        publishIfCrossed(after, actualCents, "daily", after.getDailyUsageCents(), after.getDailyLimitCents());
        publishIfCrossed(after, actualCents, "monthly", after.getMonthlyUsageCents(), after.getMonthlyLimitCents());
        return after;
    }

    public void release(BudgetReservation reservation) {
        ledger.release(reservation);
    }

    public BudgetStatus getStatus(String userId) {
        return ledger.status(userId);
    }

    public boolean hasBudget(String userId) {
        BudgetStatus status = ledger.status(userId);
        return !status.isDailyExhausted() && !status.isMonthlyExhausted();
    }

    public void applyLimits(ScoringPreferences preferences) {
        ledger.updateLimits(preferences.getUserId(),
                preferences.getMaxAiCostPerDayCents(),
                preferences.getMaxAiCostPerMonthCents());
        log.info("AI budget limits for user {} set to {} cents/day, {} cents/month",
                preferences.getUserId(), preferences.getMaxAiCostPerDayCents(), preferences.getMaxAiCostPerMonthCents());
    }

    /**
     * Nightly reset. Lazy resets on access use the same conditional guard, so a window is
     * reset once whichever path reaches it first.
     */
    @Scheduled(cron = "${budget.reset-cron:0 5 0 * * *}", zone = "${budget.zone:UTC}")
    public void resetExpiredWindows() {
        try {
            int reset = ledger.resetExpiredWindows();
            log.info("Budget window reset completed, {} windows reset", reset);
        } catch (Exception e) {
            log.error("Error resetting budget windows: {}", e.getMessage(), e);
        }
    }

    @EventListener
    public void onBudgetAlert(BudgetAlertEvent event) {
        log.warn("AI budget alert for user {}: {}", event.getUserId(), event.getMessage());
    }

    private void publishIfCrossed(BudgetStatus status, long chargedCents, String window, long usage, long limit) {
        if (limit <= 0 || chargedCents <= 0) {
            return;
        }
        long threshold = status.getAlertAtPercent() * limit;
        long before = usage - chargedCents;
        if (before * 100 < threshold && usage * 100 >= threshold) {
            double percent = usage * 100.0 / limit;
            eventPublisher.publishEvent(BudgetAlertEvent.builder()
                    .userId(status.getUserId())
                    .window(window)
                    .percentUsed(percent)
                    .usageCents(usage)
                    .limitCents(limit)
                    .message(String.format("%s AI budget at %.0f%% (%d of %d cents)", window, percent, usage, limit))
                    .build());
        }
    }
}
