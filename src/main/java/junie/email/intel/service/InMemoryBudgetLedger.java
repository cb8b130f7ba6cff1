package junie.email.intel.service;

import junie.email.intel.config.BudgetProperties;
import junie.email.intel.model.BudgetReservation;
import junie.email.intel.model.BudgetStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-process ledger. One lock guards every account, which keeps the
 * check-and-reserve atomic without any storage round trip.
 */
@Slf4j
public class InMemoryBudgetLedger implements BudgetLedger {
    private final BudgetProperties properties;
    private final BudgetWindows windows;
    private final Map<String, Account> accounts = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public InMemoryBudgetLedger(BudgetProperties properties, Clock clock) {
        this.properties = properties;
        this.windows = new BudgetWindows(clock, properties.getZone());
    }

    @Override
    public Optional<BudgetReservation> tryReserve(String userId, long estimatedCents) {
        lock.lock();
        try {
            Account account = account(userId);
            if (account.dailyUsage + account.dailyReserved >= account.dailyLimit
                    || account.monthlyUsage + account.monthlyReserved >= account.monthlyLimit) {
                log.debug("Budget exhausted for user {}, reservation of {} cents refused", userId, estimatedCents);
                return Optional.empty();
            }
            account.dailyReserved += estimatedCents;
            account.monthlyReserved += estimatedCents;
            return Optional.of(new BudgetReservation(userId, estimatedCents));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public BudgetReservation forceReserve(String userId, long estimatedCents) {
        lock.lock();
        try {
            Account account = account(userId);
            account.dailyReserved += estimatedCents;
            account.monthlyReserved += estimatedCents;
            return new BudgetReservation(userId, estimatedCents);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public BudgetStatus settle(BudgetReservation reservation, long actualCents) {
        lock.lock();
        try {
            Account account = accounts.get(reservation.getUserId());
            if (account == null) {
                throw new NotFoundException("No budget for user " + reservation.getUserId());
            }
            account.dailyReserved = Math.max(0, account.dailyReserved - reservation.getEstimatedCents());
            account.monthlyReserved = Math.max(0, account.monthlyReserved - reservation.getEstimatedCents());
            account.dailyUsage += Math.max(0, actualCents);
            account.monthlyUsage += Math.max(0, actualCents);
            return account.toStatus(reservation.getUserId());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release(BudgetReservation reservation) {
        settle(reservation, 0);
    }

    @Override
    public BudgetStatus status(String userId) {
        lock.lock();
        try {
            return account(userId).toStatus(userId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateLimits(String userId, long dailyLimitCents, long monthlyLimitCents) {
        lock.lock();
        try {
            Account account = account(userId);
            account.dailyLimit = dailyLimitCents;
            account.monthlyLimit = monthlyLimitCents;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int resetExpiredWindows() {
        lock.lock();
        try {
            int reset = 0;
            for (Account account : accounts.values()) {
                reset += account.roll(windows.today(), windows.monthStart());
            }
            return reset;
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock
    private Account account(String userId) {
        Account account = accounts.computeIfAbsent(userId, id -> new Account(
                properties.getDefaultDailyLimitCents(),
                properties.getDefaultMonthlyLimitCents(),
                properties.getAlertAtPercent(),
                windows.today(),
                windows.monthStart()));
        if (account.roll(windows.today(), windows.monthStart()) > 0) {
            log.info("AI budget window reset for user {}", userId);
        }
        return account;
    }

    private static class Account {
        long dailyLimit;
        long monthlyLimit;
        final int alertAtPercent;
        long dailyUsage;
        long monthlyUsage;
        long dailyReserved;
        long monthlyReserved;
        LocalDate dailyWindowStart;
        LocalDate monthlyWindowStart;

        Account(long dailyLimit, long monthlyLimit, int alertAtPercent, LocalDate today, LocalDate monthStart) {
            this.dailyLimit = dailyLimit;
            this.monthlyLimit = monthlyLimit;
            this.alertAtPercent = alertAtPercent;
            this.dailyWindowStart = today;
            this.monthlyWindowStart = monthStart;
        }

        int roll(LocalDate today, LocalDate monthStart) {
            int reset = 0;
            if (dailyWindowStart.isBefore(today)) {
                dailyUsage = 0;
                dailyWindowStart = today;
                reset++;
            }
            if (monthlyWindowStart.isBefore(monthStart)) {
                monthlyUsage = 0;
                monthlyWindowStart = monthStart;
                reset++;
            }
            return reset;
        }

        BudgetStatus toStatus(String userId) {
            return BudgetStatus.builder()
                    .userId(userId)
                    .dailyUsageCents(dailyUsage)
                    .dailyLimitCents(dailyLimit)
                    .monthlyUsageCents(monthlyUsage)
                    .monthlyLimitCents(monthlyLimit)
                    .reservedCents(dailyReserved)
                    .alertAtPercent(alertAtPercent)
                    .build();
        }
    }
}
