package junie.email.intel.service;

import junie.email.intel.config.BudgetProperties;
import junie.email.intel.entity.AiBudget;
import junie.email.intel.model.BudgetReservation;
import junie.email.intel.model.BudgetStatus;
import junie.email.intel.repository.AiBudgetRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Ledger backed by the {@code ai_budgets} table. Reservation, settlement and window resets
 * are each one conditional UPDATE, so several nodes can share the table.
 */
@Slf4j
public class JpaBudgetLedger implements BudgetLedger {
    private final AiBudgetRepository repository;
    private final BudgetProperties properties;
    private final BudgetWindows windows;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate newTransactionTemplate;

    public JpaBudgetLedger(AiBudgetRepository repository,
                           BudgetProperties properties,
                           Clock clock,
                           PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
        this.windows = new BudgetWindows(clock, properties.getZone());
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.newTransactionTemplate = new TransactionTemplate(transactionManager);
        this.newTransactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public Optional<BudgetReservation> tryReserve(String userId, long estimatedCents) {
        ensureBudget(userId);
        Integer rows = transactionTemplate.execute(status -> {
            rollWindows(userId);
            return repository.reserve(userId, estimatedCents, Instant.now(clock));
        });
        if (rows == null || rows == 0) {
            log.debug("Budget exhausted for user {}, reservation of {} cents refused", userId, estimatedCents);
            return Optional.empty();
        }
        return Optional.of(new BudgetReservation(userId, estimatedCents));
    }

    @Override
    public BudgetReservation forceReserve(String userId, long estimatedCents) {
        ensureBudget(userId);
        transactionTemplate.executeWithoutResult(status -> {
            rollWindows(userId);
            repository.reserveUnconditionally(userId, estimatedCents, Instant.now(clock));
        });
        return new BudgetReservation(userId, estimatedCents);
    }

    @Override
    public BudgetStatus settle(BudgetReservation reservation, long actualCents) {
        return transactionTemplate.execute(status -> {
            repository.settle(reservation.getUserId(), reservation.getEstimatedCents(),
                    Math.max(0, actualCents), Instant.now(clock));
            return load(reservation.getUserId());
        });
    }

    @Override
    public void release(BudgetReservation reservation) {
        transactionTemplate.executeWithoutResult(status ->
                repository.settle(reservation.getUserId(), reservation.getEstimatedCents(), 0, Instant.now(clock)));
    }

    @Override
    public BudgetStatus status(String userId) {
        ensureBudget(userId);
        return transactionTemplate.execute(status -> {
            rollWindows(userId);
            return load(userId);
        });
    }

    @Override
    public void updateLimits(String userId, long dailyLimitCents, long monthlyLimitCents) {
        ensureBudget(userId);
        transactionTemplate.executeWithoutResult(status ->
                repository.updateLimits(userId, dailyLimitCents, monthlyLimitCents, Instant.now(clock)));
    }

    @Override
    public int resetExpiredWindows() {
        Integer reset = transactionTemplate.execute(status -> {
            Instant now = Instant.now(clock);
            return repository.resetAllDailyWindows(windows.today(), now)
                    + repository.resetAllMonthlyWindows(windows.monthStart(), now);
        });
        return reset == null ? 0 : reset;
    }

    private void rollWindows(String userId) {
        Instant now = Instant.now(clock);
        if (repository.resetDailyWindow(userId, windows.today(), now) > 0) {
            log.info("Daily AI budget window reset for user {}", userId);
        }
        if (repository.resetMonthlyWindow(userId, windows.monthStart(), now) > 0) {
            log.info("Monthly AI budget window reset for user {}", userId);
        }
    }

    private BudgetStatus load(String userId) {
        AiBudget budget = repository.findById(userId)
                .orElseThrow(() -> new NotFoundException("No budget for user " + userId));
        return toStatus(budget);
    }

    private void ensureBudget(String userId) {
        if (repository.existsById(userId)) {
            return;
        }
        AiBudget budget = new AiBudget();
        budget.setUserId(userId);
        budget.setDailyLimitCents(properties.getDefaultDailyLimitCents());
        budget.setMonthlyLimitCents(properties.getDefaultMonthlyLimitCents());
        budget.setAlertAtPercent(properties.getAlertAtPercent());
        budget.setDailyWindowStart(windows.today());
        budget.setMonthlyWindowStart(windows.monthStart());
        budget.setUpdatedAt(Instant.now(clock));
        try {
            newTransactionTemplate.executeWithoutResult(status -> repository.saveAndFlush(budget));
            log.debug("Created AI budget for user {}", userId);
        } catch (DataIntegrityViolationException e) {
            // Another caller created the row first
            log.debug("AI budget for user {} already created concurrently", userId);
        }
    }

    static BudgetStatus toStatus(AiBudget budget) {
        return BudgetStatus.builder()
                .userId(budget.getUserId())
                .dailyUsageCents(budget.getDailyUsageCents())
                .dailyLimitCents(budget.getDailyLimitCents())
                .monthlyUsageCents(budget.getMonthlyUsageCents())
                .monthlyLimitCents(budget.getMonthlyLimitCents())
                .reservedCents(budget.getDailyReservedCents())
                .alertAtPercent(budget.getAlertAtPercent())
                .build();
    }
}
