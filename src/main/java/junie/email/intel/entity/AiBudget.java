package junie.email.intel.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Budget ledger row. All amounts are whole cents.
 */
@Entity
@Table(name = "ai_budgets")
@Data
public class AiBudget {
    @Id
    @Column(name = "user_id")
    private String userId;

    private long dailyLimitCents = 100;
    private long monthlyLimitCents = 2000;
    private int alertAtPercent = 80;

    private long dailyUsageCents;
    private long monthlyUsageCents;

    // Estimates held by in-flight invocations
    private long dailyReservedCents;
    private long monthlyReservedCents;

    private LocalDate dailyWindowStart;
    private LocalDate monthlyWindowStart;

    private Instant updatedAt;
}
