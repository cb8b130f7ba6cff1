package junie.email.intel.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BudgetStatus {
    String userId;
    long dailyUsageCents;
    long dailyLimitCents;
    long monthlyUsageCents;
    long monthlyLimitCents;
    long reservedCents;
    int alertAtPercent;

    public double dailyPercent() {
        return dailyLimitCents <= 0 ? 100.0 : dailyUsageCents * 100.0 / dailyLimitCents;
    }

    public double monthlyPercent() {
        return monthlyLimitCents <= 0 ? 100.0 : monthlyUsageCents * 100.0 / monthlyLimitCents;
    }

    public boolean isDailyExhausted() {
        return dailyUsageCents + reservedCents >= dailyLimitCents;
    }

    public boolean isMonthlyExhausted() {
        return monthlyUsageCents + reservedCents >= monthlyLimitCents;
    }

    public boolean isAlerting() {
        return dailyPercent() >= alertAtPercent || monthlyPercent() >= alertAtPercent;
    }
}
