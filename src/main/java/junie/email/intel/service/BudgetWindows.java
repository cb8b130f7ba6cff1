package junie.email.intel.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Calendar boundaries of the budget windows in the configured zone.
 */
public class BudgetWindows {
    private final Clock clock;
    private final ZoneId zone;

    public BudgetWindows(Clock clock, String zone) {
        this.clock = clock;
        this.zone = ZoneId.of(zone);
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(zone));
    }

    public LocalDate monthStart() {
        return today().withDayOfMonth(1);
    }
}
