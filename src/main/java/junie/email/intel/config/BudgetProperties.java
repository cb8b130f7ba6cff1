package junie.email.intel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "budget")
public class BudgetProperties {
    /** jpa or memory. */
    private String ledger = "jpa";

    private long defaultDailyLimitCents = 100;

    private long defaultMonthlyLimitCents = 2000;

    private int alertAtPercent = 80;

    /** Zone whose calendar defines the daily and monthly windows. */
    private String zone = "UTC";

    private String resetCron = "0 5 0 * * *";
}
