package junie.email.intel.config;

import junie.email.intel.repository.AiBudgetRepository;
import junie.email.intel.service.BudgetLedger;
import junie.email.intel.service.InMemoryBudgetLedger;
import junie.email.intel.service.JpaBudgetLedger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;

/**
 * Chooses the budget ledger. Set budget.ledger=memory for a single-node setup without
 * persisted budgets.
 */
@Configuration
public class BudgetLedgerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "budget.ledger", havingValue = "jpa", matchIfMissing = true)
    public BudgetLedger jpaBudgetLedger(AiBudgetRepository repository, BudgetProperties properties,
                                        Clock clock, PlatformTransactionManager transactionManager) {
        return new JpaBudgetLedger(repository, properties, clock, transactionManager);
    }

    @Bean
    @ConditionalOnProperty(name = "budget.ledger", havingValue = "memory")
    public BudgetLedger inMemoryBudgetLedger(BudgetProperties properties, Clock clock) {
        return new InMemoryBudgetLedger(properties, clock);
    }
}
