package junie.email.intel.service;

import junie.email.intel.entity.ProcessingTier;
import junie.email.intel.model.AiDecision;
import junie.email.intel.model.RoutingDecision;
import org.springframework.stereotype.Component;

/**
 * Maps a tier to what happens with AI analysis.
 * Medium-tier routing only peeks at the budget; the actual reservation is taken by the batch
 * worker right before the call.
 */
@Component
public class TierRouter {
    private final BudgetService budgetService;

    public TierRouter(BudgetService budgetService) {
        this.budgetService = budgetService;
    }

    public RoutingDecision route(ProcessingTier tier, String userId) {
        switch (tier) {
            case HIGH:
                return new RoutingDecision(tier, AiDecision.INVOKE_NOW);
            case MEDIUM:
                return new RoutingDecision(tier,
                        budgetService.hasBudget(userId) ? AiDecision.QUEUE_BATCH : AiDecision.SKIP_BUDGET);
            case LOW:
            default:
                return new RoutingDecision(tier, AiDecision.DEFER_DIGEST);
        }
    }
}
