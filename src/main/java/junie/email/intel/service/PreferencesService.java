package junie.email.intel.service;

import junie.email.intel.entity.ScoringPreferences;
import junie.email.intel.repository.ScoringPreferencesRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Service
public class PreferencesService {
    private final ScoringPreferencesRepository preferencesRepository;
    private final PatternStore patternStore;
    private final BudgetService budgetService;
    private final Clock clock;

    public PreferencesService(ScoringPreferencesRepository preferencesRepository,
                              PatternStore patternStore,
                              BudgetService budgetService,
                              Clock clock) {
        this.preferencesRepository = preferencesRepository;
        this.patternStore = patternStore;
        this.budgetService = budgetService;
        this.clock = clock;
    }

    public ScoringPreferences get(String userId) {
        return patternStore.preferences(userId);
    }

    /**
     * Replaces the user's preferences after validation and pushes budget limits to the ledger.
     * @throws InvalidPreferencesException when any value is out of range
     */
    @Transactional
    public ScoringPreferences update(String userId, ScoringPreferences preferences) {
        preferences.setUserId(userId);
        validate(preferences);
        preferences.setUpdatedAt(Instant.now(clock));
        ScoringPreferences saved = preferencesRepository.save(preferences);
        budgetService.applyLimits(saved);
        log.info("Scoring preferences updated for user {}", userId);
        return saved;
    }

    static void validate(ScoringPreferences p) {
        checkWeight("vipSenderWeight", p.getVipSenderWeight());
        checkWeight("urgentKeywordsWeight", p.getUrgentKeywordsWeight());
        checkWeight("marketingPenaltyWeight", p.getMarketingPenaltyWeight());
        checkWeight("timeDecayWeight", p.getTimeDecayWeight());
        checkWeight("gmailSignalsWeight", p.getGmailSignalsWeight());
        checkWeight("senderPatternWeight", p.getSenderPatternWeight());
        checkWeight("subjectPatternWeight", p.getSubjectPatternWeight());
        checkWeight("contentPatternWeight", p.getContentPatternWeight());
        checkWeight("domainPatternWeight", p.getDomainPatternWeight());

        if (p.getHighPriorityThreshold() < 50 || p.getHighPriorityThreshold() > 100) {
            throw new InvalidPreferencesException("highPriorityThreshold must be between 50 and 100");
        }
        if (p.getMediumPriorityThreshold() < 10 || p.getMediumPriorityThreshold() > 80) {
            throw new InvalidPreferencesException("mediumPriorityThreshold must be between 10 and 80");
        }
        if (p.getMediumPriorityThreshold() >= p.getHighPriorityThreshold()) {
            throw new InvalidPreferencesException("mediumPriorityThreshold must be below highPriorityThreshold");
        }
        if (p.getMaxAiCostPerDayCents() < 0 || p.getMaxAiCostPerMonthCents() < 0) {
            throw new InvalidPreferencesException("AI cost limits must not be negative");
        }
    }

    private static void checkWeight(String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 2) {
            throw new InvalidPreferencesException(name + " must be between 0 and 2");
        }
    }
}
