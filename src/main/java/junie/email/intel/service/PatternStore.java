package junie.email.intel.service;

import junie.email.intel.config.LearningProperties;
import junie.email.intel.entity.LearnedPattern;
import junie.email.intel.entity.PatternType;
import junie.email.intel.entity.ScoringPreferences;
import junie.email.intel.entity.SenderReputation;
import junie.email.intel.entity.UserActionType.Feedback;
import junie.email.intel.entity.VipSender;
import junie.email.intel.entity.VipStatus;
import junie.email.intel.model.PatternUpdate;
import junie.email.intel.model.ScoringProfile;
import junie.email.intel.repository.LearnedPatternRepository;
import junie.email.intel.repository.ScoringPreferencesRepository;
import junie.email.intel.repository.SenderReputationRepository;
import junie.email.intel.repository.VipSenderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Persistent per-user learning state: VIP senders, sender reputations and learned patterns.
 * Scoring reads it as a {@link ScoringProfile} snapshot; the feedback loop writes it.
 */
@Slf4j
@Service
public class PatternStore {
    private final VipSenderRepository vipSenderRepository;
    private final SenderReputationRepository reputationRepository;
    private final LearnedPatternRepository patternRepository;
    private final ScoringPreferencesRepository preferencesRepository;
    private final LearningProperties properties;

    public PatternStore(VipSenderRepository vipSenderRepository,
                        SenderReputationRepository reputationRepository,
                        LearnedPatternRepository patternRepository,
                        ScoringPreferencesRepository preferencesRepository,
                        LearningProperties properties) {
        this.vipSenderRepository = vipSenderRepository;
        this.reputationRepository = reputationRepository;
        this.patternRepository = patternRepository;
        this.preferencesRepository = preferencesRepository;
        this.properties = properties;
    }

    @Transactional(readOnly = true)
    public ScoringProfile loadProfile(String userId) {
        ScoringProfile.ScoringProfileBuilder builder = ScoringProfile.builder()
                .userId(userId)
                .preferences(preferences(userId));
        for (VipSender vip : vipSenderRepository.findByUserIdOrderBySenderEmail(userId)) {
            builder.vipSender(SenderAddresses.normalize(vip.getSenderEmail()), vip);
        }
        for (SenderReputation reputation : reputationRepository.findByUserId(userId)) {
            builder.reputation(SenderAddresses.normalize(reputation.getSenderEmail()), reputation);
        }
        builder.patterns(patternRepository.findConfident(userId,
                properties.getConfidentPatternThreshold(), properties.getMinPatternSamples()));
        return builder.build();
    }

    /**
     * Stored preferences, or the defaults for a user who never saved any.
     */
    @Transactional(readOnly = true)
    public ScoringPreferences preferences(String userId) {
        return preferencesRepository.findById(userId).orElseGet(() -> ScoringPreferences.defaults(userId));
    }

    /**
     * Moves a pattern's impact a fixed fraction towards the feedback direction and recomputes
     * its confidence. Neutral feedback leaves patterns alone.
     */
    @Transactional
    public PatternUpdate learn(String userId, PatternType type, String value, Feedback feedback, Instant now) {
        LearnedPattern pattern = patternRepository.findByUserIdAndPatternTypeAndPatternValue(userId, type, value)
                .orElseGet(() -> newPattern(userId, type, value, now));
        double previousImpact = pattern.getScoreImpact();

        if (feedback == Feedback.POSITIVE) {
            pattern.setPositiveCount(pattern.getPositiveCount() + 1);
        } else if (feedback == Feedback.NEGATIVE) {
            pattern.setNegativeCount(pattern.getNegativeCount() + 1);
        }
        if (feedback != Feedback.NEUTRAL) {
            double target = feedback == Feedback.POSITIVE ? properties.getMaxPatternImpact() : -properties.getMaxPatternImpact();
            double impact = previousImpact + properties.getPatternLearningRate() * (target - previousImpact);
            pattern.setScoreImpact(clampImpact(impact));
            pattern.setSampleCount(pattern.getSampleCount() + 1);
        }

        int directional = pattern.getPositiveCount() + pattern.getNegativeCount();
        double successRate = directional == 0
                ? 0.0
                : (double) Math.max(pattern.getPositiveCount(), pattern.getNegativeCount()) / directional;
        pattern.setSuccessRate(successRate);
        pattern.setConfidenceScore(sampleConfidence(pattern.getSampleCount()) * successRate);
        pattern.setLastSeenAt(now);
        patternRepository.save(pattern);

        log.debug("Pattern {}:{} for user {} now impact={} confidence={}",
                type, value, userId, pattern.getScoreImpact(), pattern.getConfidenceScore());
        return PatternUpdate.builder()
                .patternType(type)
                .patternValue(value)
                .previousImpact(previousImpact)
                .scoreImpact(pattern.getScoreImpact())
                .confidenceScore(pattern.getConfidenceScore())
                .sampleCount(pattern.getSampleCount())
                .confident(isConfident(pattern))
                .build();
    }

    /**
     * Saturating curve in [0, 1) over the number of samples.
     */
    public double sampleConfidence(int samples) {
        return 1 - Math.exp(-samples / properties.getConfidenceSampleScale());
    }

    public boolean isConfident(LearnedPattern pattern) {
        return pattern.getConfidenceScore() > properties.getConfidentPatternThreshold()
                && pattern.getSampleCount() >= properties.getMinPatternSamples();
    }

    @Transactional(readOnly = true)
    public List<VipSender> activeVipSenders(String userId) {
        return vipSenderRepository.findByUserIdAndStatus(userId, VipStatus.ACTIVE);
    }

    @Transactional
    public void recordVipUsage(String userId, String senderEmail, Instant now) {
        vipSenderRepository.incrementUsage(userId, SenderAddresses.normalize(senderEmail), now);
    }

    private double clampImpact(double impact) {
        double max = properties.getMaxPatternImpact();
        return Math.max(-max, Math.min(max, impact));
    }

    private static LearnedPattern newPattern(String userId, PatternType type, String value, Instant now) {
        LearnedPattern pattern = new LearnedPattern();
        pattern.setUserId(userId);
        pattern.setPatternType(type);
        pattern.setPatternValue(value);
        pattern.setCreatedAt(now);
        return pattern;
    }
}
