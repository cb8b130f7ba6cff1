package junie.email.intel.service;

import junie.email.intel.config.LearningProperties;
import junie.email.intel.config.ScoringProperties;
import junie.email.intel.entity.EmailRecord;
import junie.email.intel.entity.LearnedPattern;
import junie.email.intel.entity.PatternType;
import junie.email.intel.entity.ProcessingTier;
import junie.email.intel.entity.ScoreFactors;
import junie.email.intel.entity.ScoringPreferences;
import junie.email.intel.entity.SenderReputation;
import junie.email.intel.entity.VipSender;
import junie.email.intel.model.ScoringProfile;
import junie.email.intel.model.ScoreResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Rule-based multi-factor scorer.
 * <p>
 * The result depends only on the email, the profile and the evaluation instant: no storage
 * access and no mutable state, so one instance is shared across threads.
 */
@Component
public class EmailScoringEngine {
    static final int URGENCY_FIRST_MATCH = 20;
    static final int URGENCY_EXTRA_MATCH = 5;
    static final int URGENCY_CAP = 25;

    static final int MARKETING_FIRST_SIGNAL = -30;
    static final int MARKETING_EXTRA_SIGNAL = -5;
    static final int MARKETING_FLOOR = -40;

    static final int IMPORTANT_BOOST = 15;
    static final int STARRED_BOOST = 10;
    static final int UNREAD_BOOST = 5;

    static final int FRESH_BOOST = 10;
    static final Duration FRESH_AGE = Duration.ofHours(2);
    static final Duration STALE_AGE = Duration.ofHours(24);
    static final double STALE_DECAY_HOURS = 72.0;

    static final int MAX_VIP_BOOST = 50;
    static final int REPUTATION_BOUND = 10;
    static final double MAX_PATTERN_IMPACT = 50.0;

    private final ScoringProperties properties;
    private final LearningProperties learningProperties;
    private final CategoryInferenceStrategy categoryInference;

    public EmailScoringEngine(ScoringProperties properties,
                              LearningProperties learningProperties,
                              CategoryInferenceStrategy categoryInference) {
        this.properties = properties;
        this.learningProperties = learningProperties;
        this.categoryInference = categoryInference;
    }

    public ScoreResult score(EmailRecord email, ScoringProfile profile, Instant now) {
        ScoringPreferences prefs = profile.getPreferences() != null
                ? profile.getPreferences()
                : ScoringPreferences.defaults(profile.getUserId());
        String sender = SenderAddresses.normalize(email.getSenderEmail());

        VipSender vip = profile.getVipSenders().get(sender);
        boolean vipMatched = vip != null && vip.isActive();

        ScoreFactors factors = ScoreFactors.builder()
                .base(properties.getBaseScore())
                .vipBoost(vipMatched ? weighted(clamp(vip.getScoreBoost(), 0, MAX_VIP_BOOST), prefs.getVipSenderWeight()) : 0)
                .urgencyBoost(weighted(urgency(email), prefs.getUrgentKeywordsWeight()))
                .marketingPenalty(weighted(marketingPenalty(email, sender), prefs.getMarketingPenaltyWeight()))
                .providerSignalBoost(weighted(providerSignals(email), prefs.getGmailSignalsWeight()))
                .timeDecay(timeDecay(email, now, prefs.getTimeDecayWeight()))
                .contentAnalysis(contentAnalysis(email))
                .senderReputation(senderReputation(profile.getReputations().get(sender)))
                .learnedPatternAdjustment(learnedPatternAdjustment(email, sender, profile.getPatterns(), prefs))
                .build();

        int raw = factors.sum();
        int finalScore = clamp(raw, 0, 100);
        return ScoreResult.builder()
                .rawScore(raw)
                .finalScore(finalScore)
                .tier(tierFor(finalScore, prefs))
                .factors(factors)
                .inferredCategory(categoryInference.inferCategory(email))
                .vipMatched(vipMatched)
                .build();
    }

    public static ProcessingTier tierFor(int finalScore, ScoringPreferences prefs) {
        if (finalScore >= prefs.getHighPriorityThreshold()) {
            return ProcessingTier.HIGH;
        }
        if (finalScore >= prefs.getMediumPriorityThreshold()) {
            return ProcessingTier.MEDIUM;
        }
        return ProcessingTier.LOW;
    }

    int urgency(EmailRecord email) {
        String text = lower(email.getSubject()) + " " + lower(email.getSnippet());
        Set<String> matched = new LinkedHashSet<>();
        for (String keyword : properties.getUrgentKeywords()) {
            if (text.contains(keyword.toLowerCase(Locale.ROOT))) {
                matched.add(keyword.toLowerCase(Locale.ROOT));
            }
        }
        if (matched.isEmpty()) {
            return 0;
        }
        return Math.min(URGENCY_CAP, URGENCY_FIRST_MATCH + URGENCY_EXTRA_MATCH * (matched.size() - 1));
    }

    /**
     * Counts distinct kinds of marketing evidence, not individual keyword hits.
     */
    int marketingPenalty(EmailRecord email, String sender) {
        String headline = lower(email.getSubject()) + " " + lower(email.getSnippet());
        String fullText = headline + " " + lower(email.getBody());
        int kinds = 0;
        if (KeywordCategoryInference.containsAny(headline, properties.getPromotionalKeywords())) {
            kinds++;
        }
        if (KeywordCategoryInference.containsAny(fullText, properties.getUnsubscribeMarkers())) {
            kinds++;
        }
        if (email.getLabels() != null && email.getLabels().stream()
                .anyMatch(label -> properties.getPromotionalLabels().stream().anyMatch(label::equalsIgnoreCase))) {
            kinds++;
        }
        if (isMarketingSender(sender)) {
            kinds++;
        }
        if (kinds == 0) {
            return 0;
        }
        return Math.max(MARKETING_FLOOR, MARKETING_FIRST_SIGNAL + MARKETING_EXTRA_SIGNAL * (kinds - 1));
    }

    boolean isMarketingSender(String sender) {
        return properties.getMarketingDomains().contains(SenderAddresses.domain(sender))
                || KeywordCategoryInference.startsWithAny(SenderAddresses.localPart(sender), properties.getMarketingSenderPrefixes());
    }

    static int providerSignals(EmailRecord email) {
        int boost = 0;
        if (email.isImportant()) {
            boost += IMPORTANT_BOOST;
        }
        if (email.isStarred()) {
            boost += STARRED_BOOST;
        }
        if (email.isUnread()) {
            boost += UNREAD_BOOST;
        }
        return boost;
    }

    /**
     * Fresh mail gets a bonus. Unread mail older than a day decays towards -15, never below.
     */
    static int timeDecay(EmailRecord email, Instant now, double weight) {
        if (email.getReceivedAt() == null || now == null) {
            return 0;
        }
        Duration age = Duration.between(email.getReceivedAt(), now);
        if (age.isNegative() || age.compareTo(FRESH_AGE) < 0) {
            return weighted(FRESH_BOOST, weight);
        }
        if (age.compareTo(STALE_AGE) <= 0 || !email.isUnread()) {
            return 0;
        }
        double hoursPastStale = (age.toMillis() - STALE_AGE.toMillis()) / 3_600_000.0;
        double decay = -(5 + 10 * (1 - Math.exp(-hoursPastStale / STALE_DECAY_HOURS)));
        return (int) Math.round(decay * weight);
    }

    int contentAnalysis(EmailRecord email) {
        String subject = lower(email.getSubject());
        String text = subject + " " + lower(email.getSnippet()) + " " + lower(email.getBody());
        int adjustment = 0;
        if (subject.contains("?")) {
            adjustment += 3;
        }
        if (KeywordCategoryInference.containsAny(text, properties.getActionPhrases())) {
            adjustment += 5;
        }
        if (KeywordCategoryInference.containsAny(text, properties.getMeetingKeywords())) {
            adjustment += 3;
        }
        if (email.getBody() != null && email.getBody().length() > properties.getLongBodyChars()) {
            adjustment -= 2;
        }
        return clamp(adjustment, -5, 10);
    }

    /**
     * Net positive share, damped by a pseudo-count so a single interaction cannot move
     * the score much.
     */
    int senderReputation(SenderReputation reputation) {
        if (reputation == null || reputation.getSampleCount() == 0) {
            return 0;
        }
        double n = reputation.getSampleCount();
        double net = (reputation.getPositiveCount() - reputation.getNegativeCount()) / n;
        double damping = n / (n + learningProperties.getReputationPriorWeight());
        return clamp((int) Math.round(REPUTATION_BOUND * net * damping), -REPUTATION_BOUND, REPUTATION_BOUND);
    }

    int learnedPatternAdjustment(EmailRecord email, String sender, List<LearnedPattern> patterns,
                                 ScoringPreferences prefs) {
        if (patterns == null || patterns.isEmpty()) {
            return 0;
        }
        List<LearnedPattern> ordered = new ArrayList<>(patterns);
        ordered.sort(Comparator.comparing(LearnedPattern::getPatternType)
                .thenComparing(LearnedPattern::getPatternValue));

        String domain = SenderAddresses.domain(sender);
        String subject = lower(email.getSubject());
        String content = lower(email.getSnippet()) + " " + lower(email.getBody());
        double total = 0;
        for (LearnedPattern pattern : ordered) {
            if (!isConfident(pattern) || !matches(pattern, sender, domain, subject, content)) {
                continue;
            }
            double impact = Math.max(-MAX_PATTERN_IMPACT, Math.min(MAX_PATTERN_IMPACT, pattern.getScoreImpact()));
            total += impact * prefs.patternWeight(pattern.getPatternType());
        }
        return (int) Math.round(total);
    }

    boolean isConfident(LearnedPattern pattern) {
        return pattern.getConfidenceScore() > learningProperties.getConfidentPatternThreshold()
                && pattern.getSampleCount() >= learningProperties.getMinPatternSamples();
    }

    private static boolean matches(LearnedPattern pattern, String sender, String domain, String subject, String content) {
        String value = lower(pattern.getPatternValue());
        if (value.isEmpty()) {
            return false;
        }
        PatternType type = pattern.getPatternType();
        switch (type) {
            case SENDER:
                return value.equals(sender);
            case DOMAIN:
                return value.equals(domain);
            case SUBJECT:
                return subject.contains(value);
            case CONTENT:
                return content.contains(value);
            default:
                return false;
        }
    }

    private static int weighted(int value, double weight) {
        return (int) Math.round(value * weight);
    }

    static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
