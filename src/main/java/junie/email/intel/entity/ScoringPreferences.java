package junie.email.intel.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * Per-user configuration surface for scoring, budget and feature toggles.
 * Field defaults are the values a new user starts with.
 */
@Entity
@Table(name = "user_scoring_preferences")
@Data
public class ScoringPreferences {
    @Id
    @Column(name = "user_id")
    private String userId;

    // Factor weights, each 0-2
    private double vipSenderWeight = 1.0;
    private double urgentKeywordsWeight = 1.0;
    private double marketingPenaltyWeight = 1.0;
    private double timeDecayWeight = 1.0;
    private double gmailSignalsWeight = 1.0;

    // Learned pattern weights per pattern type, each 0-2
    private double senderPatternWeight = 1.0;
    private double subjectPatternWeight = 1.0;
    private double contentPatternWeight = 1.0;
    private double domainPatternWeight = 1.0;

    private int highPriorityThreshold = 80;
    private int mediumPriorityThreshold = 40;

    private long maxAiCostPerDayCents = 100;
    private long maxAiCostPerMonthCents = 2000;

    private boolean enablePatternLearning = true;
    private boolean enableWeeklyDigest = true;
    private boolean enableBulkUnsubscribe = true;
    private boolean autoPromoteVip = false;

    private Instant updatedAt;

    public double patternWeight(PatternType type) {
        switch (type) {
            case SENDER:
                return senderPatternWeight;
            case SUBJECT:
                return subjectPatternWeight;
            case CONTENT:
                return contentPatternWeight;
            case DOMAIN:
                return domainPatternWeight;
            default:
                throw new IllegalArgumentException("Unknown pattern type " + type);
        }
    }

    public static ScoringPreferences defaults(String userId) {
        ScoringPreferences preferences = new ScoringPreferences();
        preferences.setUserId(userId);
        return preferences;
    }
}
