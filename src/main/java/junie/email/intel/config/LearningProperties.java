package junie.email.intel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Thresholds of the feedback loop. Nothing in the learning code hard-codes these.
 */
@Data
@ConfigurationProperties(prefix = "learning")
public class LearningProperties {
    private double patternLearningRate = 0.1;

    /** Impact target for positive feedback; negative feedback targets its negation. */
    private double maxPatternImpact = 50;

    /** A pattern must exceed this confidence to influence scores. */
    private double confidentPatternThreshold = 0.5;

    private int minPatternSamples = 2;

    /** Scale of the saturating sample curve {@code 1 - e^(-n/scale)}. */
    private double confidenceSampleScale = 3.0;

    private double vipPromotionConfidence = 0.75;

    private int vipMinSamples = 5;

    private int learnedVipScoreBoost = 25;

    private int maxSubjectKeywords = 3;

    private int minKeywordLength = 4;

    /** Pseudo-count that damps reputation for senders with few interactions. */
    private int reputationPriorWeight = 5;

    private Set<String> stopWords = new LinkedHashSet<>(List.of(
            "the", "and", "for", "with", "your", "from", "this", "that", "have", "will",
            "about", "re", "fw", "fwd", "you", "are", "our", "was", "has", "new", "please"));
}
