package junie.email.intel.entity;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed breakdown of a score into its additive contributions.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreFactors {
    private int base;
    private int vipBoost;
    private int urgencyBoost;
    private int marketingPenalty;
    private int providerSignalBoost;
    private int timeDecay;
    private int contentAnalysis;
    private int senderReputation;
    private int learnedPatternAdjustment;

    public int sum() {
        return base + vipBoost + urgencyBoost + marketingPenalty + providerSignalBoost
                + timeDecay + contentAnalysis + senderReputation + learnedPatternAdjustment;
    }

    /**
     * Factor names as exposed to API consumers, in a stable order.
     */
    public Map<String, Integer> asMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("base", base);
        map.put("vip_boost", vipBoost);
        map.put("urgency_boost", urgencyBoost);
        map.put("marketing_penalty", marketingPenalty);
        map.put("provider_signal_boost", providerSignalBoost);
        map.put("time_decay", timeDecay);
        map.put("content_analysis", contentAnalysis);
        map.put("sender_reputation", senderReputation);
        map.put("learned_pattern_adjustment", learnedPatternAdjustment);
        return map;
    }
}
