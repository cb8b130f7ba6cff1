package junie.email.intel.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class LearningStatistics {
    long totalActions;
    Map<String, Long> actionsByType;
    Map<String, Long> actionsByFeedback;
    long activeVipSenders;
    long suggestedVipSenders;
    long learnedPatterns;
    long confidentPatterns;
}
