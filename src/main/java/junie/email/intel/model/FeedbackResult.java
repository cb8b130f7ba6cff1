package junie.email.intel.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class FeedbackResult {
    String actionId;
    boolean learningApplied;
    @Singular
    List<PatternUpdate> patternUpdates;
    @Singular
    List<VipPromotion> vipPromotions;
}
