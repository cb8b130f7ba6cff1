package junie.email.intel.model;

import junie.email.intel.entity.ProcessingTier;
import junie.email.intel.entity.ScoreFactors;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScoreResult {
    int rawScore;
    int finalScore;
    ProcessingTier tier;
    ScoreFactors factors;
    String inferredCategory;
    boolean vipMatched;
}
