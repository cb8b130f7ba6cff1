package junie.email.intel.model;

import junie.email.intel.entity.PatternType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PatternUpdate {
    PatternType patternType;
    String patternValue;
    double previousImpact;
    double scoreImpact;
    double confidenceScore;
    int sampleCount;
    boolean confident;
}
