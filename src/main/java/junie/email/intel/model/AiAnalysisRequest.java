package junie.email.intel.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class AiAnalysisRequest {
    String prompt;
    String modelHint;
    int maxTokens;
}
