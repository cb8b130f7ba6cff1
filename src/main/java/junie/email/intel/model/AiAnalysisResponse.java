package junie.email.intel.model;

import lombok.Builder;
import lombok.Value;

/**
 * Raw text returned by the capability together with the tokens it consumed.
 */
@Value
@Builder
public class AiAnalysisResponse {
    String content;
    String model;
    long promptTokens;
    long completionTokens;
}
