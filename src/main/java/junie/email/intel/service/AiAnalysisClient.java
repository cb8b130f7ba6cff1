package junie.email.intel.service;

import junie.email.intel.model.AiAnalysisRequest;
import junie.email.intel.model.AiAnalysisResponse;

/**
 * The external analysis capability. Implementations make exactly one remote call per
 * invocation; retries, timeouts and fallback belong to the caller.
 */
public interface AiAnalysisClient {
    /**
     * Quota or rate limit reached for the requested model. Retrying the same model is pointless.
     */
    class QuotaException extends RuntimeException {
        public QuotaException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * @throws QuotaException if the provider refuses the call for quota reasons
     */
    AiAnalysisResponse analyze(AiAnalysisRequest request);

    String providerName();
}
