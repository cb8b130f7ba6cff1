package junie.email.intel.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for calling the analysis model: provider, model chain, retries, timeout,
 * breaker and the per-model price list.
 */
@Data
@ConfigurationProperties(prefix = "ai")
public class AiInvocationProperties {
    /** openai or gemini. */
    private String provider = "openai";

    private String primaryModel = "gpt-4o-mini";

    /** Tried after the primary model is exhausted; blank disables fallback. */
    private String fallbackModel = "gpt-3.5-turbo";

    private int maxTokens = 300;

    /** Attempts per model. */
    private int maxAttempts = 3;

    private Duration backoffBase = Duration.ofMillis(500);

    private Duration callTimeout = Duration.ofSeconds(20);

    /**
     * Least held against the budget while a call is in flight. The hold is raised to the most
     * the call can cost across models and attempts.
     */
    private long reservationCents = 1;

    /** Medium-tier analyses handled per batch run. */
    private int batchSize = 20;

    private long batchIntervalMs = 30000;

    private Breaker breaker = new Breaker();

    /** Cents per 1K tokens. */
    private Map<String, ModelPrice> pricing = defaultPricing();

    /** Price used for models missing from the table. */
    private String pricingFallbackModel = "gpt-4o-mini";

    @Data
    public static class Breaker {
        /** Consecutive failures that open the breaker. */
        private int failureThreshold = 5;
        private Duration cooldown = Duration.ofSeconds(60);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelPrice {
        private double promptCentsPer1k;
        private double completionCentsPer1k;
    }

    private static Map<String, ModelPrice> defaultPricing() {
        Map<String, ModelPrice> pricing = new LinkedHashMap<>();
        pricing.put("gpt-5-nano", new ModelPrice(0.005, 0.04));
        pricing.put("gpt-5-mini", new ModelPrice(0.025, 0.2));
        pricing.put("gpt-5", new ModelPrice(0.125, 1.0));
        pricing.put("gpt-4o-mini", new ModelPrice(0.015, 0.06));
        pricing.put("gpt-4", new ModelPrice(3, 6));
        pricing.put("gpt-4-turbo", new ModelPrice(1, 3));
        pricing.put("gpt-3.5-turbo", new ModelPrice(0.05, 0.15));
        pricing.put("gemini-pro", new ModelPrice(0.025, 0.05));
        return pricing;
    }
}
