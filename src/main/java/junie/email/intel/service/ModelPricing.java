package junie.email.intel.service;

import junie.email.intel.config.AiInvocationProperties;
import junie.email.intel.config.AiInvocationProperties.ModelPrice;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Token cost in cents from the configured price list.
 */
@Slf4j
@Component
public class ModelPricing {
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
    // Expensive single calls are worth a log line
    private static final BigDecimal HIGH_COST_CENTS = BigDecimal.TEN;

    private final AiInvocationProperties properties;

    public ModelPricing(AiInvocationProperties properties) {
        this.properties = properties;
    }

    public BigDecimal costCents(String model, long promptTokens, long completionTokens) {
        if (promptTokens < 0 || completionTokens < 0) {
            log.warn("Invalid token counts for {}: prompt={}, completion={}", model, promptTokens, completionTokens);
            return BigDecimal.ZERO;
        }
        ModelPrice price = properties.getPricing().get(model);
        if (price == null) {
            log.warn("No pricing found for model {}, using {}", model, properties.getPricingFallbackModel());
            price = properties.getPricing().get(properties.getPricingFallbackModel());
        }
        if (price == null) {
            throw new IllegalStateException("No pricing configured for " + model + " or the fallback model");
        }
        BigDecimal cost = BigDecimal.valueOf(promptTokens).multiply(BigDecimal.valueOf(price.getPromptCentsPer1k()))
                .add(BigDecimal.valueOf(completionTokens).multiply(BigDecimal.valueOf(price.getCompletionCentsPer1k())))
                .divide(THOUSAND, 6, RoundingMode.HALF_UP);
        if (cost.compareTo(HIGH_COST_CENTS) > 0) {
            log.info("High cost operation: {} cents for {} ({} tokens)", cost, model, promptTokens + completionTokens);
        }
        return cost;
    }

    /**
     * The ledger works in whole cents and never under-charges.
     */
    public static long chargeableCents(BigDecimal costCents) {
        return costCents.setScale(0, RoundingMode.CEILING).longValueExact();
    }
}
