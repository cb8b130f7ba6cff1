package junie.email.intel.service;

import junie.email.intel.config.AiInvocationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class ModelPricingTest {

    private ModelPricing modelPricing;

    @BeforeEach
    void setUp() {
        modelPricing = new ModelPricing(new AiInvocationProperties());
    }

    @Test
    void costCents_WithKnownModel_ShouldUsePerThousandPrices() {
        // When
        BigDecimal cost = modelPricing.costCents("gpt-4", 1000, 500);

        // Then
        assertEquals(0, new BigDecimal("6").compareTo(cost));
    }

    @Test
    void costCents_WithUnknownModel_ShouldUseFallbackPrice() {
        // When
        BigDecimal unknown = modelPricing.costCents("some-future-model", 2000, 1000);
        BigDecimal fallback = modelPricing.costCents("gpt-4o-mini", 2000, 1000);

        // Then
        assertEquals(0, fallback.compareTo(unknown));
    }

    @Test
    void costCents_WithNegativeTokens_ShouldReturnZero() {
        assertEquals(BigDecimal.ZERO, modelPricing.costCents("gpt-4o-mini", -1, 10));
    }

    @Test
    void chargeableCents_ShouldRoundUpFractions() {
        assertEquals(0, ModelPricing.chargeableCents(BigDecimal.ZERO));
        assertEquals(1, ModelPricing.chargeableCents(new BigDecimal("0.000001")));
        assertEquals(2, ModelPricing.chargeableCents(new BigDecimal("1.2")));
        assertEquals(3, ModelPricing.chargeableCents(new BigDecimal("3.000000")));
    }
}
