package junie.email.intel.service;

import junie.email.intel.config.DigestProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UnsubscribeConfidenceCalculatorTest {

    private final UnsubscribeConfidenceCalculator calculator = new UnsubscribeConfidenceCalculator(new DigestProperties());

    @Test
    void confidence_WithFrequentPromotionalSender_ShouldBeSafe() {
        // When
        double confidence = calculator.confidence("deals@shop.com", 10, true, false);

        // Then
        assertEquals(1.0, confidence, 1e-9);
        assertTrue(calculator.isSafe(confidence));
        assertFalse(calculator.needsReview(confidence));
    }

    @Test
    void confidence_WithContentRichDomain_ShouldBeReducedToReview() {
        // When
        double plain = calculator.confidence("writer@example.com", 5, true, false);
        double contentRich = calculator.confidence("writer@substack.com", 5, true, false);

        // Then
        assertEquals(1.0, plain, 1e-9);
        assertEquals(0.8, contentRich, 1e-9);
        assertFalse(calculator.isSafe(contentRich));
        assertTrue(calculator.needsReview(contentRich));
    }

    @Test
    void confidence_ShouldNeverDecreaseWithMoreEmails() {
        // Given
        double previous = 0.0;

        // When / Then
        for (int count = 0; count <= 20; count++) {
            double current = calculator.confidence("someone@example.com", count, false, true);
            assertTrue(current >= previous, "confidence dropped at count " + count);
            previous = current;
        }
    }

    @Test
    void confidence_WithOccasionalPersonalSender_ShouldNotBeSuggested() {
        // When
        double confidence = calculator.confidence("friend@example.com", 1, false, false);

        // Then
        assertEquals(0.5, confidence, 1e-9);
        assertFalse(calculator.isSafe(confidence));
        assertFalse(calculator.needsReview(confidence));
    }

    @Test
    void confidence_WithFewEmails_ShouldNeedReview() {
        // When
        double confidence = calculator.confidence("friend@example.com", 3, false, false);

        // Then
        assertEquals(0.6, confidence, 1e-9);
        assertTrue(calculator.needsReview(confidence));
    }
}
