package junie.email.intel.service;

import junie.email.intel.config.DigestProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * How sure we are that the user would not miss a low-priority sender.
 * Non-decreasing in the number of emails, all else equal.
 */
@Component
public class UnsubscribeConfidenceCalculator {
    static final double BASE = 0.5;

    private final DigestProperties properties;

    public UnsubscribeConfidenceCalculator(DigestProperties properties) {
        this.properties = properties;
    }

    /**
     * @return confidence in [0, 1], rounded to two decimals
     */
    public double confidence(String sender, int emailCount, boolean promotional, boolean newsletter) {
        double confidence = BASE;
        if (emailCount >= 10) {
            confidence += 0.4;
        } else if (emailCount >= 5) {
            confidence += 0.2;
        } else if (emailCount >= 3) {
            confidence += 0.1;
        }
        if (promotional) {
            confidence += 0.3;
        }
        if (newsletter) {
            confidence += 0.1;
        }
        if (isContentRich(sender)) {
            confidence -= 0.2;
        }
        double clamped = Math.max(0.0, Math.min(1.0, confidence));
        return BigDecimal.valueOf(clamped).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    public boolean isSafe(double confidence) {
        return confidence > properties.getSafeThreshold();
    }

    public boolean needsReview(double confidence) {
        return confidence > properties.getReviewThreshold() && confidence <= properties.getSafeThreshold();
    }

    private boolean isContentRich(String sender) {
        String domain = SenderAddresses.domain(sender);
        return properties.getContentRichDomains().stream().anyMatch(domain::equalsIgnoreCase);
    }
}
