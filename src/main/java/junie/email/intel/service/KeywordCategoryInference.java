package junie.email.intel.service;

import junie.email.intel.config.ScoringProperties;
import junie.email.intel.entity.EmailRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Default category heuristic over sender address, labels and subject keywords.
 * Checks run from the most to the least specific category.
 */
@Component
public class KeywordCategoryInference implements CategoryInferenceStrategy {
    private final ScoringProperties properties;

    public KeywordCategoryInference(ScoringProperties properties) {
        this.properties = properties;
    }

    @Override
    public String inferCategory(EmailRecord email) {
        String sender = SenderAddresses.normalize(email.getSenderEmail());
        String domain = SenderAddresses.domain(sender);
        String localPart = SenderAddresses.localPart(sender);
        String subject = lower(email.getSubject());
        String snippet = lower(email.getSnippet());

        if (properties.getSocialDomains().contains(domain) || hasLabel(email, "CATEGORY_SOCIAL")) {
            return SOCIAL;
        }
        if (containsAny(localPart, properties.getNewsletterIndicators())
                || containsAny(subject, properties.getNewsletterIndicators())) {
            return NEWSLETTER;
        }
        if (hasLabel(email, "CATEGORY_PROMOTIONS")
                || properties.getMarketingDomains().contains(domain)
                || startsWithAny(localPart, properties.getMarketingSenderPrefixes())
                || containsAny(subject + " " + snippet, properties.getPromotionalKeywords())) {
            return MARKETING;
        }
        if (startsWithAny(localPart, properties.getAutomatedSenderPrefixes())
                || hasLabel(email, "CATEGORY_UPDATES")) {
            return AUTOMATED;
        }
        return PERSONAL;
    }

    private static boolean hasLabel(EmailRecord email, String label) {
        return email.getLabels() != null && email.getLabels().stream().anyMatch(label::equalsIgnoreCase);
    }

    static boolean containsAny(String text, List<String> needles) {
        for (String needle : needles) {
            if (text.contains(needle.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    static boolean startsWithAny(String text, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (text.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
