package junie.email.intel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Keyword and signal lists behind the rule-based factors.
 * All entries are matched case-insensitively.
 */
@Data
@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {
    private int baseScore = 30;

    private List<String> urgentKeywords = new ArrayList<>(List.of(
            "urgent", "asap", "immediately", "deadline", "overdue", "critical", "action required"));

    private List<String> promotionalKeywords = new ArrayList<>(List.of(
            "percent off", "% off", "sale", "deal", "limited time", "coupon", "promo", "promotion",
            "offer", "clearance", "flash sale"));

    private List<String> unsubscribeMarkers = new ArrayList<>(List.of(
            "unsubscribe", "opt out", "opt-out", "manage preferences", "email preferences"));

    private List<String> promotionalLabels = new ArrayList<>(List.of(
            "CATEGORY_PROMOTIONS", "CATEGORY_SOCIAL", "CATEGORY_FORUMS", "PROMOTIONS"));

    /** Matched against the local part of the sender address. */
    private List<String> marketingSenderPrefixes = new ArrayList<>(List.of(
            "newsletter", "marketing", "promo", "deals", "offers", "news", "updates"));

    private List<String> marketingDomains = new ArrayList<>(List.of(
            "mailchimp.com", "sendgrid.net", "mailgun.org", "constantcontact.com", "hubspot.com"));

    private List<String> actionPhrases = new ArrayList<>(List.of(
            "please review", "please confirm", "can you", "could you", "let me know",
            "need your", "waiting for your", "respond by", "sign off"));

    private List<String> meetingKeywords = new ArrayList<>(List.of(
            "meeting", "call", "invoice", "contract", "agreement", "calendar", "schedule"));

    private int longBodyChars = 5000;

    private List<String> newsletterIndicators = new ArrayList<>(List.of(
            "newsletter", "digest", "weekly", "edition", "issue #", "roundup"));

    private List<String> socialDomains = new ArrayList<>(List.of(
            "facebookmail.com", "linkedin.com", "twitter.com", "x.com", "instagram.com", "reddit.com"));

    private List<String> automatedSenderPrefixes = new ArrayList<>(List.of(
            "noreply", "no-reply", "donotreply", "do-not-reply", "notifications", "alerts", "mailer-daemon"));
}
