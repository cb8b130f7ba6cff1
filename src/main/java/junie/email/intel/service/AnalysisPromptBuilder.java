package junie.email.intel.service;

import junie.email.intel.entity.EmailRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class AnalysisPromptBuilder {
    private static final int MAX_BODY_CHARS = 2000;

    public String build(EmailRecord email) {
        List<String> flags = new ArrayList<>();
        if (email.isImportant()) {
            flags.add("Important");
        }
        if (email.isStarred()) {
            flags.add("Starred");
        }
        if (email.isUnread()) {
            flags.add("Unread");
        }
        String body = email.getBody() == null ? "" : email.getBody();

        return String.format(
                "Analyze this email and rate its priority from 1 to 10 (1=lowest, 10=highest).\n" +
                "Consider urgency, importance, and required action.\n\n" +
                "From: %s\nSubject: %s\nPreview: %s\nFlags: %s\n\nBody:\n%s\n\n" +
                "Return a JSON object with:\n" +
                "- category: one of work, personal, finance, marketing, newsletter, social, automated\n" +
                "- priority: number between 1-10\n" +
                "- summary: one or two sentences\n" +
                "- action_items: array of short strings, empty if none\n" +
                "- confidence: number between 0 and 1",
                email.getSenderEmail(),
                nullToEmpty(email.getSubject()),
                nullToEmpty(email.getSnippet()),
                flags.isEmpty() ? "None" : String.join(", ", flags),
                body.length() > MAX_BODY_CHARS ? body.substring(0, MAX_BODY_CHARS) + "..." : body);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
