package junie.email.intel.service;

import junie.email.intel.model.EmailRecordInput;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Structural checks on inbound records before they are stored or scored.
 */
@Component
public class EmailRecordValidator {
    private static final Pattern ADDRESS = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    // Provider clocks drift; anything further ahead than this is rejected
    private static final Duration MAX_CLOCK_SKEW = Duration.ofDays(1);
    private static final int MAX_SUBJECT_LENGTH = 1000;

    private final Clock clock;

    public EmailRecordValidator(Clock clock) {
        this.clock = clock;
    }

    public void validate(EmailRecordInput input) {
        if (input == null) {
            throw new InvalidEmailRecordException("Email record is required");
        }
        if (isBlank(input.getProviderMessageId())) {
            throw new InvalidEmailRecordException("providerMessageId is required");
        }
        if (isBlank(input.getSenderEmail())) {
            throw new InvalidEmailRecordException("senderEmail is required");
        }
        String sender = SenderAddresses.normalize(input.getSenderEmail());
        if (!ADDRESS.matcher(sender).matches()) {
            throw new InvalidEmailRecordException("senderEmail is not a valid address: " + input.getSenderEmail());
        }
        if (input.getReceivedAt() == null) {
            throw new InvalidEmailRecordException("receivedAt is required");
        }
        if (input.getReceivedAt().isAfter(Instant.now(clock).plus(MAX_CLOCK_SKEW))) {
            throw new InvalidEmailRecordException("receivedAt lies in the future: " + input.getReceivedAt());
        }
        if (input.getSubject() != null && input.getSubject().length() > MAX_SUBJECT_LENGTH) {
            throw new InvalidEmailRecordException("subject exceeds " + MAX_SUBJECT_LENGTH + " characters");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
