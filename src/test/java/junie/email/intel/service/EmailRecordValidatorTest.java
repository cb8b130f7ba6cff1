package junie.email.intel.service;

import junie.email.intel.model.EmailRecordInput;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class EmailRecordValidatorTest {

    private static final Instant NOW = Instant.parse("2024-03-11T10:00:00Z");

    private final EmailRecordValidator validator = new EmailRecordValidator(Clock.fixed(NOW, ZoneOffset.UTC));

    private static EmailRecordInput.EmailRecordInputBuilder valid() {
        return EmailRecordInput.builder()
                .providerMessageId("m1")
                .senderEmail("Alice <alice@example.com>")
                .subject("Hello")
                .receivedAt(NOW.minus(Duration.ofHours(1)));
    }

    @Test
    void validate_WithCompleteRecord_ShouldPass() {
        assertDoesNotThrow(() -> validator.validate(valid().build()));
    }

    @Test
    void validate_WithMissingFields_ShouldThrow() {
        assertThrows(InvalidEmailRecordException.class, () -> validator.validate(null));
        assertThrows(InvalidEmailRecordException.class, () -> validator.validate(valid().providerMessageId(" ").build()));
        assertThrows(InvalidEmailRecordException.class, () -> validator.validate(valid().senderEmail(null).build()));
        assertThrows(InvalidEmailRecordException.class, () -> validator.validate(valid().receivedAt(null).build()));
    }

    @Test
    void validate_WithMalformedSender_ShouldThrow() {
        InvalidEmailRecordException e = assertThrows(InvalidEmailRecordException.class,
                () -> validator.validate(valid().senderEmail("alice at example").build()));
        assertTrue(e.getMessage().contains("alice at example"));
    }

    @Test
    void validate_WithReceivedAtFarInFuture_ShouldThrow() {
        assertDoesNotThrow(() -> validator.validate(valid().receivedAt(NOW.plus(Duration.ofHours(23))).build()));
        assertThrows(InvalidEmailRecordException.class,
                () -> validator.validate(valid().receivedAt(NOW.plus(Duration.ofDays(2))).build()));
    }

    @Test
    void validate_WithOversizedSubject_ShouldThrow() {
        assertThrows(InvalidEmailRecordException.class,
                () -> validator.validate(valid().subject("x".repeat(1001)).build()));
    }
}
