package junie.email.intel.entity;

public enum UserActionType {
    STAR(Feedback.POSITIVE),
    REPLY(Feedback.POSITIVE),
    MARK_IMPORTANT(Feedback.POSITIVE),
    ARCHIVE(Feedback.NEGATIVE),
    DELETE(Feedback.NEGATIVE),
    MARK_READ(Feedback.NEUTRAL),
    MARK_UNREAD(Feedback.NEGATIVE),
    VIP_ON(Feedback.POSITIVE),
    VIP_OFF(Feedback.NEGATIVE),
    CATEGORY_CORRECTION(Feedback.NEUTRAL),
    // Taken from a weekly digest against a sender rather than a single email
    UNSUBSCRIBE(Feedback.NEGATIVE),
    KEEP(Feedback.POSITIVE);

    private final Feedback feedback;

    UserActionType(Feedback feedback) {
        this.feedback = feedback;
    }

    public Feedback feedback() {
        return feedback;
    }

    public enum Feedback {
        POSITIVE,
        NEGATIVE,
        NEUTRAL
    }
}
