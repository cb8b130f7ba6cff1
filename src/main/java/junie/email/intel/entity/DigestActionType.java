package junie.email.intel.entity;

public enum DigestActionType {
    UNSUBSCRIBE,
    KEEP,
    ARCHIVE,
    MARK_READ
}
