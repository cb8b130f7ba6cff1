package junie.email.intel.entity;

public enum PatternType {
    SENDER,
    SUBJECT,
    CONTENT,
    DOMAIN
}
