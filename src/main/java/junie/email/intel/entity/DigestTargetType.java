package junie.email.intel.entity;

public enum DigestTargetType {
    SENDER,
    DOMAIN,
    CATEGORY
}
