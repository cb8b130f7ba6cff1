package junie.email.intel.entity;

public enum DigestStatus {
    GENERATED,
    /** Some records could not be aggregated; see the content failures. */
    PARTIAL
}
