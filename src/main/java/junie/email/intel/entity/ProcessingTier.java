package junie.email.intel.entity;

public enum ProcessingTier {
    HIGH,
    MEDIUM,
    LOW
}
